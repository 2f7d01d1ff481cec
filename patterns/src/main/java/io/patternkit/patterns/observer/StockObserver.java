package io.patternkit.patterns.observer;

/** Subscriber to a {@link Product}'s stock flag. */
@FunctionalInterface
public interface StockObserver {
    void onStockChanged(Product product, boolean inStock);
}
