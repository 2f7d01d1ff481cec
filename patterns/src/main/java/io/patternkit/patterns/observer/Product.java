// file: src/main/java/io/patternkit/patterns/observer/Product.java
package io.patternkit.patterns.observer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Observable product: every assignment to the stock flag is pushed to all
 * attached observers, in attach order.
 * <p>
 * Observers are compared by identity. Attaching the same observer twice
 * notifies it twice; detach removes one attachment.
 */
public final class Product {

    private final String id = UUID.randomUUID().toString();
    private final List<StockObserver> observers = new ArrayList<>();
    private boolean inStock;

    public String id() {
        return id;
    }

    public boolean inStock() {
        return inStock;
    }

    /** Set the flag and notify observers, even if the value did not change. */
    public void setInStock(boolean inStock) {
        this.inStock = inStock;
        notifyObservers();
    }

    public void attach(StockObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    /** Remove one attachment of {@code observer}. Unknown observers are ignored. */
    public void detach(StockObserver observer) {
        for (int i = 0; i < observers.size(); i++) {
            if (observers.get(i) == observer) {
                observers.remove(i);
                return;
            }
        }
    }

    public int observerCount() {
        return observers.size();
    }

    public void notifyObservers() {
        // Copy so observers may detach themselves while being notified.
        for (StockObserver o : List.copyOf(observers)) {
            o.onStockChanged(this, inStock);
        }
    }
}
