package io.patternkit.patterns.observer;

import java.util.logging.Logger;

/** Observer that logs availability changes and remembers the last one. */
public final class User implements StockObserver {
    private static final Logger log = Logger.getLogger(User.class.getName());

    private final String name;
    private Boolean lastSeen;
    private int notifications;

    public User(String name) {
        this.name = name;
    }

    @Override
    public void onStockChanged(Product product, boolean inStock) {
        lastSeen = inStock;
        notifications++;
        log.info(() -> name + ": Is product available? " + inStock);
    }

    /** Last flag received, or null before the first notification. */
    public Boolean lastSeen() {
        return lastSeen;
    }

    public int notifications() {
        return notifications;
    }
}
