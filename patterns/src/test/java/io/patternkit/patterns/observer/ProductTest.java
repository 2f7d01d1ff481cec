package io.patternkit.patterns.observer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProductTest {

    @Test
    void all_attached_users_are_notified() {
        var foo = new User("foo");
        var bar = new User("bar");
        var shorts = new Product();
        shorts.attach(foo);
        shorts.attach(bar);

        shorts.setInStock(true);

        assertEquals(Boolean.TRUE, foo.lastSeen());
        assertEquals(Boolean.TRUE, bar.lastSeen());
        assertEquals(1, foo.notifications());
    }

    @Test
    void notification_order_follows_attach_order() {
        var order = new ArrayList<String>();
        var product = new Product();
        product.attach((p, s) -> order.add("first"));
        product.attach((p, s) -> order.add("second"));

        product.setInStock(false);

        assertEquals(List.of("first", "second"), order);
    }

    @Test
    void detached_observer_is_not_notified_and_unknown_detach_is_ignored() {
        var foo = new User("foo");
        var product = new Product();
        product.attach(foo);
        product.detach(foo);
        product.detach(new User("stranger"));

        product.setInStock(true);

        assertNull(foo.lastSeen());
        assertEquals(0, product.observerCount());
    }

    @Test
    void observer_can_detach_itself_during_notification() {
        var product = new Product();
        var calls = new int[1];
        StockObserver once = new StockObserver() {
            @Override
            public void onStockChanged(Product p, boolean inStock) {
                calls[0]++;
                p.detach(this);
            }
        };
        product.attach(once);

        product.setInStock(true);
        product.setInStock(false);

        assertEquals(1, calls[0]);
    }

    @Test
    void products_have_distinct_ids() {
        assertNotEquals(new Product().id(), new Product().id());
    }
}
