package io.patternkit.patterns.immutable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImmutablePersonTest {

    @Test
    void uppercased_does_not_mutate() {
        var person = new ImmutablePerson("Foo");
        assertEquals("FOO", person.uppercased());
        assertEquals("Foo", person.name());
    }

    @Test
    void with_name_returns_new_instance() {
        var foo = new ImmutablePerson("Foo");
        var bar = foo.withName("Bar");

        assertNotSame(foo, bar);
        assertEquals("Foo", foo.name());
        assertEquals("Bar", bar.name());
        assertEquals(new ImmutablePerson("Bar"), bar);
    }

    @Test
    void null_name_rejected() {
        assertThrows(NullPointerException.class, () -> new ImmutablePerson(null));
    }
}
