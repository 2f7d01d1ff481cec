package io.patternkit.patterns.immutable;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable value object: state is fixed at construction, "modifiers"
 * return new instances.
 */
public final class ImmutablePerson {

    private final String name;

    public ImmutablePerson(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /** Upper-cased name. The instance itself is unchanged. */
    public String uppercased() {
        return name.toUpperCase(Locale.ROOT);
    }

    /** Copy of this person with a different name. */
    public ImmutablePerson withName(String newName) {
        return new ImmutablePerson(newName);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImmutablePerson p)) return false;
        return name.equals(p.name);
    }

    @Override public int hashCode() { return name.hashCode(); }

    @Override public String toString() { return "ImmutablePerson{name=" + name + '}'; }
}
