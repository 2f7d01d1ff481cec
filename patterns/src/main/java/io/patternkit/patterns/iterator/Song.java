package io.patternkit.patterns.iterator;

import java.util.Objects;

public record Song(String title) {
    public Song {
        Objects.requireNonNull(title, "title");
    }
}
