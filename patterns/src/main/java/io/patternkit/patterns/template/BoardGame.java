package io.patternkit.patterns.template;

public interface BoardGame {
    void play();
}
