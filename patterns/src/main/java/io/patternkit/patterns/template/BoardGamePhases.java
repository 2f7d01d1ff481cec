package io.patternkit.patterns.template;

/**
 * Game-specific steps plugged into {@link BoardGameController}'s fixed
 * {@code play()} skeleton.
 */
public interface BoardGamePhases {
    void initialize();

    void start();
}
