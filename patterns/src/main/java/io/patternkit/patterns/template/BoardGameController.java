// file: src/main/java/io/patternkit/patterns/template/BoardGameController.java
package io.patternkit.patterns.template;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Template method through delegation instead of inheritance.
 * <p>
 * {@link #play()} always runs: openBox (shared) -> initialize -> start
 * (both supplied by the {@link BoardGamePhases} delegate).
 */
public class BoardGameController implements BoardGame {
    private static final Logger log = Logger.getLogger(BoardGameController.class.getName());

    private final BoardGamePhases phases;

    public BoardGameController(BoardGamePhases phases) {
        this.phases = Objects.requireNonNull(phases, "phases");
    }

    private void openBox() {
        log.info("BoardGameController openBox() executed");
    }

    @Override
    public final void play() {
        openBox();
        phases.initialize();
        phases.start();
    }
}
