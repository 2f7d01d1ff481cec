package io.patternkit.patterns.template;

import java.util.logging.Logger;

public final class Battleship implements BoardGamePhases {
    private static final Logger log = Logger.getLogger(Battleship.class.getName());

    @Override
    public void initialize() {
        log.info("Battleship initialize() executed");
    }

    @Override
    public void start() {
        log.info("Battleship start() executed");
    }
}
