package io.patternkit.patterns.template;

import java.util.logging.Logger;

public final class Monopoly implements BoardGamePhases {
    private static final Logger log = Logger.getLogger(Monopoly.class.getName());

    @Override
    public void initialize() {
        log.info("Monopoly initialize() executed");
    }

    @Override
    public void start() {
        log.info("Monopoly start() executed");
    }
}
