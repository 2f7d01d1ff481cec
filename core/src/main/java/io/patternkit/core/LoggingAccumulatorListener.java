package io.patternkit.core;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener behind {@link AccumulatorListener#logging()}: one INFO line per
 * operation, e.g. {@code Current value = 50 (following minus 50)}.
 */
final class LoggingAccumulatorListener implements AccumulatorListener {
    private static final Logger log = Logger.getLogger(Accumulator.class.getName());

    static final LoggingAccumulatorListener INSTANCE = new LoggingAccumulatorListener();

    private LoggingAccumulatorListener() {
        // singleton
    }

    @Override
    public void applied(Operator operator, long operand, long result) {
        if (log.isLoggable(Level.INFO)) {
            log.info(String.format("Current value = %d (following %s %d)",
                    result, operator.name().toLowerCase(Locale.ROOT), operand));
        }
    }
}
