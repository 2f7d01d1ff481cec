// file: src/main/java/io/patternkit/core/AccumulatorListener.java
package io.patternkit.core;

/**
 * Hook notified after every successful {@link Accumulator#apply(Operator, long)}.
 * <p>
 * Purely diagnostic: nothing in the undo/redo machinery depends on what a
 * listener does. An exception thrown by a listener is logged by the
 * accumulator and does not undo the operation.
 */
@FunctionalInterface
public interface AccumulatorListener {

    /**
     * Called once per applied operation.
     *
     * @param operator operator that was applied
     * @param operand  operand it was applied with
     * @param result   accumulator value after the operation
     */
    void applied(Operator operator, long operand, long result);

    /** Listener that ignores every notification. */
    static AccumulatorListener none() {
        return (operator, operand, result) -> { };
    }

    /** Default listener: one INFO line per operation via java.util.logging. */
    static AccumulatorListener logging() {
        return LoggingAccumulatorListener.INSTANCE;
    }
}
