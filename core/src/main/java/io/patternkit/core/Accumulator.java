// file: src/main/java/io/patternkit/core/Accumulator.java
package io.patternkit.core;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single mutable integer register that commands are applied to.
 * <p>
 * Semantics:
 *  - Starts at 0.
 *  - The value only changes through {@link #apply(Operator, long)}.
 *  - Arithmetic is plain Java {@code long} arithmetic: overflow wraps and
 *    division truncates toward zero.
 *  - Dividing by zero raises {@link DivisionByZeroException} and leaves the
 *    value untouched.
 *  - A listener that throws is logged at WARNING and otherwise ignored, so the
 *    applied operation always stands.
 * <p>
 * There is no undo logic here. Reversal is the job of {@link ReversibleCommand}.
 * Not thread safe; owned by exactly one {@link CommandHistory}.
 */
public final class Accumulator {
    private static final Logger log = Logger.getLogger(Accumulator.class.getName());

    private final AccumulatorListener listener;
    private long value;

    public Accumulator() {
        this(AccumulatorListener.none());
    }

    public Accumulator(AccumulatorListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** Current value. */
    public long value() {
        return value;
    }

    /**
     * Apply {@code value = value <operator> operand} in place.
     *
     * @return the new value
     * @throws DivisionByZeroException if operator is SLASH and operand is 0
     */
    public long apply(Operator operator, long operand) {
        Objects.requireNonNull(operator, "operator");
        long next = switch (operator) {
            case PLUS -> value + operand;
            case MINUS -> value - operand;
            case ASTERISK -> value * operand;
            case SLASH -> {
                if (operand == 0) throw new DivisionByZeroException(value);
                yield value / operand;
            }
        };
        value = next;
        try {
            listener.applied(operator, operand, next);
        } catch (RuntimeException e) {
            // The value has already changed; the listener cannot veto it.
            log.log(Level.WARNING, "Listener failed after " + operator.name() + " " + operand, e);
        }
        return next;
    }

    @Override
    public String toString() {
        return "Accumulator{value=" + value + '}';
    }
}
