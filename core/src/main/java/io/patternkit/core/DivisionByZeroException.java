package io.patternkit.core;

/**
 * Raised by {@link Accumulator#apply(Operator, long)} when a SLASH is applied
 * with a zero operand.
 * <p>
 * This can surface from {@link CommandHistory#compute(Operator, long)} and also
 * from {@link CommandHistory#undo(int)}: the inverse of "multiply by 0" is
 * "divide by 0". It is never caught inside the core.
 */
public final class DivisionByZeroException extends ArithmeticException {

    private final long dividend;

    public DivisionByZeroException(long dividend) {
        super("Division by zero (dividend=" + dividend + ")");
        this.dividend = dividend;
    }

    /** Accumulator value at the time of the failed division. */
    public long dividend() {
        return dividend;
    }
}
