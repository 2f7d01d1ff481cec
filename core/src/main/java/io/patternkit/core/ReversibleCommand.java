// file: src/main/java/io/patternkit/core/ReversibleCommand.java
package io.patternkit.core;

import java.util.Objects;

/**
 * One recorded operator+operand pair bound to the accumulator it acts on.
 * <p>
 * {@link #execute()} applies the operation; {@link #unexecute()} applies the
 * inverse operator with the same operand.
 * <p>
 * The inverse is exact for PLUS, MINUS and ASTERISK (barring overflow).
 * For SLASH it is lossy whenever the original division had a remainder:
 * 7 / 2 = 3, and undoing gives 3 * 2 = 6, not 7. That is the accepted
 * behaviour of integer commands and is kept as-is.
 * <p>
 * Immutable. The accumulator reference is shared, not owned.
 */
public final class ReversibleCommand {

    private final Operator operator;
    private final long operand;
    private final Accumulator target;

    public ReversibleCommand(Accumulator target, Operator operator, long operand) {
        this.target = Objects.requireNonNull(target, "target");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = operand;
    }

    public Operator operator() {
        return operator;
    }

    public long operand() {
        return operand;
    }

    /** Apply the operation. Returns the new accumulator value. */
    public long execute() {
        return target.apply(operator, operand);
    }

    /** Apply the inverse operation. Returns the new accumulator value. */
    public long unexecute() {
        return target.apply(operator.inverse(), operand);
    }

    @Override
    public String toString() {
        return operator + " " + operand;
    }
}
