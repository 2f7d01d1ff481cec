// file: cli/src/main/java/io/patternkit/cli/Step.java
package io.patternkit.cli;

import io.patternkit.core.CommandHistory;
import io.patternkit.core.Operator;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * One action the CLI runs against a {@link CommandHistory}.
 * <p>
 *  - Compute: issue a new command.
 *  - Undo / Redo: move the cursor by up to {@code levels} commands.
 *  - Value: print the current value.
 */
sealed interface Step permits Step.Compute, Step.Undo, Step.Redo, Step.Value {

    void applyTo(CommandHistory history, PrintStream out);

    record Compute(Operator operator, long operand) implements Step {
        public Compute {
            Objects.requireNonNull(operator, "operator");
        }

        @Override public void applyTo(CommandHistory history, PrintStream out) {
            history.compute(operator, operand);
        }
    }

    record Undo(int levels) implements Step {
        @Override public void applyTo(CommandHistory history, PrintStream out) {
            history.undo(levels);
        }
    }

    record Redo(int levels) implements Step {
        @Override public void applyTo(CommandHistory history, PrintStream out) {
            history.redo(levels);
        }
    }

    record Value() implements Step {
        @Override public void applyTo(CommandHistory history, PrintStream out) {
            out.println(history.value());
        }
    }

    /** Build a compute step from raw operator/operand text. */
    static Step compute(String operator, String operand) {
        try {
            return new Compute(Operator.fromSymbol(operator), parseLong(operand, "operand"));
        } catch (IllegalArgumentException e) {
            throw new CliException(e.getMessage(), e);
        }
    }

    /** Build an undo/redo step from its action name and raw level count. */
    static Step move(String action, String levels) {
        int n = parseInt(levels, "levels");
        return switch (action.toLowerCase(Locale.ROOT)) {
            case "undo" -> new Undo(n);
            case "redo" -> new Redo(n);
            default -> throw new CliException("unknown action: " + action);
        };
    }

    private static int parseInt(String text, String what) {
        if (text == null) {
            throw new CliException("missing " + what);
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new CliException("invalid " + what + ": " + text);
        }
    }

    private static long parseLong(String text, String what) {
        if (text == null) {
            throw new CliException("missing " + what);
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new CliException("invalid " + what + ": " + text);
        }
    }
}
