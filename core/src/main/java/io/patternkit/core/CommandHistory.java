// file: src/main/java/io/patternkit/core/CommandHistory.java
package io.patternkit.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Linear undo/redo history over a single {@link Accumulator}.
 * <p>
 * State is {@code (commands, cursor)} with {@code 0 <= cursor <= commands.size()}:
 *  - commands[0 .. cursor)  are applied (reflected in the accumulator),
 *  - commands[cursor .. )   are undone and can be redone.
 * <p>
 * Operations:
 *  - compute(op, operand): build a command, execute it immediately, record it.
 *  - undo(levels):         unexecute up to {@code levels} commands, newest first.
 *  - redo(levels):         re-execute up to {@code levels} undone commands, oldest first.
 * <p>
 * Level counts beyond the available history are clamped silently; zero or
 * negative counts do nothing.
 * <p>
 * Failure atomicity: the cursor only moves after the command ran successfully,
 * so a {@link DivisionByZeroException} leaves history and value unchanged and
 * stops the remaining levels.
 * <p>
 * Not thread safe. Callers sharing an instance must guard the whole object
 * with one lock.
 */
public final class CommandHistory {
    private static final Logger log = Logger.getLogger(CommandHistory.class.getName());

    private final Accumulator accumulator;
    private final List<ReversibleCommand> commands = new ArrayList<>();
    private final RedoTailPolicy redoTailPolicy;
    private int cursor;

    /** Empty history, DISCARD policy, operations logged at INFO. */
    public CommandHistory() {
        this(RedoTailPolicy.DISCARD, AccumulatorListener.logging());
    }

    public CommandHistory(RedoTailPolicy redoTailPolicy, AccumulatorListener listener) {
        this.redoTailPolicy = Objects.requireNonNull(redoTailPolicy, "redoTailPolicy");
        this.accumulator = new Accumulator(listener);
    }

    /**
     * Issue, apply and record a new command.
     *
     * @throws DivisionByZeroException if operator is SLASH and operand is 0;
     *         nothing is recorded in that case
     */
    public void compute(Operator operator, long operand) {
        var command = new ReversibleCommand(accumulator, operator, operand);
        // Execute first so a failure leaves the history untouched.
        command.execute();

        if (cursor < commands.size() && redoTailPolicy == RedoTailPolicy.DISCARD) {
            commands.subList(cursor, commands.size()).clear();
        }
        commands.add(command);
        cursor++;
    }

    /**
     * Undo up to {@code levels} commands, most recently applied first.
     * Stops silently when nothing is left to undo.
     */
    public void undo(int levels) {
        log.info("---- Undo " + levels + " levels");
        for (int i = 0; i < levels && cursor > 0; i++) {
            commands.get(cursor - 1).unexecute();
            cursor--;
        }
    }

    /**
     * Redo up to {@code levels} previously undone commands, oldest first.
     * Stops silently when nothing is left to redo.
     */
    public void redo(int levels) {
        log.info("---- Redo " + levels + " levels");
        for (int i = 0; i < levels && cursor < commands.size(); i++) {
            commands.get(cursor).execute();
            cursor++;
        }
    }

    /** Current accumulator value. */
    public long value() {
        return accumulator.value();
    }

    /** Number of applied commands. */
    public int cursor() {
        return cursor;
    }

    /** Total number of recorded commands, applied and undone. */
    public int size() {
        return commands.size();
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < commands.size();
    }

    public RedoTailPolicy redoTailPolicy() {
        return redoTailPolicy;
    }

    /** Snapshot of all recorded commands in issue order. */
    public List<ReversibleCommand> commands() {
        return List.copyOf(commands);
    }

    @Override
    public String toString() {
        return "CommandHistory{value=" + accumulator.value() +
                ", cursor=" + cursor +
                ", size=" + commands.size() +
                ", redoTailPolicy=" + redoTailPolicy +
                '}';
    }
}
