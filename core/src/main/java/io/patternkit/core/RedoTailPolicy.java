package io.patternkit.core;

/**
 * What {@link CommandHistory#compute(Operator, long)} does with commands that
 * were undone but not redone (the "redo tail") when a new command is issued.
 */
public enum RedoTailPolicy {
    /** Drop the redo tail before appending. Standard undo/redo behaviour. */
    DISCARD,

    /**
     * Keep the redo tail and append after it. A later redo can then replay
     * stale commands. Only useful to reproduce legacy histories.
     */
    RETAIN
}
