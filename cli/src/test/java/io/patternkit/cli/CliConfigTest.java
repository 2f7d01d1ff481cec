package io.patternkit.cli;

import io.patternkit.core.Operator;
import io.patternkit.core.RedoTailPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @Test
    void parses_flags_and_steps_in_order() {
        var cfg = CliConfig.fromArgs(new String[]{
                "-t", "retain", "-s", "x.json",
                "compute", "*", "10", "undo", "2", "redo", "1", "value"});

        assertEquals(RedoTailPolicy.RETAIN, cfg.redoTailPolicy());
        assertEquals("x.json", cfg.scriptPath());
        assertFalse(cfg.help());
        assertEquals(List.of(
                new Step.Compute(Operator.ASTERISK, 10),
                new Step.Undo(2),
                new Step.Redo(1),
                new Step.Value()
        ), cfg.steps());
    }

    @Test
    void defaults_when_nothing_given() {
        var cfg = CliConfig.fromArgs(new String[0]);
        assertNull(cfg.redoTailPolicy());
        assertNull(cfg.scriptPath());
        assertTrue(cfg.steps().isEmpty());
    }

    @Test
    void rejects_unknown_arguments_and_truncated_compute() {
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"frobnicate"}));
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"compute", "+"}));
        assertThrows(CliException.class, () -> CliConfig.fromArgs(new String[]{"compute", "+", "1.5"}));
    }

    @Test
    void redo_tail_policy_is_case_insensitive_and_validated() {
        assertEquals(RedoTailPolicy.DISCARD, CliConfig.parsePolicy("discard"));
        assertEquals(RedoTailPolicy.RETAIN, CliConfig.parsePolicy(" Retain "));
        assertThrows(CliException.class, () -> CliConfig.parsePolicy("sometimes"));
    }
}
