package io.patternkit.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReversibleCommandTest {

    @Test
    void unexecute_reverts_exact_operations() {
        var acc = new Accumulator();
        acc.apply(Operator.PLUS, 9);

        for (Operator op : new Operator[]{Operator.PLUS, Operator.MINUS, Operator.ASTERISK}) {
            var cmd = new ReversibleCommand(acc, op, 4);
            cmd.execute();
            cmd.unexecute();
            assertEquals(9, acc.value(), "op=" + op.name());
        }
    }

    @Test
    void divide_inverse_is_lossy_when_there_is_a_remainder() {
        var acc = new Accumulator();
        acc.apply(Operator.PLUS, 7);

        var cmd = new ReversibleCommand(acc, Operator.SLASH, 2);
        assertEquals(3, cmd.execute());
        assertEquals(6, cmd.unexecute());
    }

    @Test
    void undoing_multiply_by_zero_is_a_division_by_zero() {
        var acc = new Accumulator();
        acc.apply(Operator.PLUS, 5);

        var cmd = new ReversibleCommand(acc, Operator.ASTERISK, 0);
        assertEquals(0, cmd.execute());
        assertThrows(DivisionByZeroException.class, cmd::unexecute);
        assertEquals(0, acc.value());
    }

    @Test
    void renders_operator_and_operand() {
        var cmd = new ReversibleCommand(new Accumulator(), Operator.MINUS, 50);
        assertEquals("- 50", cmd.toString());
        assertEquals(Operator.MINUS, cmd.operator());
        assertEquals(50, cmd.operand());
    }
}
