package me.christianrobert.cnxpretext.transformer.builder.math;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Number of positional operand children a MathML construct consumes.
 *
 * <p>A node with fewer children than its arity requires is rendered with empty
 * operands for the missing positions; extra children are ignored.</p>
 */
public enum ArityClass {
    NULLARY(0),
    UNARY(1),
    BINARY(2),
    TERNARY(3),
    /** Rows, fences, tables and unknown tags: all children, in order. */
    VARIADIC(-1);

    private static final Map<String, ArityClass> BY_TAG = Map.ofEntries(
            entry("mi", NULLARY),
            entry("mn", NULLARY),
            entry("mo", NULLARY),
            entry("mtext", NULLARY),
            entry("ms", NULLARY),
            entry("mspace", NULLARY),
            entry("msqrt", UNARY),
            entry("mfrac", BINARY),
            entry("mroot", BINARY),
            entry("msub", BINARY),
            entry("msup", BINARY),
            entry("mover", BINARY),
            entry("munder", BINARY),
            entry("msubsup", TERNARY),
            entry("munderover", TERNARY)
    );

    private final int operandCount;

    ArityClass(int operandCount) {
        this.operandCount = operandCount;
    }

    public int getOperandCount() {
        return operandCount;
    }

    public boolean isPositional() {
        return operandCount > 0;
    }

    public static ArityClass of(String tag) {
        return BY_TAG.getOrDefault(tag, VARIADIC);
    }
}
