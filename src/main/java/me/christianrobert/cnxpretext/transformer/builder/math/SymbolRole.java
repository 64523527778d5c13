package me.christianrobert.cnxpretext.transformer.builder.math;

/**
 * Positional role of a symbol inside an expression, used as the second half of
 * the {@link SymbolTable} lookup key.
 */
public enum SymbolRole {
    /** Identifiers, numbers and anything without a more specific role. */
    DEFAULT,
    /** Content of an operator token. */
    OPERATOR,
    /** Base operand of an under/over construct, where Σ means a summation and not the letter. */
    LIMIT_BASE
}
