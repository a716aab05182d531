package com.raditha.mvscan.frontend;

/**
 * Kind of a control-flow node as classified by the front-end.
 */
public enum NodeKind {
    /** Synthetic entry node of a function */
    ENTRY_POINT,

    /** Conditional branch ({@code if}, loop condition) */
    IF,

    /** {@code require(...)} guard */
    REQUIRE,

    /** {@code assert(...)} guard */
    ASSERT,

    /** {@code revert(...)} statement */
    REVERT,

    /** {@code return} statement */
    RETURN,

    /** Plain expression statement */
    EXPRESSION,

    /** Anything else (loop headers, placeholders, inline assembly) */
    OTHER;

    /**
     * Branching predicates are the nodes whose outcome can alter control flow.
     */
    public boolean isBranch() {
        return this == IF || this == REQUIRE || this == ASSERT || this == REVERT;
    }
}
