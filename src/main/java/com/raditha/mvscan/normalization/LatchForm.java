package com.raditha.mvscan.normalization;

/**
 * Syntactic form of a pre-initialization latch predicate.
 */
public enum LatchForm {
    /** {@code !L} */
    BOOL,
    /** {@code L == c} */
    EQ,
    /** {@code (L & C) == 0} */
    MASK_ZERO,
    /** {@code _initialized < k} */
    VERSION_LT
}
