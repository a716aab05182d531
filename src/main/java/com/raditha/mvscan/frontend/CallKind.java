package com.raditha.mvscan.frontend;

/**
 * Kind of a call operation in the IR.
 */
public enum CallKind {
    /** Message call to another contract (or to {@code this} through the ABI) */
    HIGH_LEVEL,

    /** Jump to a function of the same contract or one of its bases */
    INTERNAL,

    /** {@code call}, {@code delegatecall}, {@code staticcall} on a raw address */
    LOW_LEVEL
}
