package com.raditha.mvscan.model;

import org.jspecify.annotations.Nullable;

/**
 * Pseudo-state standing for state held by another contract and observed or
 * mutated through a call, e.g. {@code token.balanceof}.
 *
 * @param address  Canonical callee address expression
 * @param selector Lower-cased method selector name
 */
public record ExternalStateProxy(String address, String selector) implements StateVar {

    public ExternalStateProxy {
        address = address == null || address.isBlank() ? "unknown" : address.toLowerCase();
        selector = selector == null ? "" : selector.toLowerCase();
    }

    @Override
    public String name() {
        return address + "." + selector;
    }

    @Override
    public VariableKind kind() {
        return VariableKind.EXTERNAL;
    }

    @Override
    public @Nullable String declaringContract() {
        return null;
    }

    @Override
    public String identity() {
        return "SV:" + name();
    }

    @Override
    public String toString() {
        return "EXT::" + address + "::" + selector;
    }
}
