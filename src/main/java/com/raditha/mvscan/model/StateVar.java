package com.raditha.mvscan.model;

import org.jspecify.annotations.Nullable;

/**
 * A logical variable tracked by the state dependency graph.
 * <p>
 * All variants are value types: equality is semantic, so every map of the
 * analysis can key off them directly.
 */
public sealed interface StateVar permits StorageVariable, SlotInstance, ExternalStateProxy, VariableGroup {

    /**
     * Human readable name.
     */
    String name();

    VariableKind kind();

    /**
     * Declaring contract, null for external proxies and groups.
     */
    @Nullable
    String declaringContract();

    /**
     * Identity used by coarse deduplication. Slots collapse onto their base.
     */
    String identity();

    /**
     * The variable itself, or the collection a slot belongs to.
     */
    default StateVar base() {
        return this;
    }
}
