package com.raditha.mvscan.model;

/**
 * One concrete element of a mapping or array, e.g. {@code balances[msg.sender]}.
 *
 * @param collection The collection variable
 * @param key        Canonical key expression
 */
public record SlotInstance(StorageVariable collection, String key) implements StateVar {

    public SlotInstance {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        if (key == null) {
            key = "";
        }
    }

    @Override
    public String name() {
        return collection.name() + "[" + key + "]";
    }

    @Override
    public VariableKind kind() {
        return VariableKind.MAPPING_SLOT;
    }

    @Override
    public String declaringContract() {
        return collection.contract();
    }

    @Override
    public String identity() {
        return collection.identity();
    }

    @Override
    public StateVar base() {
        return collection;
    }

    @Override
    public String toString() {
        return collection.contract() + "." + name();
    }
}
