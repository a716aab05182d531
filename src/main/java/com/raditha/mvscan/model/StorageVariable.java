package com.raditha.mvscan.model;

import com.raditha.mvscan.frontend.StateVariableModel;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A named persistent slot of a declaring contract.
 * Two storage variables are equal when contract and name agree.
 *
 * @param contract  Declaring contract
 * @param name      Variable name
 * @param type      Declared type text
 * @param constant  Declared constant
 * @param immutable Declared immutable
 * @param slot      Front-end provided slot, if any
 */
public record StorageVariable(
        String contract,
        String name,
        String type,
        boolean constant,
        boolean immutable,
        @Nullable Integer slot) implements StateVar {

    public StorageVariable {
        if (contract == null || name == null) {
            throw new IllegalArgumentException("contract and name are required");
        }
        if (type == null) {
            type = "";
        }
    }

    public static StorageVariable of(String contract, String name) {
        return new StorageVariable(contract, name, "", false, false, null);
    }

    public static StorageVariable from(String contract, StateVariableModel model) {
        return new StorageVariable(contract, model.name(), model.type(),
                model.constant(), model.immutable(), model.slot());
    }

    @Override
    public VariableKind kind() {
        return VariableKind.STATE;
    }

    @Override
    public String declaringContract() {
        return contract;
    }

    @Override
    public String identity() {
        return "SV:" + contract + "." + name;
    }

    /**
     * Constants, immutables and {@code bytes32 *_ROLE} identifiers never race.
     */
    public boolean isInert() {
        return constant || immutable || ("bytes32".equals(type) && name.endsWith("_ROLE"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof StorageVariable other
                && contract.equals(other.contract)
                && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contract, name);
    }

    @Override
    public String toString() {
        return contract + "." + name;
    }
}
