package com.raditha.mvscan.frontend;

import org.jspecify.annotations.Nullable;

/**
 * A declared state variable.
 *
 * @param name      Variable name
 * @param type      Declared type as text (e.g. {@code mapping(address => uint256)})
 * @param constant  Declared {@code constant}
 * @param immutable Declared {@code immutable}
 * @param slot      Storage slot when the front-end already knows it, otherwise null
 */
public record StateVariableModel(
        String name,
        String type,
        boolean constant,
        boolean immutable,
        @Nullable Integer slot) {

    public StateVariableModel {
        if (type == null) {
            type = "";
        }
    }

    public static StateVariableModel of(String name, String type) {
        return new StateVariableModel(name, type, false, false, null);
    }
}
