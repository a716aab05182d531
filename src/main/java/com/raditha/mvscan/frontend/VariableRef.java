package com.raditha.mvscan.frontend;

import org.jspecify.annotations.Nullable;

/**
 * A reference from an IR node to persistent storage.
 * A plain reference names a state variable; an indexed reference additionally
 * carries the key expression of one mapping or array element.
 *
 * @param contract Declaring contract of the state variable
 * @param name     State variable name
 * @param key      Index expression text, or null for a plain reference
 */
public record VariableRef(
        String contract,
        String name,
        @Nullable String key) {

    public static VariableRef of(String contract, String name) {
        return new VariableRef(contract, name, null);
    }

    public static VariableRef indexed(String contract, String name, String key) {
        return new VariableRef(contract, name, key);
    }

    public boolean isIndexed() {
        return key != null;
    }
}
