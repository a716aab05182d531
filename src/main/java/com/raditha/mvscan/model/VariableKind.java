package com.raditha.mvscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a tracked variable as reported in findings.
 */
public enum VariableKind {
    STATE("state"),
    MAPPING_SLOT("mapping_slot"),
    EXTERNAL("external"),
    MULTI_VAR_GROUP("multi_var_group");

    private final String label;

    VariableKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
