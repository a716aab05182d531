package com.raditha.mvscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of one finding bucket.
 */
public enum BucketClass {
    /** One non-group variable. */
    SINGLE_VAR_CROSS_TX("single_var_cross_tx"),
    /** Several variables declared by one contract. */
    MULTI_VAR_INTRA_CONTRACT("multi_var_intra_contract"),
    MULTI_VAR_CROSS_CONTRACT("multi_var_cross_contract");

    private final String label;

    BucketClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
