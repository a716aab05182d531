package com.raditha.mvscan.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Shape of a finding: whether the participating entries share a callee and
 * whether they can reenter each other.
 */
@JsonPropertyOrder({"shared_callee", "reentrant"})
public record ShapeTags(
        @JsonProperty("shared_callee") boolean sharedCallee,
        @JsonProperty("reentrant") boolean reentrant) {

    public static final ShapeTags NONE = new ShapeTags(false, false);

    public ShapeTags merge(ShapeTags other) {
        return new ShapeTags(sharedCallee || other.sharedCallee, reentrant || other.reentrant);
    }
}
