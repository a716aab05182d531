package com.raditha.mvscan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.util.List;

/**
 * Serializable description of a variable in a finding.
 *
 * @param name         Display name (the collection name for slots)
 * @param kind         Variable kind
 * @param slot         Storage slot; for slots with a numeric key the derived element slot
 * @param baseSlot     Slot of the collection, for slots only
 * @param key          Canonical key, for slots only
 * @param slotExpr     Key text when the element slot cannot be derived
 * @param members      Member names, for groups only
 * @param branchGroups Branch groups mentioning the variable or its collection
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "kind", "slot", "base_slot", "key", "slot_expr", "members", "branch_groups"})
public record VariableMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("kind") VariableKind kind,
        @JsonProperty("slot") @Nullable BigInteger slot,
        @JsonProperty("base_slot") @Nullable Integer baseSlot,
        @JsonProperty("key") @Nullable String key,
        @JsonProperty("slot_expr") @Nullable String slotExpr,
        @JsonProperty("members") @Nullable List<String> members,
        @JsonProperty("branch_groups") @Nullable List<Integer> branchGroups) {

    public static VariableMetadata group(String name, List<String> members) {
        return new VariableMetadata(name, VariableKind.MULTI_VAR_GROUP, null, null, null, null, members, null);
    }
}
