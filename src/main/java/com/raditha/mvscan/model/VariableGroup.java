package com.raditha.mvscan.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A set of related variables treated as one logical variable.
 * Groups are equal when their ids are equal.
 *
 * @param gid     Synthetic group id
 * @param members Member variables, sorted by name
 */
public record VariableGroup(int gid, List<StateVar> members) implements StateVar {

    public VariableGroup {
        members = members == null ? List.of() : List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("A variable group needs at least 2 members, got " + members.size());
        }
    }

    @Override
    public String name() {
        return "{" + members.stream()
                .map(StateVar::name)
                .sorted()
                .collect(Collectors.joining(", ")) + "}";
    }

    @Override
    public VariableKind kind() {
        return VariableKind.MULTI_VAR_GROUP;
    }

    @Override
    public @Nullable String declaringContract() {
        return null;
    }

    @Override
    public String identity() {
        return "MVG:" + gid;
    }

    public List<String> memberNames() {
        return members.stream().map(StateVar::name).toList();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableGroup other && gid == other.gid;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(gid);
    }

    @Override
    public String toString() {
        return "MVG#" + gid + name();
    }
}
