package com.raditha.mvscan.frontend;

import java.util.List;

/**
 * One control-flow node of a function, with the storage it touches and the IR
 * operations it performs.
 *
 * @param id          Node id, unique within the enclosing function
 * @param kind        Node kind
 * @param expression  Source text of the node expression (may be empty)
 * @param successors  Ids of intra-procedural successor nodes
 * @param reads       Storage read references
 * @param writes      Storage write references
 * @param localWrites Names of local variables written by the node
 * @param assignments IR assignments in textual form
 * @param calls       IR call operations
 * @param source      Source location
 */
public record NodeModel(
        int id,
        NodeKind kind,
        String expression,
        List<Integer> successors,
        List<VariableRef> reads,
        List<VariableRef> writes,
        List<String> localWrites,
        List<AssignmentModel> assignments,
        List<CallModel> calls,
        SourceLocation source) {

    public NodeModel {
        if (kind == null) {
            kind = NodeKind.OTHER;
        }
        if (expression == null) {
            expression = "";
        }
        successors = successors == null ? List.of() : List.copyOf(successors);
        reads = reads == null ? List.of() : List.copyOf(reads);
        writes = writes == null ? List.of() : List.copyOf(writes);
        localWrites = localWrites == null ? List.of() : List.copyOf(localWrites);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        calls = calls == null ? List.of() : List.copyOf(calls);
        if (source == null) {
            source = SourceLocation.UNKNOWN;
        }
    }

    public boolean isBranch() {
        return kind.isBranch();
    }

    public boolean isReturn() {
        return kind == NodeKind.RETURN;
    }

    /**
     * True if the node writes anything at all, storage or local.
     */
    public boolean writesAnything() {
        return !writes.isEmpty() || !localWrites.isEmpty();
    }

    public boolean writesStorage() {
        return !writes.isEmpty();
    }

    public boolean hasCalls() {
        return !calls.isEmpty();
    }
}
