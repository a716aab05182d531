package com.raditha.mvscan.sdg;

import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read set, write set and successors of one block.
 * <p>
 * A block created only as the target of a call or return edge is a
 * placeholder: it has no node yet and is completed when its function is
 * walked.
 */
public class BlockInfo {

    private final BlockId id;
    private final Set<StateVar> reads = new LinkedHashSet<>();
    private final Set<StateVar> writes = new LinkedHashSet<>();
    private final Set<BlockId> successors = new TreeSet<>();
    private @Nullable NodeModel node;

    BlockInfo(BlockId id) {
        this.id = id;
    }

    public BlockId id() {
        return id;
    }

    public Set<StateVar> reads() {
        return Collections.unmodifiableSet(reads);
    }

    public Set<StateVar> writes() {
        return Collections.unmodifiableSet(writes);
    }

    public Set<BlockId> successors() {
        return Collections.unmodifiableSet(successors);
    }

    public @Nullable NodeModel node() {
        return node;
    }

    public boolean isPlaceholder() {
        return node == null;
    }

    public boolean readsVariable(StateVar variable) {
        return reads.contains(variable) || reads.contains(variable.base());
    }

    public boolean writesVariable(StateVar variable) {
        return writes.contains(variable);
    }

    void complete(NodeModel node, Set<StateVar> reads, Set<StateVar> writes, Set<BlockId> successors) {
        this.node = node;
        this.reads.addAll(reads);
        this.writes.addAll(writes);
        this.successors.addAll(successors);
    }

    void addSuccessor(BlockId successor) {
        successors.add(successor);
    }

    void retainSuccessors(Set<BlockId> keep) {
        successors.retainAll(keep);
    }

    @Override
    public String toString() {
        return id + " r=" + reads + " w=" + writes + " succ=" + successors;
    }
}
