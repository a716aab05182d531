package com.raditha.mvscan.sink;

import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.sdg.StateDependencyGraph;

/**
 * Decides whether a stale read of a variable is consequential, i.e. whether
 * the read value can reach a use that matters.
 */
public interface SinkPolicy {

    /**
     * @param variable  the variable read
     * @param readBlock the reading block
     * @param sdg       the pruned graph
     * @return true if the read reaches a sink within the policy's budget
     */
    boolean isConsequential(StateVar variable, BlockId readBlock, StateDependencyGraph sdg);
}
