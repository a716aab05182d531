package com.raditha.mvscan.analysis;

import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.sdg.CallGraph;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a read can affect state: a read of a branch-group variable
 * always can; otherwise the value must reach another use of the variable or a
 * write along the function's own successors, or the reading function must be
 * called from a state-changing function.
 */
public class StateEffectAnalyzer {

    private final StateDependencyGraph sdg;
    private final CallGraph callGraph;

    public StateEffectAnalyzer(StateDependencyGraph sdg, CallGraph callGraph) {
        this.sdg = sdg;
        this.callGraph = callGraph;
    }

    public boolean isStateAffectingRead(StateVar variable, BlockId readBlock) {
        if (!sdg.branchGroupsOf(variable).isEmpty()) {
            return true;
        }
        return readAffectsState(variable, readBlock) || callGraph.isCalledFromStateful(readBlock.function());
    }

    /**
     * Walk intra-procedural successors from the read: a later use of the
     * variable (control-flow divergence) or any write (data-flow divergence)
     * makes the read matter.
     */
    boolean readAffectsState(StateVar variable, BlockId readBlock) {
        Optional<FunctionModel> fn = sdg.function(readBlock.function());
        if (fn.isEmpty()) {
            return false;
        }
        Optional<NodeModel> start = fn.get().node(readBlock.node());
        if (start.isEmpty()) {
            return false;
        }
        Set<Integer> seen = new HashSet<>();
        seen.add(start.get().id());
        Deque<NodeModel> queue = new ArrayDeque<>();
        queue.add(start.get());
        while (!queue.isEmpty()) {
            NodeModel cur = queue.poll();
            boolean isStart = cur.id() == start.get().id();
            if (!isStart && usesVariable(fn.get(), cur, variable)) {
                return true;
            }
            if (cur.writesAnything()) {
                return true;
            }
            for (Integer succ : cur.successors()) {
                if (seen.add(succ)) {
                    fn.get().node(succ).ifPresent(queue::add);
                }
            }
        }
        return false;
    }

    private boolean usesVariable(FunctionModel fn, NodeModel node, StateVar variable) {
        return sdg.block(new BlockId(fn.id(), node.id()))
                .map(b -> b.readsVariable(variable))
                .orElse(false);
    }
}
