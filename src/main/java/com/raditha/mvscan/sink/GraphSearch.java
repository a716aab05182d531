package com.raditha.mvscan.sink;

import com.raditha.mvscan.frontend.CallKind;
import com.raditha.mvscan.frontend.CallModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Graph queries shared by the sink policies.
 */
public final class GraphSearch {

    private GraphSearch() {
    }

    /**
     * True if {@code dst} is reachable from {@code src} without passing through
     * another block that writes {@code variable}. A block trivially reaches itself.
     */
    public static boolean reachableWithoutOverwrite(StateDependencyGraph sdg, BlockId src, BlockId dst,
                                                    StateVar variable) {
        if (src.equals(dst)) {
            return true;
        }
        Set<BlockId> seen = new HashSet<>();
        seen.add(src);
        Deque<BlockId> queue = new ArrayDeque<>();
        queue.add(src);
        while (!queue.isEmpty()) {
            BlockId cur = queue.poll();
            for (BlockId next : sdg.successors(cur)) {
                if (next.equals(dst)) {
                    return true;
                }
                if (seen.contains(next)) {
                    continue;
                }
                boolean overwrites = sdg.block(next).map(b -> b.writesVariable(variable)).orElse(false);
                if (overwrites) {
                    continue;
                }
                seen.add(next);
                queue.add(next);
            }
        }
        return false;
    }

    public static boolean readsVariable(StateDependencyGraph sdg, BlockId block, StateVar variable) {
        return sdg.block(block).map(b -> b.readsVariable(variable)).orElse(false);
    }

    public static boolean isBranch(StateDependencyGraph sdg, BlockId block) {
        return sdg.node(block).map(NodeModel::isBranch).orElse(false);
    }

    /**
     * A critical sink is a branch predicate or a call leaving the contract:
     * low-level, unresolved high-level, or resolved into another contract.
     */
    public static boolean isCriticalSink(StateDependencyGraph sdg, BlockId block) {
        Optional<NodeModel> node = sdg.node(block);
        if (node.isEmpty()) {
            return false;
        }
        if (node.get().isBranch()) {
            return true;
        }
        return isExternalCallSite(sdg, block, node.get());
    }

    private static boolean isExternalCallSite(StateDependencyGraph sdg, BlockId block, NodeModel node) {
        Optional<FunctionModel> caller = sdg.function(block.function());
        if (caller.isEmpty()) {
            return false;
        }
        for (CallModel call : node.calls()) {
            if (call.kind() == CallKind.LOW_LEVEL) {
                return true;
            }
            if (call.kind() != CallKind.HIGH_LEVEL) {
                continue;
            }
            if (!call.isResolved()) {
                return true;
            }
            String calleeContract = sdg.function(call.callee())
                    .map(FunctionModel::contract)
                    .orElse(call.calleeContract());
            if (calleeContract == null || !calleeContract.equals(caller.get().contract())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Budget check: {@code budget < 0} is unbounded.
     */
    static boolean withinBudget(int steps, int budget) {
        return budget < 0 || steps < budget;
    }
}
