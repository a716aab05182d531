package com.raditha.mvscan.sink;

import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Budgeted forward search from the read: the read is consequential when the
 * same variable is re-read at a critical sink (branch or call leaving the
 * contract) with no overwrite in between.
 */
public class SameVariableSinkPolicy implements SinkPolicy {

    private final int budget;

    /**
     * @param budget maximum blocks visited; negative for unbounded, zero to never succeed
     */
    public SameVariableSinkPolicy(int budget) {
        this.budget = budget;
    }

    @Override
    public boolean isConsequential(StateVar variable, BlockId readBlock, StateDependencyGraph sdg) {
        if (budget == 0) {
            return false;
        }
        Set<BlockId> readers = sdg.readers(variable);
        if (readers.contains(readBlock) && GraphSearch.isCriticalSink(sdg, readBlock)) {
            return true;
        }

        Set<BlockId> seen = new HashSet<>();
        seen.add(readBlock);
        Deque<BlockId> queue = new ArrayDeque<>();
        queue.add(readBlock);
        int steps = 0;
        while (!queue.isEmpty() && GraphSearch.withinBudget(steps, budget)) {
            BlockId cur = queue.poll();
            steps++;
            if (readers.contains(cur) && GraphSearch.isCriticalSink(sdg, cur)
                    && GraphSearch.reachableWithoutOverwrite(sdg, readBlock, cur, variable)) {
                return true;
            }
            for (BlockId next : sdg.successors(cur)) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }
}
