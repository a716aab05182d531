package com.raditha.mvscan.sink;

import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.sdg.StateDependencyGraph;

/**
 * No sink test: every pair passes.
 */
public class DisabledSinkPolicy implements SinkPolicy {

    @Override
    public boolean isConsequential(StateVar variable, BlockId readBlock, StateDependencyGraph sdg) {
        return true;
    }
}
