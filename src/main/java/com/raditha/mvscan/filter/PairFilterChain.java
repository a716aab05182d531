package com.raditha.mvscan.filter;

import com.raditha.mvscan.analysis.InitializerAnalyzer.InitializerFacts;
import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.model.StalePair;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import com.raditha.mvscan.sink.SinkPolicy;

import java.util.Set;

/**
 * Benign-pair filters applied after enumeration.
 * Applies filters in order of cost: set lookups first, then the sink search,
 * then the initializer latch check.
 */
public class PairFilterChain {

    private final DetectorConfig config;
    private final Set<String> adminOnly;
    private final InitializerFacts initFacts;
    private final SinkPolicy sinkPolicy;
    private final StateDependencyGraph sdg;

    private int adminDropped;
    private int initOnlyDropped;
    private int sameEntryDropped;
    private int sinkDropped;
    private int latchDropped;
    private int accepted;

    /**
     * @param config     Filter switches
     * @param adminOnly  Ids of admin-only functions
     * @param initFacts  Initializer facts of the unpruned graph
     * @param sinkPolicy Sink test for reads
     * @param sdg        Pruned graph
     */
    public PairFilterChain(DetectorConfig config, Set<String> adminOnly, InitializerFacts initFacts,
                           SinkPolicy sinkPolicy, StateDependencyGraph sdg) {
        this.config = config;
        this.adminOnly = Set.copyOf(adminOnly);
        this.initFacts = initFacts;
        this.sinkPolicy = sinkPolicy;
        this.sdg = sdg;
    }

    /**
     * Check if a pair should be reported.
     *
     * @param pair        Raw pair
     * @param writerEntry Owning entry of the writer block
     * @param readerEntry Owning entry of the reader block
     * @return true if the pair survives every enabled filter
     */
    public boolean accept(StalePair pair, String writerEntry, String readerEntry) {
        // Stage 1: admin writes observed by user code
        if (config.adminWritesBenign()
                && adminOnly.contains(pair.writer().function())
                && !adminOnly.contains(pair.reader().function())) {
            adminDropped++;
            return false;
        }

        // Stage 2: variables only written during initialization
        if (config.initOnlyFilter() && initFacts.isInitOnly(pair.variable())) {
            initOnlyDropped++;
            return false;
        }

        // Stage 3: one transaction cannot interleave with itself
        if (config.crossTxOnly() && writerEntry.equals(readerEntry)) {
            sameEntryDropped++;
            return false;
        }

        // Stage 4: the read must reach a sink
        if (!sinkPolicy.isConsequential(pair.variable(), pair.reader(), sdg)) {
            sinkDropped++;
            return false;
        }

        // Stage 5: reader only runs after the writer's initializer latch flipped
        if (config.initOnlyFilter() && initFacts.isBenign(writerEntry, readerEntry)) {
            latchDropped++;
            return false;
        }

        accepted++;
        return true;
    }

    public FilterStats getStats() {
        return new FilterStats(adminDropped, initOnlyDropped, sameEntryDropped, sinkDropped, latchDropped, accepted);
    }

    /**
     * Number of pairs dropped by each stage, and accepted.
     */
    public record FilterStats(
            int adminDropped,
            int initOnlyDropped,
            int sameEntryDropped,
            int sinkDropped,
            int latchDropped,
            int accepted) {

        public int total() {
            return adminDropped + initOnlyDropped + sameEntryDropped + sinkDropped + latchDropped + accepted;
        }

        @Override
        public String toString() {
            return String.format("admin: %d, init-only: %d, same entry: %d, no sink: %d, init latch: %d, kept: %d",
                    adminDropped, initOnlyDropped, sameEntryDropped, sinkDropped, latchDropped, accepted);
        }
    }
}
