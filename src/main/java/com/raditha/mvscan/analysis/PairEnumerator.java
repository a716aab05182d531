package com.raditha.mvscan.analysis;

import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.PairPattern;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StalePair;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.sdg.BlockInfo;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Enumerates raw write/read pairs over the pruned graph.
 * <p>
 * Writes and reads in constructors or {@code initialize*} functions never
 * participate. Each (writer function, reader function, variable) triple is
 * reported at most once.
 */
public class PairEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(PairEnumerator.class);

    private final StateDependencyGraph sdg;
    private final StateEffectAnalyzer stateEffect;
    private final SelfCopyDetector selfCopy;
    private final DetectorConfig config;

    public PairEnumerator(StateDependencyGraph sdg, StateEffectAnalyzer stateEffect,
                          SelfCopyDetector selfCopy, DetectorConfig config) {
        this.sdg = sdg;
        this.stateEffect = stateEffect;
        this.selfCopy = selfCopy;
        this.config = config;
    }

    public Stream<StalePair> enumeratePairs() {
        List<StalePair> pairs = new ArrayList<>();
        for (StateVar v : List.copyOf(sdg.writtenVariables())) {
            if (v instanceof StorageVariable sv && sv.isInert()) {
                continue;
            }
            List<BlockId> writes = sdg.writers(v).stream()
                    .filter(w -> !isInitialization(sdg.functionOf(w)))
                    .toList();
            Set<BlockId> reads = sdg.readers(v);
            if (writes.isEmpty() || reads.isEmpty()) {
                continue;
            }
            enumerate(v, writes, reads, pairs);
        }
        logger.info("Enumerated {} write/read pairs", pairs.size());
        return pairs.stream();
    }

    private void enumerate(StateVar v, List<BlockId> writes, Set<BlockId> reads, List<StalePair> out) {
        Set<String> yielded = new HashSet<>();
        for (BlockId w : writes) {
            for (BlockId r : reads) {
                String triple = w.function() + "|" + r.function();
                if (yielded.contains(triple)) {
                    continue;
                }
                Optional<StalePair> pair = pairOf(v, w, r);
                if (pair.isPresent()) {
                    yielded.add(triple);
                    out.add(pair.get());
                }
            }
        }
    }

    /**
     * Apply the per-pair filters and classify the pair.
     */
    Optional<StalePair> pairOf(StateVar v, BlockId w, BlockId r) {
        if (isInitialization(sdg.functionOf(r))) {
            return Optional.empty();
        }
        if (!stateEffect.isStateAffectingRead(v, r)) {
            return Optional.empty();
        }
        if (w.equals(r)) {
            return Optional.empty();
        }
        if (config.noopWriteFilter()) {
            Optional<NodeModel> node = sdg.node(w);
            if (node.isPresent() && selfCopy.isSelfCopyWrite(v, node.get())) {
                return Optional.empty();
            }
        }
        if (config.requireSameSlotKey() && !keysOverlap(w, r)) {
            return Optional.empty();
        }
        PairPattern pattern = w.precedes(r) ? PairPattern.STALE_READ : PairPattern.DESTRUCTIVE_WRITE;
        if (pattern == PairPattern.STALE_READ && !w.function().equals(r.function())) {
            pattern = PairPattern.CROSS_TX_STALE_READ;
        }
        return Optional.of(new StalePair(w, r, v, pattern));
    }

    /**
     * When both blocks touch slots of a common collection, they must share at
     * least one key on one of them.
     */
    boolean keysOverlap(BlockId w, BlockId r) {
        Map<StorageVariable, Set<String>> written = slotKeys(sdg.block(w).map(BlockInfo::writes).orElse(Set.of()));
        Map<StorageVariable, Set<String>> read = slotKeys(sdg.block(r).map(BlockInfo::reads).orElse(Set.of()));
        boolean common = false;
        for (Map.Entry<StorageVariable, Set<String>> e : written.entrySet()) {
            Set<String> readKeys = read.get(e.getKey());
            if (readKeys == null) {
                continue;
            }
            common = true;
            if (e.getValue().stream().anyMatch(readKeys::contains)) {
                return true;
            }
        }
        return !common;
    }

    private static Map<StorageVariable, Set<String>> slotKeys(Set<StateVar> variables) {
        Map<StorageVariable, Set<String>> keys = new HashMap<>();
        for (StateVar v : variables) {
            if (v instanceof SlotInstance slot) {
                keys.computeIfAbsent(slot.collection(), k -> new HashSet<>()).add(slot.key());
            }
        }
        return keys;
    }

    static boolean isInitialization(FunctionModel fn) {
        return fn.constructor() || fn.name().startsWith("initialize");
    }
}
