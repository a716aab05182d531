package com.raditha.mvscan.reachability;

import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Restricts the graph to blocks reachable from user-callable entries and tags
 * every kept block with the normalized name of its owning entry.
 */
public class ReachabilityPruner {

    private static final Logger logger = LoggerFactory.getLogger(ReachabilityPruner.class);

    private final EntryNameNormalizer entryNames;

    public ReachabilityPruner(EntryNameNormalizer entryNames) {
        this.entryNames = entryNames;
    }

    /**
     * Reachable blocks and their owners.
     *
     * @param kept    Blocks reachable from some entry
     * @param ownerOf Owning normalized entry per kept block
     */
    public record PruneResult(Set<BlockId> kept, Map<BlockId, String> ownerOf) {

        public String owner(BlockId block) {
            String owner = ownerOf.get(block);
            if (owner == null) {
                throw new IllegalStateException("Block has no owning entry: " + block);
            }
            return owner;
        }
    }

    /**
     * Traverse from every entry in block order. Each entry owns itself; any
     * other block inherits the owner of the block it was first reached from. Unreachable
     * blocks are removed from the graph.
     */
    public PruneResult prune(StateDependencyGraph sdg, Set<BlockId> entries) {
        Map<BlockId, String> ownerOf = new HashMap<>();
        for (BlockId entry : entries) {
            ownerOf.put(entry, entryNames.normalize(entry.function()));
        }

        Set<BlockId> keep = new HashSet<>();
        for (BlockId entry : entries) {
            Deque<BlockId> stack = new ArrayDeque<>();
            stack.push(entry);
            while (!stack.isEmpty()) {
                BlockId cur = stack.pop();
                if (!keep.add(cur)) {
                    continue;
                }
                for (BlockId next : sdg.successors(cur)) {
                    ownerOf.putIfAbsent(next, ownerOf.get(cur));
                    if (!keep.contains(next)) {
                        stack.push(next);
                    }
                }
            }
        }

        int before = sdg.size();
        sdg.retainBlocks(keep);
        ownerOf.keySet().retainAll(keep);
        logger.info("Pruned SDG from {} to {} reachable blocks", before, sdg.size());
        return new PruneResult(Collections.unmodifiableSet(keep), Collections.unmodifiableMap(ownerOf));
    }
}
