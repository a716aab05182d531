package com.raditha.mvscan.sdg;

import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.VariableGroup;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * State dependency graph of one compilation unit.
 * <p>
 * Holds, per block, the variables read and written and the successor blocks
 * (intra-procedural plus call and return edges), and per variable the blocks
 * that read or write it. Branch groups and pure multi-return summaries are
 * recorded while the graph is built. The graph is mutated by pseudo-variable
 * registration and by reachability pruning.
 */
public class StateDependencyGraph {

    private final Map<BlockId, BlockInfo> blocks = new TreeMap<>();
    private final Map<StateVar, Set<BlockId>> varReads = new LinkedHashMap<>();
    private final Map<StateVar, Set<BlockId>> varWrites = new LinkedHashMap<>();
    private final Map<String, FunctionModel> functions = new TreeMap<>();
    private final Map<Integer, Set<StateVar>> branchGroups = new TreeMap<>();
    private final Map<StateVar, Set<Integer>> varToBranchGroups = new HashMap<>();
    private final Map<String, Set<StateVar>> functionReturns = new TreeMap<>();
    private Map<BlockId, Set<BlockId>> predecessors;
    private int nextGroupId = 1;

    public void registerFunction(FunctionModel function) {
        functions.put(function.id(), function);
    }

    public Optional<FunctionModel> function(String functionId) {
        return Optional.ofNullable(functions.get(functionId));
    }

    public FunctionModel functionOf(BlockId block) {
        FunctionModel function = functions.get(block.function());
        if (function == null) {
            throw new IllegalStateException("Unknown function for block " + block);
        }
        return function;
    }

    public Collection<FunctionModel> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    /**
     * First function with the given plain name, used to resolve unresolved
     * call targets textually.
     */
    public Optional<FunctionModel> functionByName(String name) {
        return functions.values().stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public boolean hasBlock(BlockId id) {
        return blocks.containsKey(id);
    }

    public Optional<BlockInfo> block(BlockId id) {
        return Optional.ofNullable(blocks.get(id));
    }

    public Set<BlockId> blockIds() {
        return Collections.unmodifiableSet(blocks.keySet());
    }

    public Collection<BlockInfo> blocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public Optional<NodeModel> node(BlockId id) {
        BlockInfo info = blocks.get(id);
        return info == null ? Optional.empty() : Optional.ofNullable(info.node());
    }

    public Set<BlockId> successors(BlockId id) {
        BlockInfo info = blocks.get(id);
        return info == null ? Set.of() : info.successors();
    }

    /**
     * Predecessors derived from successor edges, cached until the next mutation.
     */
    public Set<BlockId> predecessors(BlockId id) {
        if (predecessors == null) {
            predecessors = new HashMap<>();
            for (BlockInfo info : blocks.values()) {
                for (BlockId succ : info.successors()) {
                    predecessors.computeIfAbsent(succ, k -> new TreeSet<>()).add(info.id());
                }
            }
        }
        return predecessors.getOrDefault(id, Set.of());
    }

    /**
     * Get or create a placeholder block for a call or return edge target.
     */
    BlockInfo placeholder(BlockId id) {
        predecessors = null;
        return blocks.computeIfAbsent(id, BlockInfo::new);
    }

    /**
     * Commit a fully processed block. Edges already attached to a placeholder
     * for the same block are kept.
     */
    void commit(BlockId id, NodeModel node, Set<StateVar> reads, Set<StateVar> writes, Set<BlockId> successors) {
        predecessors = null;
        BlockInfo info = blocks.computeIfAbsent(id, BlockInfo::new);
        info.complete(node, reads, writes, successors);
        for (StateVar v : reads) {
            varReads.computeIfAbsent(v, k -> new TreeSet<>()).add(id);
        }
        for (StateVar v : writes) {
            varWrites.computeIfAbsent(v, k -> new TreeSet<>()).add(id);
        }
    }

    public Set<BlockId> readers(StateVar variable) {
        return Collections.unmodifiableSet(varReads.getOrDefault(variable, Set.of()));
    }

    public Set<BlockId> writers(StateVar variable) {
        return Collections.unmodifiableSet(varWrites.getOrDefault(variable, Set.of()));
    }

    /**
     * Variables with at least one write, in registration order.
     */
    public Set<StateVar> writtenVariables() {
        return Collections.unmodifiableSet(varWrites.keySet());
    }

    public Set<StateVar> variables() {
        Set<StateVar> all = new LinkedHashSet<>(varWrites.keySet());
        all.addAll(varReads.keySet());
        return all;
    }

    public int nextGroupId() {
        return nextGroupId++;
    }

    void addToBranchGroup(int gid, StateVar variable) {
        branchGroups.computeIfAbsent(gid, k -> new LinkedHashSet<>()).add(variable);
        varToBranchGroups.computeIfAbsent(variable, k -> new TreeSet<>()).add(gid);
    }

    public Map<Integer, Set<StateVar>> branchGroups() {
        return Collections.unmodifiableMap(branchGroups);
    }

    /**
     * Branch groups mentioning the variable or, for a slot, its collection.
     */
    public Set<Integer> branchGroupsOf(StateVar variable) {
        Set<Integer> groups = new TreeSet<>(varToBranchGroups.getOrDefault(variable, Set.of()));
        if (variable.base() != variable) {
            groups.addAll(varToBranchGroups.getOrDefault(variable.base(), Set.of()));
        }
        return groups;
    }

    void recordReturns(String functionId, Set<StateVar> variables) {
        functionReturns.put(functionId, Collections.unmodifiableSet(new LinkedHashSet<>(variables)));
    }

    public Map<String, Set<StateVar>> functionReturns() {
        return Collections.unmodifiableMap(functionReturns);
    }

    public Optional<Set<StateVar>> returnsOf(String functionId) {
        return Optional.ofNullable(functionReturns.get(functionId));
    }

    /**
     * Register a pseudo-variable so it behaves like a variable: its read and
     * write sets are the union of the given members' sets.
     */
    public void registerPseudo(VariableGroup group, Collection<? extends StateVar> sources) {
        Set<BlockId> reads = varReads.computeIfAbsent(group, k -> new TreeSet<>());
        Set<BlockId> writes = varWrites.computeIfAbsent(group, k -> new TreeSet<>());
        for (StateVar source : sources) {
            reads.addAll(varReads.getOrDefault(source, Set.of()));
            writes.addAll(varWrites.getOrDefault(source, Set.of()));
        }
        if (reads.isEmpty()) {
            varReads.remove(group);
        }
        if (writes.isEmpty()) {
            varWrites.remove(group);
        }
    }

    /**
     * Keep only the given blocks; prune the variable maps and drop variables
     * left without blocks.
     */
    public void retainBlocks(Set<BlockId> keep) {
        predecessors = null;
        blocks.keySet().retainAll(keep);
        for (BlockInfo info : blocks.values()) {
            info.retainSuccessors(keep);
        }
        prune(varReads, keep);
        prune(varWrites, keep);
    }

    private static void prune(Map<StateVar, Set<BlockId>> map, Set<BlockId> keep) {
        map.values().forEach(s -> s.retainAll(keep));
        map.values().removeIf(Set::isEmpty);
    }

    public List<BlockId> entryBlocksOf(FunctionModel function) {
        return function.entryNode()
                .map(n -> List.of(new BlockId(function.id(), n.id())))
                .orElse(List.of());
    }

    public int size() {
        return blocks.size();
    }
}
