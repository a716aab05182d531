package com.raditha.mvscan.analysis;

import com.raditha.mvscan.frontend.AssignmentModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.normalization.ExpressionNormalizer;
import com.raditha.mvscan.normalization.GuardPatterns;
import com.raditha.mvscan.normalization.Latch;
import com.raditha.mvscan.normalization.LatchForm;
import com.raditha.mvscan.reachability.EntryNameNormalizer;
import com.raditha.mvscan.sdg.BlockInfo;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Recognizes one-time initialization on the unpruned graph.
 * <p>
 * Two facts are computed:
 * <ul>
 * <li>init-only variables: every write is in a creation-phase function or
 * behind a monotone latch,</li>
 * <li>initializer latches: public functions that check a latch in its initial
 * state, flip it and are never undone, together with the entries whose guards
 * only pass after the flip.</li>
 * </ul>
 * These are text heuristics over normalized predicates.
 */
public class InitializerAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(InitializerAnalyzer.class);

    private final StateDependencyGraph sdg;
    private final ExpressionNormalizer normalizer;
    private final EntryNameNormalizer entryNames;

    public InitializerAnalyzer(StateDependencyGraph sdg, ExpressionNormalizer normalizer,
                               EntryNameNormalizer entryNames) {
        this.sdg = sdg;
        this.normalizer = normalizer;
        this.entryNames = entryNames;
    }

    /**
     * Results of the initializer analysis.
     *
     * @param initOnly           Storage variables written only during initialization
     * @param latchesByEntry     Latches flipped by each initializer entry
     * @param postGuardedByLatch Entries guarded by each latch being already flipped
     */
    public record InitializerFacts(
            Set<StateVar> initOnly,
            Map<String, Set<String>> latchesByEntry,
            Map<String, Set<String>> postGuardedByLatch) {

        public static final InitializerFacts NONE = new InitializerFacts(Set.of(), Map.of(), Map.of());

        public boolean isInitOnly(StateVar variable) {
            return initOnly.contains(variable) || initOnly.contains(variable.base());
        }

        /**
         * True when the writer entry is an initializer and the reader entry
         * only runs after one of its latches was flipped.
         */
        public boolean isBenign(String writerEntry, String readerEntry) {
            Set<String> latches = latchesByEntry.getOrDefault(writerEntry, Set.of());
            return latches.stream()
                    .anyMatch(l -> postGuardedByLatch.getOrDefault(l, Set.of()).contains(readerEntry));
        }
    }

    public InitializerFacts analyze() {
        Set<StateVar> initOnly = initOnlyVariables();

        Map<String, Set<String>> latchesByEntry = new TreeMap<>();
        Set<String> allLatches = new LinkedHashSet<>();
        for (FunctionModel fn : sdg.functions()) {
            if (!fn.isExternallyVisible()) {
                continue;
            }
            Set<String> latches = initializerLatches(fn);
            if (!latches.isEmpty()) {
                latchesByEntry.computeIfAbsent(entryNames.normalize(fn.id()), k -> new LinkedHashSet<>())
                        .addAll(latches);
                allLatches.addAll(latches);
            }
        }

        Map<String, Set<String>> postGuarded = new TreeMap<>();
        for (FunctionModel fn : sdg.functions()) {
            if (!fn.isExternallyVisible()) {
                continue;
            }
            for (String latch : allLatches) {
                if (hasPostGuard(fn, latch)) {
                    postGuarded.computeIfAbsent(latch, k -> new LinkedHashSet<>())
                            .add(entryNames.normalize(fn.id()));
                }
            }
        }

        logger.info("Initializer analysis: {} init-only variables, {} initializer entries",
                initOnly.size(), latchesByEntry.size());
        return new InitializerFacts(Collections.unmodifiableSet(initOnly),
                Collections.unmodifiableMap(latchesByEntry), Collections.unmodifiableMap(postGuarded));
    }

    Set<StateVar> initOnlyVariables() {
        Set<StateVar> result = new LinkedHashSet<>();
        for (StateVar v : sdg.writtenVariables()) {
            if (!(v instanceof StorageVariable)) {
                continue;
            }
            Set<BlockId> writes = sdg.writers(v);
            if (!writes.isEmpty() && writes.stream().allMatch(w -> isCreationPhase(w) || passesMonotoneLatch(w))) {
                result.add(v);
            }
        }
        return result;
    }

    boolean isCreationPhase(BlockId write) {
        FunctionModel fn = sdg.functionOf(write);
        return fn.constructor()
                || GuardPatterns.isCreationPhaseName(fn.name())
                || fn.modifiers().stream().anyMatch(GuardPatterns::isInitializerModifier);
    }

    /**
     * A guard before the write checks a latch in its initial state, a block
     * from the write onwards flips the latch, nothing resets it, and every
     * public entry reaching the write mentions it.
     */
    boolean passesMonotoneLatch(BlockId write) {
        Set<Latch> candidates = new LinkedHashSet<>();
        for (BlockId guard : backwardClosure(write)) {
            sdg.node(guard)
                    .filter(NodeModel::isBranch)
                    .ifPresent(n -> candidates.addAll(
                            GuardPatterns.latchCandidates(normalizer.predicateText(n.expression()))));
        }
        for (Latch latch : candidates) {
            if (hasMonotoneFlip(latch, write) && !hasReset(latch) && entryPathsGuarded(latch, write)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Latches for which the function behaves like an initializer.
     */
    Set<String> initializerLatches(FunctionModel fn) {
        Optional<BlockId> entry = sdg.entryBlocksOf(fn).stream().findFirst();
        if (entry.isEmpty()) {
            return Set.of();
        }
        Set<String> pre = new LinkedHashSet<>();
        for (NodeModel node : fn.nodes()) {
            if (node.isBranch()) {
                pre.addAll(GuardPatterns.preGuardLatchNames(normalizer.predicateText(node.expression())));
            }
        }
        String name = fn.name().toLowerCase();
        if ((name.contains("init") || name.contains("setup") || name.contains("bootstrap"))
                && fn.modifiers().stream().anyMatch(GuardPatterns::isInitializerModifier)) {
            pre.add("initialized");
        }
        Set<String> latches = new LinkedHashSet<>();
        for (String candidate : pre) {
            Latch latch = new Latch(candidate, LatchForm.EQ, null);
            if (hasMonotoneFlip(latch, entry.get()) && !hasReset(latch)) {
                latches.add(candidate);
            }
        }
        return latches;
    }

    boolean hasPostGuard(FunctionModel fn, String latch) {
        for (NodeModel node : fn.nodes()) {
            if (node.isBranch() && GuardPatterns.isPostGuard(normalizer.predicateText(node.expression()), latch)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Any block forward-reachable from the write, the write included,
     * assigns the latch a value outside its initial state.
     */
    boolean hasMonotoneFlip(Latch latch, BlockId from) {
        Set<BlockId> seen = new HashSet<>();
        Deque<BlockId> work = new ArrayDeque<>();
        work.push(from);
        seen.add(from);
        while (!work.isEmpty()) {
            BlockId cur = work.pop();
            Optional<NodeModel> node = sdg.node(cur);
            if (node.isPresent() && assignsLatch(node.get(), latch, true)) {
                return true;
            }
            for (BlockId next : sdg.successors(cur)) {
                if (seen.add(next)) {
                    work.push(next);
                }
            }
        }
        return false;
    }

    boolean hasReset(Latch latch) {
        return sdg.blocks().stream()
                .map(BlockInfo::node)
                .anyMatch(n -> n != null && assignsLatch(n, latch, false));
    }

    private boolean assignsLatch(NodeModel node, Latch latch, boolean flip) {
        String target = latch.canonicalName();
        for (AssignmentModel assignment : node.assignments()) {
            String lv = stripUnderscores(normalizer.normalize(assignment.lvalue()));
            if (!lv.equals(target)) {
                continue;
            }
            String rv = normalizer.normalize(assignment.rvalue());
            if (flip ? GuardPatterns.isMonotoneFlip(latch, rv) : GuardPatterns.isReset(rv)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Every externally visible function met walking backwards from the write
     * mentions the latch somewhere in its nodes.
     */
    boolean entryPathsGuarded(Latch latch, BlockId write) {
        String name = latch.canonicalName();
        Set<String> entries = new HashSet<>();
        Set<String> guarded = new HashSet<>();
        for (BlockId cur : backwardClosure(write)) {
            Optional<FunctionModel> fn = sdg.function(cur.function());
            if (fn.isEmpty() || !fn.get().isExternallyVisible() || !entries.add(fn.get().id())) {
                continue;
            }
            boolean mentions = fn.get().nodes().stream()
                    .anyMatch(n -> n.expression().toLowerCase().contains(name));
            if (mentions) {
                guarded.add(fn.get().id());
            }
        }
        return !entries.isEmpty() && guarded.containsAll(entries);
    }

    private Set<BlockId> backwardClosure(BlockId start) {
        Set<BlockId> seen = new LinkedHashSet<>();
        Deque<BlockId> work = new ArrayDeque<>();
        seen.add(start);
        work.push(start);
        while (!work.isEmpty()) {
            BlockId cur = work.pop();
            for (BlockId pred : sdg.predecessors(cur)) {
                if (seen.add(pred)) {
                    work.push(pred);
                }
            }
        }
        return seen;
    }

    private static String stripUnderscores(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == '_') {
            i++;
        }
        return text.substring(i);
    }
}
