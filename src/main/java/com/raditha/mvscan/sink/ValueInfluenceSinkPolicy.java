package com.raditha.mvscan.sink;

import com.raditha.mvscan.alias.VariableCanonicalizer;
import com.raditha.mvscan.frontend.AssignmentModel;
import com.raditha.mvscan.frontend.CallModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.normalization.ExpressionNormalizer;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Budgeted forward search from the read: the read is consequential when the
 * variable, or a local copy of its value, reaches a branch predicate, a call
 * or a storage write along a path that does not overwrite the variable.
 * <p>
 * Local copies are tracked textually: an assignment whose right-hand side
 * mentions a tracked token adds its left-hand side to the tokens.
 */
public class ValueInfluenceSinkPolicy implements SinkPolicy {

    private final int budget;
    private final VariableCanonicalizer canonicalizer;
    private final ExpressionNormalizer normalizer;

    public ValueInfluenceSinkPolicy(int budget, VariableCanonicalizer canonicalizer, ExpressionNormalizer normalizer) {
        this.budget = budget;
        this.canonicalizer = canonicalizer;
        this.normalizer = normalizer;
    }

    @Override
    public boolean isConsequential(StateVar variable, BlockId readBlock, StateDependencyGraph sdg) {
        if (budget == 0) {
            return false;
        }
        if (GraphSearch.isCriticalSink(sdg, readBlock) && GraphSearch.readsVariable(sdg, readBlock, variable)) {
            return true;
        }

        Set<String> tokens = initialTokens(variable);
        Set<BlockId> seen = new HashSet<>();
        seen.add(readBlock);
        Deque<BlockId> queue = new ArrayDeque<>();
        queue.add(readBlock);
        int steps = 0;
        while (!queue.isEmpty() && GraphSearch.withinBudget(steps, budget)) {
            BlockId cur = queue.poll();
            steps++;
            Optional<NodeModel> node = sdg.node(cur);
            if (node.isPresent()) {
                growTokens(node.get(), tokens);
                if (isSink(sdg, cur, node.get(), variable, tokens)
                        && GraphSearch.reachableWithoutOverwrite(sdg, readBlock, cur, variable)) {
                    return true;
                }
            }
            for (BlockId next : sdg.successors(cur)) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    private boolean isSink(StateDependencyGraph sdg, BlockId block, NodeModel node, StateVar variable,
                           Set<String> tokens) {
        boolean reads = GraphSearch.readsVariable(sdg, block, variable);
        if (node.isBranch()) {
            return reads || mentionsAny(normalizer.predicateText(node.expression()), tokens);
        }
        if (node.hasCalls()) {
            return reads || node.calls().stream().anyMatch(call -> callUsesTokens(call, tokens));
        }
        if (node.writesAnything() || !node.assignments().isEmpty()) {
            return reads || (node.writesStorage()
                    && node.assignments().stream().anyMatch(a -> mentionsAny(a.rvalue(), tokens)));
        }
        return false;
    }

    private boolean callUsesTokens(CallModel call, Set<String> tokens) {
        if (call.value() != null && mentionsAny(call.value(), tokens)) {
            return true;
        }
        return call.arguments().stream().anyMatch(arg -> mentionsAny(arg, tokens));
    }

    private Set<String> initialTokens(StateVar variable) {
        Set<String> tokens = new LinkedHashSet<>();
        String text = canonicalizer.variableText(variable);
        if (!text.isEmpty()) {
            tokens.add(text);
        }
        if (variable instanceof SlotInstance slot) {
            tokens.add(canonicalizer.variableText(slot.collection()));
        }
        return tokens;
    }

    private void growTokens(NodeModel node, Set<String> tokens) {
        if (tokens.isEmpty()) {
            return;
        }
        for (AssignmentModel assignment : node.assignments()) {
            String lv = normalizer.normalize(assignment.lvalue());
            if (!lv.isEmpty() && mentionsAny(assignment.rvalue(), tokens)) {
                tokens.add(lv);
            }
        }
    }

    private boolean mentionsAny(String text, Set<String> tokens) {
        for (String token : tokens) {
            if (normalizer.mentions(text, token)) {
                return true;
            }
        }
        return false;
    }
}
