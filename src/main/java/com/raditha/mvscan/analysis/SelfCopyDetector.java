package com.raditha.mvscan.analysis;

import com.raditha.mvscan.alias.VariableCanonicalizer;
import com.raditha.mvscan.frontend.AssignmentModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.ExternalStateProxy;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.VariableGroup;
import com.raditha.mvscan.normalization.ExpressionNormalizer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Detects no-op writes: every assignment to the variable in the node assigns
 * the variable to itself, directly, through at most {@code aliasHops} local
 * aliases, or through an identity update such as {@code x + 0}.
 */
public class SelfCopyDetector {

    private final VariableCanonicalizer canonicalizer;
    private final ExpressionNormalizer normalizer;
    private final int aliasHops;

    public SelfCopyDetector(VariableCanonicalizer canonicalizer, ExpressionNormalizer normalizer, int aliasHops) {
        this.canonicalizer = canonicalizer;
        this.normalizer = normalizer;
        this.aliasHops = aliasHops;
    }

    public boolean isSelfCopyWrite(StateVar variable, NodeModel node) {
        if (variable instanceof ExternalStateProxy || variable instanceof VariableGroup) {
            return false;
        }
        String target = canonicalizer.variableText(variable);
        if (target.isEmpty()) {
            return false;
        }
        Map<String, String> defs = definitions(node);
        boolean foundWrite = false;
        for (AssignmentModel assignment : node.assignments()) {
            String lv = normalizer.normalize(assignment.lvalue());
            if (!lv.equals(target)) {
                continue;
            }
            foundWrite = true;
            String rv = normalizer.normalize(assignment.rvalue());
            if (rv.equals(target) || resolveAlias(rv, defs).equals(target)
                    || normalizer.isIdentityUpdate(assignment.lvalue(), assignment.rvalue())) {
                continue;
            }
            return false;
        }
        return foundWrite;
    }

    /**
     * First definition of each local in the node: lvalue to rvalue.
     */
    private Map<String, String> definitions(NodeModel node) {
        Map<String, String> defs = new HashMap<>();
        for (AssignmentModel assignment : node.assignments()) {
            String lv = normalizer.normalize(assignment.lvalue());
            if (!lv.isEmpty()) {
                defs.putIfAbsent(lv, normalizer.normalize(assignment.rvalue()));
            }
        }
        return defs;
    }

    /**
     * Follow at most {@code aliasHops} definitions, stopping on cycles.
     */
    String resolveAlias(String text, Map<String, String> defs) {
        Set<String> seen = new HashSet<>();
        String cur = text;
        for (int i = 0; i < aliasHops; i++) {
            if (!seen.add(cur)) {
                break;
            }
            String next = defs.get(cur);
            if (next == null || next.isEmpty()) {
                break;
            }
            cur = next;
        }
        return cur;
    }
}
