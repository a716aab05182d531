package com.raditha.mvscan.reachability;

import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.normalization.ExpressionNormalizer;
import com.raditha.mvscan.normalization.GuardPatterns;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides which functions are user-callable entry points.
 * <p>
 * A function is an entry when it is public or external, is not a constructor
 * or initializer, is not denied, and is not admin-only unless allowed or
 * role-gated entries are included. Allow and deny lists match the
 * contract-qualified id, the signature or the plain name.
 */
public class EntryPointClassifier {

    private static final Logger logger = LoggerFactory.getLogger(EntryPointClassifier.class);

    private static final Set<String> INIT_NAMES = Set.of("init", "initialize", "setup", "set_up", "bootstrap");

    private final ExpressionNormalizer normalizer;
    private final List<String> allow;
    private final List<String> deny;
    private final boolean includeRoleGated;

    public EntryPointClassifier(ExpressionNormalizer normalizer, List<String> allow, List<String> deny,
                                boolean includeRoleGated) {
        this.normalizer = normalizer;
        this.allow = List.copyOf(allow);
        this.deny = List.copyOf(deny);
        this.includeRoleGated = includeRoleGated;
    }

    /**
     * Admin-only: a recognized guard modifier or an inline privileged-caller
     * predicate in a branch node.
     */
    public boolean isAdminOnly(FunctionModel fn) {
        if (fn.modifiers().stream().anyMatch(GuardPatterns::isAdminModifier)) {
            return true;
        }
        for (NodeModel node : fn.nodes()) {
            if (node.isBranch() && GuardPatterns.isAdminGuard(normalizer.predicateText(node.expression()))) {
                return true;
            }
        }
        return false;
    }

    public boolean isUserCallable(FunctionModel fn) {
        if (!fn.isExternallyVisible() || fn.constructor() || fn.name().startsWith("initialize")) {
            return false;
        }
        if (INIT_NAMES.contains(fn.name().toLowerCase())) {
            return false;
        }
        if (matches(deny, fn)) {
            return false;
        }
        if (matches(allow, fn)) {
            return true;
        }
        return includeRoleGated || !isAdminOnly(fn);
    }

    /**
     * Entry blocks of every user-callable function present in the graph.
     */
    public Set<BlockId> publicEntries(StateDependencyGraph sdg) {
        Set<BlockId> entries = new TreeSet<>();
        for (FunctionModel fn : sdg.functions()) {
            if (!isUserCallable(fn)) {
                continue;
            }
            for (BlockId entry : sdg.entryBlocksOf(fn)) {
                if (sdg.hasBlock(entry)) {
                    entries.add(entry);
                }
            }
        }
        logger.info("Found {} user-callable entries", entries.size());
        return entries;
    }

    private static boolean matches(List<String> names, FunctionModel fn) {
        return names.contains(fn.id()) || names.contains(fn.signature()) || names.contains(fn.name());
    }
}
