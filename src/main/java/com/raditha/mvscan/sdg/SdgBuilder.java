package com.raditha.mvscan.sdg;

import com.raditha.mvscan.alias.VariableCanonicalizer;
import com.raditha.mvscan.analyzer.AnalysisContext;
import com.raditha.mvscan.frontend.AssignmentModel;
import com.raditha.mvscan.frontend.CallKind;
import com.raditha.mvscan.frontend.CallModel;
import com.raditha.mvscan.frontend.ContractModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.frontend.ParameterModel;
import com.raditha.mvscan.frontend.VariableRef;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.normalization.ExpressionNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the state dependency graph of a compilation unit.
 * <p>
 * Every node of every function becomes a block with canonical read and write
 * sets. Resolved calls add an edge to the callee entry and edges from the
 * callee exits back to the caller's successors; there is no call stack, so
 * interprocedural paths are over-approximated. Conditionals mixing two or
 * more variables form branch groups. Functions that write no storage and
 * return two or more variables are summarized, and their call sites read the
 * returned variables.
 */
public class SdgBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SdgBuilder.class);

    private final AnalysisContext context;
    private final VariableCanonicalizer canonicalizer;
    private final ExpressionNormalizer normalizer;
    private final boolean promoteMappingBase;

    public SdgBuilder(AnalysisContext context, boolean promoteMappingBase) {
        this.context = context;
        this.canonicalizer = context.canonicalizer();
        this.normalizer = context.normalizer();
        this.promoteMappingBase = promoteMappingBase;
    }

    /**
     * Build the graph for every contract of the context's compilation unit.
     */
    public StateDependencyGraph build() {
        StateDependencyGraph sdg = new StateDependencyGraph();
        context.unit().functions().forEach(sdg::registerFunction);

        for (FunctionModel fn : sdg.functions()) {
            summarizeReturns(sdg, fn);
        }

        for (ContractModel contract : context.unit().contracts()) {
            for (FunctionModel fn : contract.functions()) {
                for (NodeModel node : fn.nodes()) {
                    addBlock(sdg, fn, node);
                }
            }
        }

        logger.info("Built SDG: {} blocks, {} variables, {} branch groups, {} return summaries",
                sdg.size(), sdg.variables().size(), sdg.branchGroups().size(), sdg.functionReturns().size());
        return sdg;
    }

    /**
     * Populate one block. A block is fully processed at most once; placeholder
     * blocks created by call or return edges are completed here.
     *
     * @return false if the block was already processed
     */
    boolean addBlock(StateDependencyGraph sdg, FunctionModel fn, NodeModel node) {
        BlockId id = new BlockId(fn.id(), node.id());
        Optional<BlockInfo> existing = sdg.block(id);
        if (existing.isPresent() && !existing.get().isPlaceholder()) {
            return false;
        }

        Set<StateVar> reads = new LinkedHashSet<>();
        Set<StateVar> writes = new LinkedHashSet<>();
        for (VariableRef ref : node.reads()) {
            reads.add(canonicalizer.canonicalize(ref));
        }
        for (VariableRef ref : node.writes()) {
            writes.add(canonicalizer.canonicalize(ref));
        }
        for (AssignmentModel assignment : node.assignments()) {
            canonicalizer.indexedLvalue(fn.contract(), assignment.lvalue()).ifPresent(writes::add);
        }

        for (StateVar written : List.copyOf(writes)) {
            writes.addAll(canonicalizer.getterAliases(written, fn.id()));
        }

        Set<BlockId> successors = new TreeSet<>();
        for (Integer succ : node.successors()) {
            successors.add(new BlockId(fn.id(), succ));
        }

        for (CallModel call : node.calls()) {
            Optional<FunctionModel> callee = call.isResolved() ? sdg.function(call.callee()) : Optional.empty();
            callee.ifPresent(target -> linkCall(sdg, id, successors, target));

            summaryTarget(sdg, call, callee).ifPresent(target ->
                    reads.addAll(substituteArguments(target, call, sdg.returnsOf(target.id()).orElseThrow())));

            canonicalizer.externalAccess(call, fn.id()).ifPresent(access -> {
                if (access.write()) {
                    writes.add(access.proxy());
                } else {
                    reads.add(access.proxy());
                }
            });
        }

        if (node.isBranch() && reads.size() >= 2) {
            int gid = sdg.nextGroupId();
            for (StateVar v : reads) {
                sdg.addToBranchGroup(gid, v);
                if (promoteMappingBase && v instanceof SlotInstance slot) {
                    sdg.addToBranchGroup(gid, slot.collection());
                }
            }
            logger.debug("Branch group {} at {}: {}", gid, id, reads);
        }

        sdg.commit(id, node, reads, writes, successors);
        return true;
    }

    /**
     * Call edge to the callee entry and return edges from every callee exit to
     * the caller's successors (or to the call site when it has none).
     */
    private void linkCall(StateDependencyGraph sdg, BlockId callSite, Set<BlockId> callSiteSuccessors,
                          FunctionModel callee) {
        Set<BlockId> returnTargets = new TreeSet<>();
        for (BlockId succ : callSiteSuccessors) {
            if (succ.function().equals(callSite.function())) {
                returnTargets.add(succ);
            }
        }
        if (returnTargets.isEmpty()) {
            returnTargets.add(callSite);
        }
        for (BlockId entry : sdg.entryBlocksOf(callee)) {
            sdg.placeholder(entry);
            callSiteSuccessors.add(entry);
        }
        for (NodeModel exit : callee.exitNodes()) {
            BlockInfo exitBlock = sdg.placeholder(new BlockId(callee.id(), exit.id()));
            returnTargets.forEach(exitBlock::addSuccessor);
        }
    }

    /**
     * Summarized function invoked by a call: the resolved callee, or for an
     * unresolved target the function with the same name.
     */
    private Optional<FunctionModel> summaryTarget(StateDependencyGraph sdg, CallModel call,
                                                  Optional<FunctionModel> callee) {
        Optional<FunctionModel> target = callee;
        if (target.isEmpty() && call.kind() != CallKind.LOW_LEVEL && !call.isResolved()) {
            target = sdg.functions().stream()
                    .filter(f -> f.name().equals(call.calleeName()))
                    .filter(f -> call.calleeContract() == null || f.contract().equals(call.calleeContract()))
                    .findFirst();
            target.ifPresent(f -> logger.debug("Resolved call to {} by name as {}", call.calleeName(), f.id()));
        }
        return target.filter(f -> sdg.returnsOf(f.id()).isPresent());
    }

    /**
     * Record the return summary of a function that writes no storage and whose
     * return statements read two or more variables.
     */
    void summarizeReturns(StateDependencyGraph sdg, FunctionModel fn) {
        if (writesStorage(fn)) {
            return;
        }
        Set<StateVar> returned = new LinkedHashSet<>();
        for (NodeModel node : fn.nodes()) {
            if (node.isReturn()) {
                node.reads().forEach(ref -> returned.add(canonicalizer.canonicalize(ref)));
            }
        }
        if (returned.size() >= 2) {
            sdg.recordReturns(fn.id(), returned);
            logger.debug("Return summary {} -> {}", fn.id(), returned);
        }
    }

    private boolean writesStorage(FunctionModel fn) {
        for (NodeModel node : fn.nodes()) {
            if (node.writesStorage()) {
                return true;
            }
            for (AssignmentModel assignment : node.assignments()) {
                if (canonicalizer.indexedLvalue(fn.contract(), assignment.lvalue()).isPresent()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Replace callee parameter names inside slot keys with the caller's
     * canonical arguments.
     */
    private Set<StateVar> substituteArguments(FunctionModel callee, CallModel call, Set<StateVar> returned) {
        Map<String, String> substitution = new HashMap<>();
        List<ParameterModel> params = callee.parameters();
        List<String> args = call.arguments();
        for (int i = 0; i < params.size() && i < args.size(); i++) {
            String name = params.get(i).name();
            if (name == null || name.isBlank()) {
                name = "arg" + i;
            }
            substitution.put(normalizer.normalize(name), normalizer.normalize(args.get(i)));
        }
        Set<StateVar> result = new LinkedHashSet<>();
        for (StateVar v : returned) {
            if (v instanceof SlotInstance slot) {
                result.add(new SlotInstance(slot.collection(), substitution.getOrDefault(slot.key(), slot.key())));
            } else {
                result.add(v);
            }
        }
        return result;
    }
}
