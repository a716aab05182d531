package com.raditha.mvscan.clustering;

import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.frontend.SourceLocation;
import com.raditha.mvscan.layout.StorageLayoutResolver;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.BucketClass;
import com.raditha.mvscan.model.ClassifiedPair;
import com.raditha.mvscan.model.Finding;
import com.raditha.mvscan.model.PairPattern;
import com.raditha.mvscan.model.ShapeTags;
import com.raditha.mvscan.model.SiteSample;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.TransactionSet;
import com.raditha.mvscan.model.VariableGroup;
import com.raditha.mvscan.model.VariableMetadata;
import com.raditha.mvscan.sdg.PseudoVariableSynthesizer.PseudoVariables;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups classified pairs into findings.
 * <p>
 * Pairs are bucketed by transaction set, then by variable. A pair on a
 * variable that belongs to multi-variable groups is also added to the bucket
 * of every such group. Each bucket becomes one {@link Finding} with sampled
 * writer and reader sites and aggregated shape tags.
 */
public class FindingBucketer {

    private final StateDependencyGraph sdg;
    private final PseudoVariables pseudo;
    private final StorageLayoutResolver layout;
    private final VariableDescriber describer;
    private final int maxSitesPerVariable;

    private final Map<TransactionSet, Map<StateVar, List<ClassifiedPair>>> buckets = new LinkedHashMap<>();
    private final Map<ShapeKey, ShapeTags> shapes = new HashMap<>();

    private record ShapeKey(TransactionSet txSet, String variable) {
    }

    /**
     * @param sdg                 Pruned graph
     * @param pseudo              Synthesized groups
     * @param layout              Storage layout for metadata and selectors
     * @param maxSitesPerVariable Pairs sampled per variable into a finding
     */
    public FindingBucketer(StateDependencyGraph sdg, PseudoVariables pseudo, StorageLayoutResolver layout,
                           int maxSitesPerVariable) {
        this.sdg = sdg;
        this.pseudo = pseudo;
        this.layout = layout;
        this.describer = new VariableDescriber(sdg, layout);
        this.maxSitesPerVariable = maxSitesPerVariable;
    }

    public void add(ClassifiedPair pair) {
        TransactionSet tx = pair.txSet();
        Map<StateVar, List<ClassifiedPair>> byVar = buckets.computeIfAbsent(tx, k -> new LinkedHashMap<>());
        record(tx, pair.variable(), pair, byVar);
        for (VariableGroup group : pseudo.groupsContaining(pair.variable())) {
            if (!group.equals(pair.variable())) {
                record(tx, group, pair, byVar);
            }
        }
    }

    private void record(TransactionSet tx, StateVar variable, ClassifiedPair pair,
                        Map<StateVar, List<ClassifiedPair>> byVar) {
        byVar.computeIfAbsent(variable, k -> new ArrayList<>()).add(pair);
        ShapeTags tags = new ShapeTags(pair.sharedCallee(), pair.reentrant());
        shapes.merge(new ShapeKey(tx, variable.identity()), tags, ShapeTags::merge);
    }

    public int bucketCount() {
        return buckets.size();
    }

    /**
     * One finding per bucket, in insertion order, before deduplication.
     */
    public List<Finding> findings() {
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<TransactionSet, Map<StateVar, List<ClassifiedPair>>> e : buckets.entrySet()) {
            findings.add(toFinding(e.getKey(), e.getValue()));
        }
        return findings;
    }

    private Finding toFinding(TransactionSet tx, Map<StateVar, List<ClassifiedPair>> byVar) {
        List<StateVar> vars = List.copyOf(byVar.keySet());

        Set<SiteSample> writers = new LinkedHashSet<>();
        Set<SiteSample> readers = new LinkedHashSet<>();
        Set<PairPattern> patterns = EnumSet.noneOf(PairPattern.class);
        for (List<ClassifiedPair> pairs : byVar.values()) {
            for (ClassifiedPair pair : pairs.subList(0, Math.min(pairs.size(), maxSitesPerVariable))) {
                writers.add(site(pair.writer()));
                readers.add(site(pair.reader()));
                patterns.add(pair.pattern());
            }
        }

        ShapeTags aggregate = ShapeTags.NONE;
        List<Finding.VariableShape> perVar = new ArrayList<>();
        List<VariableMetadata> metadata = new ArrayList<>();
        for (StateVar v : vars) {
            ShapeTags tags = shapeOf(tx, v);
            aggregate = aggregate.merge(tags);
            VariableMetadata meta = describer.describe(v);
            metadata.add(meta);
            perVar.add(new Finding.VariableShape(meta, tags));
        }

        List<PairPattern> sortedPatterns = patterns.stream()
                .sorted((a, b) -> a.label().compareTo(b.label()))
                .toList();
        return new Finding(classify(vars), metadata, tx.entries(), List.copyOf(writers), List.copyOf(readers),
                sortedPatterns, aggregate, perVar, vars.stream().map(StateVar::identity).toList());
    }

    private ShapeTags shapeOf(TransactionSet tx, StateVar variable) {
        return shapes.getOrDefault(new ShapeKey(tx, variable.identity()), ShapeTags.NONE);
    }

    /**
     * One non-group variable is single-variable; otherwise the declaring
     * contracts of the concrete variables decide.
     */
    static BucketClass classify(List<StateVar> vars) {
        if (vars.size() == 1 && !(vars.get(0) instanceof VariableGroup)) {
            return BucketClass.SINGLE_VAR_CROSS_TX;
        }
        long contracts = vars.stream()
                .map(StateVar::declaringContract)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        return contracts == 1 ? BucketClass.MULTI_VAR_INTRA_CONTRACT : BucketClass.MULTI_VAR_CROSS_CONTRACT;
    }

    SiteSample site(BlockId block) {
        FunctionModel fn = sdg.function(block.function()).orElse(null);
        if (fn == null) {
            return new SiteSample(block.function(), "", SourceLocation.UNKNOWN.file(), 0);
        }
        SourceLocation location = fn.node(block.node())
                .map(NodeModel::source)
                .orElse(SourceLocation.UNKNOWN);
        return new SiteSample(fn.id(), layout.selectorOf(fn), location.file(), location.startLine());
    }
}
