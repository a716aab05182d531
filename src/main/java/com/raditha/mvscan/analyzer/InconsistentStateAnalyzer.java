package com.raditha.mvscan.analyzer;

import com.raditha.mvscan.analysis.InitializerAnalyzer;
import com.raditha.mvscan.analysis.InitializerAnalyzer.InitializerFacts;
import com.raditha.mvscan.analysis.PairClassifier;
import com.raditha.mvscan.analysis.PairEnumerator;
import com.raditha.mvscan.analysis.SelfCopyDetector;
import com.raditha.mvscan.analysis.StateEffectAnalyzer;
import com.raditha.mvscan.clustering.FindingBucketer;
import com.raditha.mvscan.clustering.FindingDeduplicator;
import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.filter.PairFilterChain;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.Finding;
import com.raditha.mvscan.model.StalePair;
import com.raditha.mvscan.reachability.EntryNameNormalizer;
import com.raditha.mvscan.reachability.EntryPointClassifier;
import com.raditha.mvscan.reachability.ReachabilityPruner;
import com.raditha.mvscan.reachability.ReachabilityPruner.PruneResult;
import com.raditha.mvscan.sdg.CallGraph;
import com.raditha.mvscan.sdg.PseudoVariableSynthesizer;
import com.raditha.mvscan.sdg.PseudoVariableSynthesizer.PseudoVariables;
import com.raditha.mvscan.sdg.SdgBuilder;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import com.raditha.mvscan.sink.SinkPolicies;
import com.raditha.mvscan.sink.SinkPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Main orchestrator for inconsistent-state detection.
 * Builds the state dependency graph, restricts it to user-reachable blocks,
 * enumerates and filters write/read pairs, then buckets and deduplicates
 * the survivors into findings.
 */
public class InconsistentStateAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(InconsistentStateAnalyzer.class);

    private final DetectorConfig config;

    /**
     * Create analyzer with default configuration.
     */
    public InconsistentStateAnalyzer() {
        this(DetectorConfig.defaults());
    }

    public InconsistentStateAnalyzer(DetectorConfig config) {
        this.config = config;
    }

    public DetectorConfig getConfig() {
        return config;
    }

    /**
     * Analyze one compilation unit.
     *
     * @param unit Front-end model of the contracts
     * @return Report with deduplicated findings
     */
    public AnalysisReport analyze(CompilationUnitModel unit) {
        AnalysisContext context = new AnalysisContext(unit, config.projectRoot());

        // Step 1: build the graph
        StateDependencyGraph sdg = new SdgBuilder(context, config.promoteMappingBase()).build();
        int totalBlocks = sdg.size();

        EntryNameNormalizer entryNames = new EntryNameNormalizer(config.atomicGroup(), config.mergeOverloads());
        EntryPointClassifier classifier = new EntryPointClassifier(context.normalizer(),
                config.userCallableAlways(), config.userCallableDeny(), config.includeRoleGated());

        // Step 2: facts that need the unpruned graph
        Set<String> adminOnly = sdg.functions().stream()
                .filter(classifier::isAdminOnly)
                .map(FunctionModel::id)
                .collect(Collectors.toSet());
        context.markAdminOnly(adminOnly);
        InitializerFacts initFacts = config.initOnlyFilter()
                ? new InitializerAnalyzer(sdg, context.normalizer(), entryNames).analyze()
                : InitializerFacts.NONE;

        // Step 3: pseudo-variables and call graph
        PseudoVariables pseudo = new PseudoVariableSynthesizer().synthesize(sdg);
        CallGraph callGraph = CallGraph.build(sdg.functions());

        // Step 4: restrict to user-reachable blocks
        Set<BlockId> entries = classifier.publicEntries(sdg);
        PruneResult pruned = new ReachabilityPruner(entryNames).prune(sdg, entries);

        // Step 5: enumerate, filter, classify and bucket
        PairEnumerator enumerator = new PairEnumerator(sdg,
                new StateEffectAnalyzer(sdg, callGraph),
                new SelfCopyDetector(context.canonicalizer(), context.normalizer(), config.aliasHops()),
                config);
        SinkPolicy sinkPolicy = SinkPolicies.create(config, context);
        PairFilterChain filters = new PairFilterChain(config, context.adminOnly(), initFacts, sinkPolicy, sdg);
        PairClassifier pairClassifier = new PairClassifier(callGraph);
        FindingBucketer bucketer = new FindingBucketer(sdg, pseudo, context.layout(), config.maxSitesPerVariable());

        List<StalePair> pairs = enumerator.enumeratePairs().toList();
        for (StalePair pair : pairs) {
            String writerEntry = pruned.owner(pair.writer());
            String readerEntry = pruned.owner(pair.reader());
            if (filters.accept(pair, writerEntry, readerEntry)) {
                bucketer.add(pairClassifier.classify(pair, writerEntry, readerEntry));
            }
        }
        logger.info("Pair filters: {}", filters.getStats());

        // Step 6: deduplicate
        List<Finding> findings = new FindingDeduplicator(config.coarseDedup()).deduplicate(bucketer.findings());
        logger.info("Emitting {} findings from {} buckets", findings.size(), bucketer.bucketCount());

        return new AnalysisReport(findings, totalBlocks, sdg.size(), entries.size(), pairs.size(),
                filters.getStats(), config);
    }
}
