package com.raditha.mvscan.analysis;

import com.raditha.mvscan.ModelFixtures;
import com.raditha.mvscan.analyzer.AnalysisContext;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.frontend.ContractModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeKind;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.normalization.Latch;
import com.raditha.mvscan.normalization.LatchForm;
import com.raditha.mvscan.reachability.EntryNameNormalizer;
import com.raditha.mvscan.sdg.StateDependencyGraph;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.raditha.mvscan.ModelFixtures.function;
import static com.raditha.mvscan.ModelFixtures.node;
import static com.raditha.mvscan.ModelFixtures.param;
import static com.raditha.mvscan.ModelFixtures.ref;
import static org.junit.jupiter.api.Assertions.*;

class InitializerAnalyzerTest {

    private static final String CONFIGURE = "Fees.configure(uint256)";
    private static final StorageVariable FEE = StorageVariable.of("Fees", "fee");
    private static final StorageVariable CONFIGURED = StorageVariable.of("Fees", "configured");

    private static InitializerAnalyzer analyzer(CompilationUnitModel unit) {
        AnalysisContext context = ModelFixtures.context(unit);
        StateDependencyGraph sdg = ModelFixtures.sdgOf(context);
        return new InitializerAnalyzer(sdg, context.normalizer(), new EntryNameNormalizer(List.of(), false));
    }

    /**
     * The fees contract with extra functions appended.
     */
    private static CompilationUnitModel feesWith(FunctionModel... extra) {
        ContractModel fees = ModelFixtures.fees().contracts().get(0);
        List<FunctionModel> functions = new ArrayList<>(fees.functions());
        functions.addAll(List.of(extra));
        return ModelFixtures.unit(ModelFixtures.contract("Fees", fees.stateVariables(),
                functions.toArray(new FunctionModel[0])));
    }

    @Test
    void testLatchedSetterIsInitOnly() {
        InitializerAnalyzer.InitializerFacts facts = analyzer(ModelFixtures.fees()).analyze();

        assertTrue(facts.isInitOnly(FEE));
        assertTrue(facts.isInitOnly(CONFIGURED));
        assertFalse(facts.isInitOnly(StorageVariable.of("Fees", "total")));
        assertEquals(Map.of(CONFIGURE, Set.of("configured")), facts.latchesByEntry());
    }

    @Test
    void testPostGuardedEntryIsBenign() {
        FunctionModel use = function("Fees", "use", List.of(), "external",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.REQUIRE, "require(configured)").succ(2).reads(ref("Fees", "configured")),
                node(2, NodeKind.EXPRESSION, "total = fee").reads(ref("Fees", "fee"))
                        .writes(ref("Fees", "total")).assigns("total", "fee"));

        InitializerAnalyzer.InitializerFacts facts = analyzer(feesWith(use)).analyze();

        assertEquals(Set.of("Fees.use()"), facts.postGuardedByLatch().get("configured"));
        assertTrue(facts.isBenign(CONFIGURE, "Fees.use()"));
        assertFalse(facts.isBenign(CONFIGURE, "Fees.charge(uint256)"));
        assertFalse(facts.isBenign("Fees.use()", CONFIGURE));
    }

    @Test
    void testResetDefeatsLatch() {
        FunctionModel unlock = function("Fees", "unlock", List.of(), "external",
                node(0, NodeKind.EXPRESSION, "configured = false")
                        .writes(ref("Fees", "configured")).assigns("configured", "false"));

        InitializerAnalyzer.InitializerFacts facts = analyzer(feesWith(unlock)).analyze();

        assertFalse(facts.isInitOnly(FEE));
        assertFalse(facts.isInitOnly(CONFIGURED));
        assertTrue(facts.latchesByEntry().isEmpty());
    }

    @Test
    void testUnguardedSecondWriter() {
        FunctionModel setFee = function("Fees", "setFee", List.of(param("v", "uint256")), "external",
                node(0, NodeKind.EXPRESSION, "fee = v").writes(ref("Fees", "fee")).assigns("fee", "v"));

        InitializerAnalyzer.InitializerFacts facts = analyzer(feesWith(setFee)).analyze();

        assertFalse(facts.isInitOnly(FEE));
        assertTrue(facts.isInitOnly(CONFIGURED));
    }

    @Test
    void testCreationPhaseWriters() {
        FunctionModel constructor = function("Own", "constructor", List.of(), "public",
                node(0, NodeKind.EXPRESSION, "owner = msg.sender")
                        .writes(ref("Own", "owner")).assigns("owner", "msg.sender"));
        FunctionModel setup = function("Own", "setup", List.of(), "external",
                node(0, NodeKind.EXPRESSION, "admin = msg.sender")
                        .writes(ref("Own", "admin")).assigns("admin", "msg.sender"));
        FunctionModel boot = function("Own", "boot", List.of(), "external", "nonpayable", List.of("initializer"),
                node(0, NodeKind.EXPRESSION, "cap = 1").writes(ref("Own", "cap")).assigns("cap", "1"));
        FunctionModel poke = function("Own", "poke", List.of(), "external",
                node(0, NodeKind.EXPRESSION, "counter += 1").reads(ref("Own", "counter"))
                        .writes(ref("Own", "counter")).assigns("counter", "counter + 1"));
        InitializerAnalyzer analyzer = analyzer(ModelFixtures.unit(ModelFixtures.contract("Own",
                List.of(ModelFixtures.stateVar("owner", "address"), ModelFixtures.stateVar("admin", "address"),
                        ModelFixtures.stateVar("cap", "uint256"), ModelFixtures.stateVar("counter", "uint256")),
                constructor, setup, boot, poke)));

        assertTrue(analyzer.isCreationPhase(new BlockId("Own.setup()", 0)));
        assertTrue(analyzer.isCreationPhase(new BlockId("Own.boot()", 0)));
        assertFalse(analyzer.isCreationPhase(new BlockId("Own.poke()", 0)));
        assertEquals(Set.of(StorageVariable.of("Own", "owner"), StorageVariable.of("Own", "admin"),
                StorageVariable.of("Own", "cap")), analyzer.initOnlyVariables());
    }

    @Test
    void testMonotoneFlipIncludesWriteBlock() {
        InitializerAnalyzer analyzer = analyzer(ModelFixtures.fees());
        Latch latch = Latch.of("configured", LatchForm.BOOL);

        assertTrue(analyzer.hasMonotoneFlip(latch, new BlockId(CONFIGURE, 3)));
        assertTrue(analyzer.hasMonotoneFlip(latch, new BlockId(CONFIGURE, 1)));
        assertFalse(analyzer.hasMonotoneFlip(latch, new BlockId("Fees.charge(uint256)", 0)));
        assertFalse(analyzer.hasReset(latch));
        assertTrue(analyzer.entryPathsGuarded(latch, new BlockId(CONFIGURE, 2)));
        assertTrue(analyzer.passesMonotoneLatch(new BlockId(CONFIGURE, 2)));
    }

    @Test
    void testInitializerLatchesRequireGuard() {
        InitializerAnalyzer analyzer = analyzer(ModelFixtures.fees());
        FunctionModel charge = ModelFixtures.fees().contracts().get(0).functions().get(1);

        assertTrue(analyzer.initializerLatches(charge).isEmpty());
    }
}
