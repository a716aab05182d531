package com.raditha.mvscan.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.mvscan.ModelFixtures;
import com.raditha.mvscan.analyzer.AnalysisReport;
import com.raditha.mvscan.analyzer.InconsistentStateAnalyzer;
import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.model.BucketClass;
import com.raditha.mvscan.model.PairPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FindingExporterTest {

    @TempDir
    Path tempDir;

    private AnalysisReport report;
    private final FindingExporter exporter = new FindingExporter();

    @BeforeEach
    void setUp() {
        report = new InconsistentStateAnalyzer(DetectorConfig.builder().projectRoot(tempDir).build())
                .analyze(ModelFixtures.vault());
    }

    @Test
    void testExportFindingsJson() throws IOException {
        Path out = tempDir.resolve("reports/findings.json");

        exporter.exportFindings(report.findings(), out);

        JsonNode root = new ObjectMapper().readTree(out.toFile());
        assertTrue(root.isArray());
        assertEquals(1, root.size());

        JsonNode finding = root.get(0);
        assertEquals("single_var_cross_tx", finding.get("pattern").asText());
        assertEquals("Vault.deposit()", finding.get("tx_set").get(0).asText());
        assertEquals("cross_tx_stale_read", finding.get("op_patterns").get(0).asText());
        assertEquals("destructive_write", finding.get("op_patterns").get(1).asText());
        assertFalse(finding.get("shape").get("reentrant").asBoolean());
        assertFalse(finding.has("varKeys"));
        assertFalse(finding.has("var_keys"));

        JsonNode variable = finding.get("vars").get(0);
        assertEquals("balances", variable.get("name").asText());
        assertEquals("mapping_slot", variable.get("kind").asText());
        assertEquals(0, variable.get("base_slot").asInt());
        assertFalse(variable.has("members"));

        JsonNode writer = finding.get("writers").get(0);
        assertTrue(writer.get("selector").asText().startsWith("0x"));
        assertEquals("Test.sol", writer.get("file").asText());
    }

    @Test
    void testEmptyFindingsIsEmptyArray() throws IOException {
        assertEquals("[ ]", exporter.toJson(List.of()));
    }

    @Test
    void testBuildMetrics() {
        FindingExporter.RunMetrics metrics = exporter.buildMetrics(report, "vault");

        assertEquals("vault", metrics.projectName());
        assertEquals(1, metrics.totalFindings());
        assertEquals(3, metrics.pairsEnumerated());
        assertEquals(1, metrics.findingsByClass().get(BucketClass.SINGLE_VAR_CROSS_TX));
        assertEquals(1, metrics.findingsByPattern().get(PairPattern.DESTRUCTIVE_WRITE));
        assertEquals(0, metrics.reentrantFindings());
    }

    @Test
    void testExportToCsv() throws IOException {
        Path csv = tempDir.resolve("metrics.csv");

        exporter.exportToCsv(exporter.buildMetrics(report, "vault"), csv);

        List<String> lines = Files.readAllLines(csv);
        assertEquals("# Run Summary", lines.get(0));
        assertTrue(lines.get(2).contains(",vault,1,3,"));
        assertTrue(lines.contains("single_var_cross_tx,1"));
        assertTrue(lines.contains("multi_var_cross_contract,0"));
        assertTrue(lines.contains("cross_tx_stale_read,1"));
        assertTrue(lines.contains("reentrant_stale_read,0"));
    }
}
