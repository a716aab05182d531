package com.raditha.mvscan.analyzer;

import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.filter.PairFilterChain.FilterStats;
import com.raditha.mvscan.model.BucketClass;
import com.raditha.mvscan.model.Finding;
import com.raditha.mvscan.model.PairPattern;
import com.raditha.mvscan.model.ShapeTags;
import com.raditha.mvscan.model.SiteSample;
import com.raditha.mvscan.model.VariableKind;
import com.raditha.mvscan.model.VariableMetadata;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisReportTest {

    private static final FilterStats STATS = new FilterStats(0, 1, 2, 0, 0, 1);

    private static Finding finding() {
        VariableMetadata meta = new VariableMetadata("fee", VariableKind.STATE, null, null, null, null, null, null);
        List<SiteSample> writers = List.of(
                new SiteSample("Fees.setFee(uint256)", "0x69fe0e2d", "Fees.sol", 12),
                new SiteSample("Fees.reset()", "0xd826f88f", "Fees.sol", 20),
                new SiteSample("Fees.bump()", "0x00000001", "Fees.sol", 30));
        List<SiteSample> readers = List.of(new SiteSample("Fees.charge(uint256)", "0x00000002", "Fees.sol", 40));
        return new Finding(BucketClass.SINGLE_VAR_CROSS_TX, List.of(meta),
                List.of("Fees.charge(uint256)", "Fees.setFee(uint256)"), writers, readers,
                List.of(PairPattern.DESTRUCTIVE_WRITE), ShapeTags.NONE,
                List.of(new Finding.VariableShape(meta, ShapeTags.NONE)), List.of("SV:Fees.fee"));
    }

    @Test
    void testSummary() {
        AnalysisReport report = new AnalysisReport(List.of(finding()), 10, 7, 3, 4, STATS, DetectorConfig.defaults());

        assertEquals("Found 1 findings from 4 pairs (7 of 10 blocks reachable from 3 entries, sink: none)",
                report.getSummary());
        assertTrue(report.hasFindings());
        assertEquals(1, report.getFindingCount());
    }

    @Test
    void testDetailedReportShowsTwoSitesPerSide() {
        AnalysisReport report = new AnalysisReport(List.of(finding()), 10, 7, 3, 4, STATS, DetectorConfig.defaults());

        String text = report.getDetailedReport();

        assertTrue(text.contains("INCONSISTENT STATE REPORT"));
        assertTrue(text.contains("Budget: 1000"));
        assertTrue(text.contains("[single_var_cross_tx] fee"));
        assertTrue(text.contains("tx-set -> Fees.charge(uint256), Fees.setFee(uint256)"));
        assertTrue(text.contains("Fees.sol:12"));
        assertTrue(text.contains("Fees.sol:20"));
        assertFalse(text.contains("Fees.sol:30"));
        assertTrue(text.contains("read\tFees.sol:40"));
    }

    @Test
    void testEmptyReport() {
        DetectorConfig unbounded = DetectorConfig.builder().divergenceBudget(DetectorConfig.UNBOUNDED).build();
        AnalysisReport report = new AnalysisReport(List.of(), 0, 0, 0, 0, new FilterStats(0, 0, 0, 0, 0, 0),
                unbounded);

        String text = report.getDetailedReport();

        assertFalse(report.hasFindings());
        assertTrue(text.contains("Budget: unbounded"));
        assertTrue(text.contains("No inconsistent state found."));
    }

    @Test
    void testFindingsAreCopied() {
        List<Finding> findings = new ArrayList<>(List.of(finding()));
        AnalysisReport report = new AnalysisReport(findings, 1, 1, 1, 1, STATS, DetectorConfig.defaults());

        findings.clear();

        assertEquals(1, report.getFindingCount());
        assertThrows(UnsupportedOperationException.class, () -> report.findings().clear());
    }
}
