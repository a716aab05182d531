package com.raditha.mvscan.analyzer;

import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.filter.PairFilterChain.FilterStats;
import com.raditha.mvscan.model.Finding;
import com.raditha.mvscan.model.SiteSample;

import java.util.List;

/**
 * Report containing inconsistent-state findings for one compilation unit.
 *
 * @param findings       Deduplicated findings
 * @param totalBlocks    Blocks in the graph before pruning
 * @param reachableBlocks Blocks reachable from user-callable entries
 * @param entryCount     User-callable entries
 * @param pairsEnumerated Raw write/read pairs before filtering
 * @param filterStats    Pairs dropped per filter
 * @param config         Configuration the analysis ran with
 */
public record AnalysisReport(
        List<Finding> findings,
        int totalBlocks,
        int reachableBlocks,
        int entryCount,
        int pairsEnumerated,
        FilterStats filterStats,
        DetectorConfig config) {

    /**
     * Sites printed per side in the text report.
     */
    private static final int SITES_SHOWN = 2;

    public AnalysisReport {
        findings = List.copyOf(findings);
    }

    public int getFindingCount() {
        return findings.size();
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d findings from %d pairs (%d of %d blocks reachable from %d entries, sink: %s)",
                findings.size(),
                pairsEnumerated,
                reachableBlocks,
                totalBlocks,
                entryCount,
                config.sinkMode().toCliString());
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("INCONSISTENT STATE REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Budget: ").append(config.isUnbounded() ? "unbounded" : config.divergenceBudget()).append("\n");
        sb.append("Filters: ").append(filterStats).append("\n\n");
        sb.append(getSummary()).append("\n");

        if (findings.isEmpty()) {
            sb.append("\nNo inconsistent state found.\n");
        } else {
            for (Finding finding : findings) {
                sb.append(formatFinding(finding)).append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * Text block of one finding: class and variables, transaction set, and the
     * first writer and reader sites.
     */
    public static String formatFinding(Finding finding) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n[").append(finding.bucketClass().label()).append("] ")
                .append(String.join(", ", finding.variableNames())).append("\n");
        sb.append("  tx-set -> ").append(String.join(", ", finding.txSet())).append("\n");
        appendSites(sb, "write", finding.writers());
        appendSites(sb, "read", finding.readers());
        return sb.toString();
    }

    private static void appendSites(StringBuilder sb, String label, List<SiteSample> sites) {
        for (SiteSample site : sites.subList(0, Math.min(SITES_SHOWN, sites.size()))) {
            sb.append("\n • ").append(label).append("\t").append(site.location())
                    .append("  (").append(site.sig()).append(")\n");
        }
    }
}
