package com.raditha.mvscan.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.raditha.mvscan.analyzer.AnalysisReport;
import com.raditha.mvscan.model.BucketClass;
import com.raditha.mvscan.model.Finding;
import com.raditha.mvscan.model.PairPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Exports findings as a JSON array for downstream exploit generation, and
 * summary metrics as CSV for historical tracking.
 */
public class FindingExporter {

    private static final Logger logger = LoggerFactory.getLogger(FindingExporter.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();

    /**
     * Summary of one analysis run.
     */
    public record RunMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalFindings,
            int pairsEnumerated,
            int reachableBlocks,
            Map<BucketClass, Integer> findingsByClass,
            Map<PairPattern, Integer> findingsByPattern,
            int reentrantFindings) {
    }

    public RunMetrics buildMetrics(AnalysisReport report, String projectName) {
        Map<BucketClass, Integer> byClass = new EnumMap<>(BucketClass.class);
        Map<PairPattern, Integer> byPattern = new EnumMap<>(PairPattern.class);
        int reentrant = 0;
        for (Finding finding : report.findings()) {
            byClass.merge(finding.bucketClass(), 1, Integer::sum);
            for (PairPattern pattern : finding.opPatterns()) {
                byPattern.merge(pattern, 1, Integer::sum);
            }
            if (finding.shape().reentrant()) {
                reentrant++;
            }
        }
        return new RunMetrics(projectName, LocalDateTime.now(), report.getFindingCount(),
                report.pairsEnumerated(), report.reachableBlocks(), byClass, byPattern, reentrant);
    }

    /**
     * Write findings as a pretty-printed JSON array.
     */
    public void exportFindings(List<Finding> findings, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer.writeValue(outputPath.toFile(), findings);
        logger.info("Wrote {} findings to {}", findings.size(), outputPath);
    }

    public String toJson(List<Finding> findings) throws IOException {
        return writer.writeValueAsString(findings);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("timestamp,project,total_findings,pairs_enumerated,reachable_blocks,reentrant_findings\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.projectName(),
                metrics.totalFindings(),
                metrics.pairsEnumerated(),
                metrics.reachableBlocks(),
                metrics.reentrantFindings()));

        csv.append("\n");
        csv.append("# Findings by class\n");
        csv.append("class,count\n");
        for (BucketClass bucketClass : BucketClass.values()) {
            csv.append(String.format("%s,%d\n", bucketClass.label(),
                    metrics.findingsByClass().getOrDefault(bucketClass, 0)));
        }

        csv.append("\n");
        csv.append("# Findings by pattern\n");
        csv.append("pattern,count\n");
        for (PairPattern pattern : PairPattern.values()) {
            csv.append(String.format("%s,%d\n", pattern.label(),
                    metrics.findingsByPattern().getOrDefault(pattern, 0)));
        }

        Files.writeString(outputPath, csv.toString());
    }
}
