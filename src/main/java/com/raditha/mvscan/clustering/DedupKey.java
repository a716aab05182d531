package com.raditha.mvscan.clustering;

import com.raditha.mvscan.model.BucketClass;
import com.raditha.mvscan.model.Finding;
import com.raditha.mvscan.model.PairPattern;
import com.raditha.mvscan.model.SiteSample;

import java.util.List;
import java.util.Set;

/**
 * Identity of a finding for deduplication.
 * <p>
 * The coarse key describes the shape of a finding: class, variable identities,
 * transaction set, patterns and shape tags. The strict key describes its
 * sites: class, variable names, transaction set, writer and reader sites.
 * Components not used by a mode are left empty.
 */
public record DedupKey(
        BucketClass bucketClass,
        List<String> variables,
        List<String> txSet,
        List<String> patterns,
        boolean reentrant,
        boolean sharedCallee,
        Set<SiteSample> writers,
        Set<SiteSample> readers) {

    public static DedupKey of(Finding finding, boolean coarse) {
        return coarse ? coarse(finding) : strict(finding);
    }

    public static DedupKey coarse(Finding finding) {
        return new DedupKey(
                finding.bucketClass(),
                finding.varKeys().stream().sorted().toList(),
                finding.txSet(),
                finding.opPatterns().stream().map(PairPattern::label).sorted().toList(),
                finding.shape().reentrant(),
                finding.shape().sharedCallee(),
                Set.of(),
                Set.of());
    }

    public static DedupKey strict(Finding finding) {
        return new DedupKey(
                finding.bucketClass(),
                finding.variableNames().stream().sorted().toList(),
                finding.txSet(),
                List.of(),
                false,
                false,
                Set.copyOf(finding.writers()),
                Set.copyOf(finding.readers()));
    }
}
