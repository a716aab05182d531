package com.raditha.mvscan.clustering;

import com.raditha.mvscan.model.Finding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the first finding of every {@link DedupKey}.
 */
public class FindingDeduplicator {

    private final boolean coarse;

    public FindingDeduplicator(boolean coarse) {
        this.coarse = coarse;
    }

    public List<Finding> deduplicate(List<Finding> findings) {
        Set<DedupKey> seen = new HashSet<>();
        List<Finding> unique = new ArrayList<>();
        for (Finding finding : findings) {
            if (seen.add(DedupKey.of(finding, coarse))) {
                unique.add(finding);
            }
        }
        return unique;
    }
}
