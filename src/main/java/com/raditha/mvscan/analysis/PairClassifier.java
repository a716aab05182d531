package com.raditha.mvscan.analysis;

import com.raditha.mvscan.model.ClassifiedPair;
import com.raditha.mvscan.model.PairPattern;
import com.raditha.mvscan.model.StalePair;
import com.raditha.mvscan.sdg.CallGraph;

/**
 * Attaches owning entries and shape tags to a pair. Pairs owned by different
 * entries whose functions reach each other through the call graph are
 * escalated to their reentrant pattern.
 */
public class PairClassifier {

    private final CallGraph callGraph;

    public PairClassifier(CallGraph callGraph) {
        this.callGraph = callGraph;
    }

    public ClassifiedPair classify(StalePair pair, String writerEntry, String readerEntry) {
        String writerFn = pair.writer().function();
        String readerFn = pair.reader().function();
        PairPattern pattern = pair.pattern();
        boolean reentrant = false;
        if (!writerEntry.equals(readerEntry) && callGraph.reentrant(writerFn, readerFn)) {
            pattern = pattern.reentrant();
            reentrant = true;
        }
        boolean sharedCallee = callGraph.sharesCallee(writerFn, readerFn);
        return new ClassifiedPair(pair, writerEntry, readerEntry, pattern, reentrant, sharedCallee);
    }
}
