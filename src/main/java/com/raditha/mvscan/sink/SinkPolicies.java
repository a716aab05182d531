package com.raditha.mvscan.sink;

import com.raditha.mvscan.analyzer.AnalysisContext;
import com.raditha.mvscan.config.DetectorConfig;

/**
 * Creates the sink policy selected by the configuration.
 */
public final class SinkPolicies {

    private SinkPolicies() {
    }

    public static SinkPolicy create(DetectorConfig config, AnalysisContext context) {
        return switch (config.sinkMode()) {
            case SAME_VARIABLE -> new SameVariableSinkPolicy(config.divergenceBudget());
            case VALUE_INFLUENCE -> new ValueInfluenceSinkPolicy(config.divergenceBudget(),
                    context.canonicalizer(), context.normalizer());
            case NONE -> new DisabledSinkPolicy();
        };
    }
}
