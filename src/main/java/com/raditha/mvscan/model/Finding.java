package com.raditha.mvscan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One deduplicated inconsistent-state finding.
 *
 * @param bucketClass Bucket classification
 * @param vars        Variables of the bucket
 * @param txSet       Sorted owning entries
 * @param writers     Sampled writer sites
 * @param readers     Sampled reader sites
 * @param opPatterns  Sorted pair patterns seen in the bucket
 * @param shape       Shape aggregated across variables
 * @param shapeByVar  Shape per variable
 * @param varKeys     Variable identities, used for deduplication only
 */
@JsonPropertyOrder({"pattern", "vars", "tx_set", "writers", "readers", "op_patterns", "shape", "shape_by_var"})
public record Finding(
        @JsonProperty("pattern") BucketClass bucketClass,
        @JsonProperty("vars") List<VariableMetadata> vars,
        @JsonProperty("tx_set") List<String> txSet,
        @JsonProperty("writers") List<SiteSample> writers,
        @JsonProperty("readers") List<SiteSample> readers,
        @JsonProperty("op_patterns") List<PairPattern> opPatterns,
        @JsonProperty("shape") ShapeTags shape,
        @JsonProperty("shape_by_var") List<VariableShape> shapeByVar,
        @JsonIgnore List<String> varKeys) {

    /**
     * Shape tags of one variable of the bucket.
     */
    public record VariableShape(
            @JsonProperty("var") VariableMetadata var,
            @JsonProperty("shape") ShapeTags shape) {
    }

    public Finding {
        vars = List.copyOf(vars);
        txSet = List.copyOf(txSet);
        writers = List.copyOf(writers);
        readers = List.copyOf(readers);
        opPatterns = List.copyOf(opPatterns);
        shapeByVar = List.copyOf(shapeByVar);
        varKeys = varKeys == null ? List.of() : List.copyOf(varKeys);
    }

    public List<String> variableNames() {
        return vars.stream().map(VariableMetadata::name).toList();
    }

    public boolean hasPattern(PairPattern pattern) {
        return opPatterns.contains(pattern);
    }
}
