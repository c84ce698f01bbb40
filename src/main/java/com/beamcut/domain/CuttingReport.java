package com.beamcut.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything the result page renders for one cutting request.
 * JSON names follow the fields the visualization templates read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CuttingReport {
    // Assigned when the report is stored, not part of the result itself
    @JsonProperty("request_id")
    @EqualsAndHashCode.Exclude
    private Long requestId;

    @JsonProperty("raw_length")
    private double rawLength;

    @JsonProperty("genotype_waste")
    private double genotypeWaste;

    @JsonProperty("beam_count")
    private int beamCount;

    @JsonProperty("all_elements_length")
    private double allElementsLength;

    // percentage 0-100, rounding is left to the page
    @JsonProperty("surowca_utilization")
    private double rawMaterialUtilization;

    @JsonProperty("unique_element_lengths_and_count_dict")
    @JsonSerialize(keyUsing = LengthKeySerializer.class)
    private Map<Double, Integer> lengthHistogram;

    @JsonProperty("patterns")
    private List<Pattern> patterns;

    @JsonProperty("pattern_usages")
    private List<PatternUsage> patternUsages;

    // Run info
    @JsonProperty("cancelled")
    private boolean cancelled;

    @JsonProperty("stop_reason")
    private String stopReason;

    @JsonProperty("generations")
    private int generations;

    @JsonProperty("random_seed")
    private long randomSeed;

    @JsonProperty("best_fitness")
    private double bestFitness;

    @JsonProperty("lower_bound_beam_count")
    private int lowerBoundBeamCount;

    // Wall-clock, differs between replays of the same seed
    @JsonProperty("computation_time_ms")
    @EqualsAndHashCode.Exclude
    private long computationTimeMs;
}
