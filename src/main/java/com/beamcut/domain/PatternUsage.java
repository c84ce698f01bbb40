package com.beamcut.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A distinct cutting pattern and the number of beams cut that way ("3 x [50, 30, 20]").
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternUsage {
    @JsonProperty("repetition")
    private int repetition;

    // sorted longest first so that equal multisets compare equal
    @JsonProperty("cuts")
    private List<Double> cuts;

    @JsonProperty("waste")
    private double waste;
}
