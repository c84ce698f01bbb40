package com.beamcut.web;

import com.beamcut.domain.OptimizerParams;
import com.beamcut.domain.RequiredPart;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CuttingRequest {
    private Double rawLength;
    private List<RequiredPart> parts;
    private String profile; // "QUICK", "BALANCED" or "THOROUGH"
    private ParamsDto params;

    /**
     * Optional overrides, applied on top of the selected profile.
     */
    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ParamsDto {
        private Integer populationSize;
        private Integer maxGenerations;
        private Integer stallLimit;
        private Double crossoverProbability;
        private Double mutationProbability;
        private Integer tournamentSize;
        private Integer eliteCount;
        private Double beamWeight;
        private Double wasteWeight;
        private Double fillWeight;
        private Long randomSeed;
        private Boolean parallelEvaluation;
        private Long timeLimitMillis;
        private Boolean verifyGenotypes;
        private Boolean stopAtLowerBound;

        public OptimizerParams applyTo(OptimizerParams base) {
            OptimizerParams.OptimizerParamsBuilder b = base.toBuilder();
            if (populationSize != null) b.populationSize(populationSize);
            if (maxGenerations != null) b.maxGenerations(maxGenerations);
            if (stallLimit != null) b.stallLimit(stallLimit);
            if (crossoverProbability != null) b.crossoverProbability(crossoverProbability);
            if (mutationProbability != null) b.mutationProbability(mutationProbability);
            if (tournamentSize != null) b.tournamentSize(tournamentSize);
            if (eliteCount != null) b.eliteCount(eliteCount);
            if (beamWeight != null) b.beamWeight(beamWeight);
            if (wasteWeight != null) b.wasteWeight(wasteWeight);
            if (fillWeight != null) b.fillWeight(fillWeight);
            if (randomSeed != null) b.randomSeed(randomSeed);
            if (parallelEvaluation != null) b.parallelEvaluation(parallelEvaluation);
            if (timeLimitMillis != null) b.timeLimitMillis(timeLimitMillis);
            if (verifyGenotypes != null) b.verifyGenotypes(verifyGenotypes);
            if (stopAtLowerBound != null) b.stopAtLowerBound(stopAtLowerBound);
            return b.build();
        }
    }
}
