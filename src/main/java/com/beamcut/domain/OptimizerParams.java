package com.beamcut.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizerParams {
    // Population
    private int populationSize;
    private int maxGenerations;      // hard cap, always enforced
    private int stallLimit;          // generations without improvement before stopping, 0 = off

    // Operators
    private double crossoverProbability;
    private double mutationProbability;
    private int tournamentSize;
    private int eliteCount;

    // Fitness weights (lower fitness is better)
    private double beamWeight;
    private double wasteWeight;
    private double fillWeight;       // tie-breaker between plans with the same beam count, at most beamWeight

    // Run control
    private Long randomSeed;         // null = draw one and report it
    private boolean parallelEvaluation;
    private long timeLimitMillis;    // 0 = no wall-clock limit
    private boolean verifyGenotypes;
    private boolean stopAtLowerBound;

    // --- EFFORT PROFILES ---

    /**
     * QUICK PROFILE
     * - Small population, short run, early stall stop.
     * - Meant for interactive previews of short part lists.
     */
    public static OptimizerParams forQuickRun() {
        return forBalancedRun().toBuilder()
                .populationSize(30)
                .maxGenerations(40)
                .stallLimit(10)
                .build();
    }

    /**
     * BALANCED PROFILE
     * - Default for the web form.
     */
    public static OptimizerParams forBalancedRun() {
        return OptimizerParams.builder()
                .populationSize(50)
                .maxGenerations(100)
                .stallLimit(30)
                .crossoverProbability(0.9)
                .mutationProbability(0.2)
                .tournamentSize(3)
                .eliteCount(1)
                .beamWeight(1.0)
                .wasteWeight(0.001)
                .fillWeight(0.5)
                .randomSeed(null)
                .parallelEvaluation(true)
                .timeLimitMillis(0)
                .verifyGenotypes(true)
                .stopAtLowerBound(true)
                .build();
    }

    /**
     * THOROUGH PROFILE
     * - Large population and long patience for big part lists.
     */
    public static OptimizerParams forThoroughRun() {
        return forBalancedRun().toBuilder()
                .populationSize(120)
                .maxGenerations(400)
                .stallLimit(80)
                .tournamentSize(4)
                .eliteCount(2)
                .build();
    }

    public static OptimizerParams defaults() {
        return forBalancedRun();
    }

    /**
     * @throws InvalidInputException naming the first parameter out of range
     */
    public void validate() {
        if (populationSize < 1) {
            throw new InvalidInputException("populationSize must be at least 1, got " + populationSize);
        }
        if (maxGenerations < 0) {
            throw new InvalidInputException("maxGenerations must not be negative, got " + maxGenerations);
        }
        if (stallLimit < 0) {
            throw new InvalidInputException("stallLimit must not be negative, got " + stallLimit);
        }
        checkProbability("crossoverProbability", crossoverProbability);
        checkProbability("mutationProbability", mutationProbability);
        if (tournamentSize < 1) {
            throw new InvalidInputException("tournamentSize must be at least 1, got " + tournamentSize);
        }
        if (eliteCount < 1 || eliteCount > populationSize) {
            throw new InvalidInputException("eliteCount must be between 1 and populationSize, got " + eliteCount);
        }
        checkWeight("beamWeight", beamWeight);
        checkWeight("wasteWeight", wasteWeight);
        checkWeight("fillWeight", fillWeight);
        if (beamWeight == 0 && wasteWeight == 0) {
            throw new InvalidInputException("beamWeight and wasteWeight must not both be zero");
        }
        // fill term is below 1, so this keeps one extra beam always worse
        if (fillWeight > beamWeight) {
            throw new InvalidInputException("fillWeight must not exceed beamWeight (" + beamWeight + "), got " + fillWeight);
        }
        if (timeLimitMillis < 0) {
            throw new InvalidInputException("timeLimitMillis must not be negative, got " + timeLimitMillis);
        }
    }

    private static void checkProbability(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidInputException(name + " must be within [0, 1], got " + value);
        }
    }

    private static void checkWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidInputException(name + " must be a non-negative number, got " + value);
        }
    }
}
