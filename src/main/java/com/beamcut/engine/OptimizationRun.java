package com.beamcut.engine;

import com.beamcut.domain.CuttingPlan;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one optimizer run. The plan always belongs to a fully evaluated
 * genotype, also when the run was cancelled.
 */
@Value
@Builder
public class OptimizationRun {
    Genotype bestGenotype;
    CuttingPlan bestPlan;
    double bestFitness;
    int generations;
    StopReason stopReason;
    long randomSeed;
    // best-ever fitness after initialization, then after each generation
    List<Double> fitnessHistory;
    long computationTimeMs;

    public boolean isCancelled() {
        return stopReason.isEarlyTermination();
    }
}
