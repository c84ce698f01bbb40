package com.beamcut.engine;

import com.beamcut.domain.CuttingPlan;
import com.beamcut.domain.Demand;
import com.beamcut.domain.OptimizerParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * GENETIC CUTTING OPTIMIZER
 * - Gene = position of a part instance in the cutting order
 * - Decoding = sequential first fit into the current beam
 * - Selection = tournament, Crossover = single-point order crossover, Mutation = swap
 * - Elitism keeps the best genotype, so best-ever fitness never gets worse
 */
@Slf4j
@Component
public class GeneticCuttingOptimizer implements CuttingOptimizer {

    @Override
    public OptimizationRun optimize(Demand demand, OptimizerParams params, BooleanSupplier cancellationSignal) {
        Objects.requireNonNull(demand, "demand");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(cancellationSignal, "cancellationSignal");
        params.validate();

        long startTime = System.currentTimeMillis();
        long seed = params.getRandomSeed() != null ? params.getRandomSeed() : ThreadLocalRandom.current().nextLong();
        Random rnd = new Random(seed);

        FirstFitDecoder decoder = new FirstFitDecoder(demand);
        FitnessEvaluator evaluator = FitnessEvaluator.from(params);
        PopulationManager manager = new PopulationManager(params, rnd, demand.size());
        int lowerBound = demand.lowerBoundBeamCount();

        log.info("Cutting run: {} instances, raw length {}, lower bound {} beams, seed {}, population {}, max generations {}",
                demand.size(), demand.getRawLength(), lowerBound, seed,
                params.getPopulationSize(), params.getMaxGenerations());

        // 1. Initial population
        List<Genotype> population = new ArrayList<>(params.getPopulationSize());
        for (int i = 0; i < params.getPopulationSize(); i++) {
            population.add(Genotype.random(demand.size(), rnd));
        }
        evaluatePopulation(population, decoder, evaluator, params.isParallelEvaluation());

        Genotype best = PopulationManager.best(population).copy();
        verifyPlan(best, demand, params);
        List<Double> history = new ArrayList<>();
        history.add(best.getFitness());

        // 2. Evolution
        StopReason stopReason = StopReason.MAX_GENERATIONS;
        int generation = 0;
        int stall = 0;
        while (true) {
            if (params.isStopAtLowerBound() && best.getPlan().getBeamCount() <= lowerBound) {
                stopReason = StopReason.LOWER_BOUND_REACHED;
                break;
            }
            if (generation >= params.getMaxGenerations()) {
                stopReason = StopReason.MAX_GENERATIONS;
                break;
            }
            if (params.getStallLimit() > 0 && stall >= params.getStallLimit()) {
                stopReason = StopReason.STALLED;
                break;
            }
            if (cancellationSignal.getAsBoolean()) {
                stopReason = StopReason.CANCELLED;
                break;
            }
            if (params.getTimeLimitMillis() > 0 && System.currentTimeMillis() - startTime >= params.getTimeLimitMillis()) {
                stopReason = StopReason.TIME_LIMIT;
                break;
            }

            List<Genotype> next = manager.nextGeneration(population);
            evaluatePopulation(next, decoder, evaluator, params.isParallelEvaluation());
            generation++;

            Genotype generationBest = PopulationManager.best(next);
            if (generationBest.getFitness() < best.getFitness()) {
                best = generationBest.copy();
                verifyPlan(best, demand, params);
                stall = 0;
                log.debug("Gen {} improved: beams={}, waste={}, fitness={}", generation,
                        best.getPlan().getBeamCount(), best.getPlan().getGenotypeWaste(), best.getFitness());
            } else {
                stall++;
            }
            history.add(best.getFitness());
            population = next;
        }

        long duration = System.currentTimeMillis() - startTime;
        CuttingPlan plan = best.getPlan();
        log.info("Cutting run finished after {} generations ({}): beams={}, waste={}, utilization={}%, {} ms",
                generation, stopReason, plan.getBeamCount(), plan.getGenotypeWaste(),
                String.format("%.2f", plan.getUtilization()), duration);

        return OptimizationRun.builder()
                .bestGenotype(best)
                .bestPlan(plan)
                .bestFitness(best.getFitness())
                .generations(generation)
                .stopReason(stopReason)
                .randomSeed(seed)
                .fitnessHistory(Collections.unmodifiableList(history))
                .computationTimeMs(duration)
                .build();
    }

    private void evaluatePopulation(List<Genotype> population, FirstFitDecoder decoder,
                                    FitnessEvaluator evaluator, boolean parallel) {
        if (parallel) {
            population.parallelStream().forEach(g -> g.evaluate(decoder, evaluator));
        } else {
            population.forEach(g -> g.evaluate(decoder, evaluator));
        }
    }

    /**
     * Conservation check on every new best: same instances, same total length.
     */
    private void verifyPlan(Genotype genotype, Demand demand, OptimizerParams params) {
        if (!params.isVerifyGenotypes()) {
            return;
        }
        if (!Genotype.isPermutation(genotype.getOrder(), demand.size())) {
            log.error("Best genotype is not a permutation of {} instances: {}", demand.size(), genotype);
            throw new IllegalStateException("Best genotype is not a permutation of the part instances");
        }
        double tolerance = FirstFitDecoder.EPS * Math.max(1.0, demand.getTotalLength());
        if (Math.abs(genotype.getPlan().getAllElementsLength() - demand.getTotalLength()) > tolerance) {
            log.error("Decoded length {} differs from demand total {}",
                    genotype.getPlan().getAllElementsLength(), demand.getTotalLength());
            throw new IllegalStateException("Decoded plan does not cover the demand exactly");
        }
    }
}
