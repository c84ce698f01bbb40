package com.beamcut.engine;

import com.beamcut.domain.CuttingPlan;
import com.beamcut.domain.CuttingReport;
import com.beamcut.domain.Demand;
import com.beamcut.domain.Pattern;
import com.beamcut.domain.PatternUsage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles the page model from the demand and the winning plan.
 * Only arithmetic already available on those two objects happens here.
 */
@Component
public class ResultReporter {

    public CuttingReport report(Demand demand, OptimizationRun run) {
        CuttingPlan plan = run.getBestPlan();
        return CuttingReport.builder()
                .rawLength(demand.getRawLength())
                .genotypeWaste(plan.getGenotypeWaste())
                .beamCount(plan.getBeamCount())
                .allElementsLength(plan.getAllElementsLength())
                .rawMaterialUtilization(plan.getUtilization())
                .lengthHistogram(new LinkedHashMap<>(demand.getLengthHistogram()))
                .patterns(plan.getPatterns())
                .patternUsages(groupPatterns(plan))
                .cancelled(run.isCancelled())
                .stopReason(run.getStopReason().name())
                .generations(run.getGenerations())
                .randomSeed(run.getRandomSeed())
                .bestFitness(run.getBestFitness())
                .lowerBoundBeamCount(demand.lowerBoundBeamCount())
                .computationTimeMs(run.getComputationTimeMs())
                .build();
    }

    /**
     * Beams cutting the same multiset of lengths collapse into one usage, in first-seen order.
     */
    static List<PatternUsage> groupPatterns(CuttingPlan plan) {
        Map<List<Double>, PatternUsage> usages = new LinkedHashMap<>();
        for (Pattern pattern : plan.getPatterns()) {
            List<Double> key = pattern.getCuts().stream()
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
            PatternUsage usage = usages.get(key);
            if (usage == null) {
                usages.put(key, PatternUsage.builder()
                        .repetition(1)
                        .cuts(key)
                        .waste(pattern.getWaste())
                        .build());
            } else {
                usage.setRepetition(usage.getRepetition() + 1);
            }
        }
        return new ArrayList<>(usages.values());
    }
}
