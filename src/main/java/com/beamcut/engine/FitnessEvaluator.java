package com.beamcut.engine;

import com.beamcut.domain.CuttingPlan;
import com.beamcut.domain.OptimizerParams;
import com.beamcut.domain.Pattern;

/**
 * Scores a plan, lower is better:
 * {@code beamWeight * beams + wasteWeight * waste + fillWeight * (1 - mean(fill^2))}.
 *
 * <p>The fill term lies in [0, 1) and favours plans whose parts are concentrated in
 * a few full beams, which is what lets later generations free up a whole beam.
 */
public class FitnessEvaluator {

    private final double beamWeight;
    private final double wasteWeight;
    private final double fillWeight;

    public FitnessEvaluator(double beamWeight, double wasteWeight, double fillWeight) {
        this.beamWeight = beamWeight;
        this.wasteWeight = wasteWeight;
        this.fillWeight = fillWeight;
    }

    public static FitnessEvaluator from(OptimizerParams params) {
        return new FitnessEvaluator(params.getBeamWeight(), params.getWasteWeight(), params.getFillWeight());
    }

    public double evaluate(CuttingPlan plan) {
        double score = beamWeight * plan.getBeamCount() + wasteWeight * plan.getGenotypeWaste();
        if (fillWeight > 0 && plan.getBeamCount() > 0) {
            double sumSquares = 0;
            for (Pattern pattern : plan.getPatterns()) {
                double fill = pattern.getUsedLength() / plan.getRawLength();
                sumSquares += fill * fill;
            }
            score += fillWeight * (1.0 - sumSquares / plan.getBeamCount());
        }
        return score;
    }
}
