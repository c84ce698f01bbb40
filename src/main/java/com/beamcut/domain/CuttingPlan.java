package com.beamcut.domain;

import java.util.List;

/**
 * A decoded solution: one {@link Pattern} per beam, in the order beams were opened.
 */
public final class CuttingPlan {

    private final double rawLength;
    private final List<Pattern> patterns;
    private final double genotypeWaste;
    private final double allElementsLength;

    public CuttingPlan(double rawLength, List<Pattern> patterns) {
        this.rawLength = rawLength;
        this.patterns = List.copyOf(patterns);
        double waste = 0;
        double used = 0;
        for (Pattern pattern : this.patterns) {
            waste += pattern.getWaste();
            used += pattern.getUsedLength();
        }
        this.genotypeWaste = waste;
        this.allElementsLength = used;
    }

    public double getRawLength() {
        return rawLength;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public int getBeamCount() {
        return patterns.size();
    }

    public double getGenotypeWaste() {
        return genotypeWaste;
    }

    public double getAllElementsLength() {
        return allElementsLength;
    }

    /** Percentage of consumed stock that ends up in parts. */
    public double getUtilization() {
        if (patterns.isEmpty()) {
            return 0.0;
        }
        return 100.0 * allElementsLength / (patterns.size() * rawLength);
    }

    @Override
    public String toString() {
        return "CuttingPlan{beams=" + patterns.size() + ", waste=" + genotypeWaste + ", patterns=" + patterns + "}";
    }
}
