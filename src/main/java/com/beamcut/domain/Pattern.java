package com.beamcut.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The parts cut from a single beam, in cutting order, plus the offcut left over.
 */
public final class Pattern {

    private final List<Double> cuts;
    private final double usedLength;
    private final double waste;

    public Pattern(List<Double> cuts, double rawLength) {
        this.cuts = List.copyOf(cuts);
        double used = 0;
        for (double cut : this.cuts) {
            used += cut;
        }
        this.usedLength = used;
        // float rounding may push used a hair past the stock
        this.waste = Math.max(0.0, rawLength - used);
    }

    @JsonProperty("cuts")
    public List<Double> getCuts() {
        return cuts;
    }

    @JsonProperty("used_length")
    public double getUsedLength() {
        return usedLength;
    }

    @JsonProperty("waste")
    public double getWaste() {
        return waste;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        Pattern other = (Pattern) o;
        return cuts.equals(other.cuts) && Double.compare(waste, other.waste) == 0;
    }

    @Override
    public int hashCode() {
        return cuts.hashCode() * 31 + Double.hashCode(waste);
    }

    @Override
    public String toString() {
        return cuts + " waste=" + waste;
    }
}
