package com.beamcut.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized demand: the raw stock length and the flattened multiset of part
 * instances, indexed {@code 0..N-1} in input order.
 *
 * <p>Instances are referenced by index everywhere in the engine, so two parts
 * of equal length stay distinguishable inside a genotype.
 */
public final class Demand {

    /** Upper bound on the flattened instance count of one demand. */
    public static final int MAX_INSTANCES = 100_000;

    private final double rawLength;
    private final double[] instanceLengths;
    private final Map<Double, Integer> lengthHistogram;
    private final double totalLength;

    private Demand(double rawLength, double[] instanceLengths, Map<Double, Integer> lengthHistogram) {
        this.rawLength = rawLength;
        this.instanceLengths = instanceLengths;
        this.lengthHistogram = Collections.unmodifiableMap(lengthHistogram);
        double sum = 0;
        for (double length : instanceLengths) {
            sum += length;
        }
        this.totalLength = sum;
    }

    /**
     * Validates the raw input and flattens it.
     *
     * @throws InvalidInputException    when the raw length, a part or the list itself is invalid,
     *                                  or the quantities add up to more than {@link #MAX_INSTANCES}
     * @throws InfeasiblePartException  when a part is longer than the raw length
     */
    public static Demand of(double rawLength, List<RequiredPart> parts) {
        if (!Double.isFinite(rawLength) || rawLength <= 0) {
            throw new InvalidInputException("Raw length must be a positive number, got " + rawLength);
        }
        if (parts == null || parts.isEmpty()) {
            throw new InvalidInputException("Part list is empty, there is no demand to optimize");
        }

        long instanceCount = 0;
        for (int i = 0; i < parts.size(); i++) {
            RequiredPart part = parts.get(i);
            if (part == null) {
                throw new InvalidInputException("Part #" + i + " is missing");
            }
            if (!Double.isFinite(part.getLength()) || part.getLength() <= 0) {
                throw new InvalidInputException("Part #" + i + " has non-positive length " + part.getLength());
            }
            if (part.getQuantity() < 1) {
                throw new InvalidInputException("Part #" + i + " has quantity " + part.getQuantity() + ", at least 1 is required");
            }
            if (part.getLength() > rawLength) {
                throw new InfeasiblePartException(part.getLength(), rawLength);
            }
            instanceCount += part.getQuantity();
            if (instanceCount > MAX_INSTANCES) {
                throw new InvalidInputException("Demand has more than " + MAX_INSTANCES
                        + " part instances, split the order into smaller requests");
            }
        }

        double[] lengths = new double[(int) instanceCount];
        Map<Double, Integer> histogram = new LinkedHashMap<>();
        int k = 0;
        for (RequiredPart part : parts) {
            for (int q = 0; q < part.getQuantity(); q++) {
                lengths[k++] = part.getLength();
            }
            histogram.merge(part.getLength(), part.getQuantity(), Integer::sum);
        }
        return new Demand(rawLength, lengths, histogram);
    }

    public double getRawLength() {
        return rawLength;
    }

    public int size() {
        return instanceLengths.length;
    }

    public double lengthOf(int instance) {
        return instanceLengths[instance];
    }

    public double[] getInstanceLengths() {
        return instanceLengths.clone();
    }

    /** Distinct length to required count, in first-seen order. */
    public Map<Double, Integer> getLengthHistogram() {
        return lengthHistogram;
    }

    public double getTotalLength() {
        return totalLength;
    }

    /** No plan can use fewer beams than this. */
    public int lowerBoundBeamCount() {
        return (int) Math.ceil(totalLength / rawLength - 1e-9);
    }

    @Override
    public String toString() {
        return "Demand{rawLength=" + rawLength + ", instances=" + instanceLengths.length
                + ", histogram=" + lengthHistogram + ", total=" + totalLength + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Demand)) return false;
        Demand other = (Demand) o;
        return Double.compare(rawLength, other.rawLength) == 0 && Arrays.equals(instanceLengths, other.instanceLengths);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(rawLength) + Arrays.hashCode(instanceLengths);
    }
}
