package com.beamcut.engine;

import com.beamcut.domain.CuttingPlan;
import com.beamcut.domain.Demand;
import com.beamcut.domain.Pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an instance ordering into beams: each part goes into the current beam if
 * it still fits, otherwise the beam is closed and the part opens the next one.
 * Stateless, safe to share between evaluation threads.
 */
public class FirstFitDecoder {

    // absorbs rounding when fractional lengths add up to exactly the stock
    static final double EPS = 1e-9;

    private final Demand demand;

    public FirstFitDecoder(Demand demand) {
        this.demand = demand;
    }

    public CuttingPlan decode(int[] order) {
        double raw = demand.getRawLength();
        double tolerance = EPS * Math.max(1.0, raw);
        List<Pattern> patterns = new ArrayList<>();
        List<Double> current = new ArrayList<>();
        double remaining = raw;

        for (int instance : order) {
            double length = demand.lengthOf(instance);
            if (!current.isEmpty() && length > remaining + tolerance) {
                patterns.add(new Pattern(current, raw));
                current = new ArrayList<>();
                remaining = raw;
            }
            current.add(length);
            remaining -= length;
        }
        if (!current.isEmpty()) {
            patterns.add(new Pattern(current, raw));
        }
        return new CuttingPlan(raw, patterns);
    }
}
