package com.beamcut.engine;

import com.beamcut.domain.Demand;
import com.beamcut.domain.OptimizerParams;

import java.util.function.BooleanSupplier;

public interface CuttingOptimizer {

    /**
     * @param cancellationSignal polled once per generation; when it returns true the
     *                           run stops and returns the best plan found so far
     */
    OptimizationRun optimize(Demand demand, OptimizerParams params, BooleanSupplier cancellationSignal);

    default OptimizationRun optimize(Demand demand, OptimizerParams params) {
        return optimize(demand, params, () -> false);
    }
}
