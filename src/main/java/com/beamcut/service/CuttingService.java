package com.beamcut.service;

import com.beamcut.domain.CuttingReport;
import com.beamcut.domain.Demand;
import com.beamcut.domain.InvalidInputException;
import com.beamcut.domain.OptimizerParams;
import com.beamcut.domain.ReportNotFoundException;
import com.beamcut.domain.RequiredPart;
import com.beamcut.engine.CuttingOptimizer;
import com.beamcut.engine.OptimizationRun;
import com.beamcut.engine.ResultReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.BooleanSupplier;

@Slf4j
@Service
public class CuttingService {

    private final CuttingOptimizer optimizer;
    private final ResultReporter reporter;
    private final CuttingStatistics statistics;
    private final CuttingReportRepository repository;
    private final long defaultTimeLimitMillis;

    public CuttingService(CuttingOptimizer optimizer,
                          ResultReporter reporter,
                          CuttingStatistics statistics,
                          CuttingReportRepository repository,
                          @Value("${beamcut.optimizer.time-limit-millis:0}") long defaultTimeLimitMillis) {
        this.optimizer = optimizer;
        this.reporter = reporter;
        this.statistics = statistics;
        this.repository = repository;
        this.defaultTimeLimitMillis = defaultTimeLimitMillis;
    }

    public CuttingReport optimizeCutting(double rawLength, List<RequiredPart> parts, OptimizerParams params, String profile) {
        return optimizeCutting(rawLength, parts, params, profile, () -> false);
    }

    public CuttingReport optimizeCutting(double rawLength, List<RequiredPart> parts, OptimizerParams params,
                                         String profile, BooleanSupplier cancellationSignal) {
        statistics.recordRequest();

        // Fallback to the profile if params are missing
        if (params == null) {
            params = resolveProfile(profile);
        }
        // No wall-clock cap on seeded runs, they must replay identically
        if (params.getRandomSeed() == null && params.getTimeLimitMillis() == 0 && defaultTimeLimitMillis > 0) {
            params = params.toBuilder().timeLimitMillis(defaultTimeLimitMillis).build();
        }

        // Fails fast, before any generation runs
        Demand demand = Demand.of(rawLength, parts);
        params.validate();

        OptimizationRun run = optimizer.optimize(demand, params, cancellationSignal);
        CuttingReport report = repository.save(reporter.report(demand, run));
        statistics.recordRun(report);

        log.info("Cutting request #{}: raw={}, instances={}, beams={}, waste={}, stop={}",
                report.getRequestId(), rawLength, demand.size(), report.getBeamCount(), report.getGenotypeWaste(), report.getStopReason());
        return report;
    }

    /**
     * @throws ReportNotFoundException when the id was never issued or has been evicted
     */
    public CuttingReport findReport(long requestId) {
        return repository.findById(requestId)
                .orElseThrow(() -> new ReportNotFoundException(requestId));
    }

    public static OptimizerParams resolveProfile(String profile) {
        if (profile == null || profile.isBlank()) {
            return OptimizerParams.defaults();
        }
        return switch (profile.trim().toUpperCase()) {
            case "QUICK" -> OptimizerParams.forQuickRun();
            case "BALANCED" -> OptimizerParams.forBalancedRun();
            case "THOROUGH" -> OptimizerParams.forThoroughRun();
            default -> throw new InvalidInputException("Unknown profile '" + profile + "', expected QUICK, BALANCED or THOROUGH");
        };
    }
}
