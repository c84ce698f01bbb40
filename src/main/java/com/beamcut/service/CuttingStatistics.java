package com.beamcut.service;

import com.beamcut.domain.CuttingReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Running totals over all requests served by this instance.
 */
@Component
public class CuttingStatistics {

    private long totalRequests;
    private long completedRuns;
    private long cancelledRuns;
    private long totalBeams;
    private double totalWaste;
    private double utilizationSum;

    public synchronized void recordRequest() {
        totalRequests++;
    }

    public synchronized void recordRun(CuttingReport report) {
        completedRuns++;
        if (report.isCancelled()) {
            cancelledRuns++;
        }
        totalBeams += report.getBeamCount();
        totalWaste += report.getGenotypeWaste();
        utilizationSum += report.getRawMaterialUtilization();
    }

    public synchronized Snapshot snapshot() {
        return Snapshot.builder()
                .totalRequests(totalRequests)
                .completedRuns(completedRuns)
                .cancelledRuns(cancelledRuns)
                .totalBeams(totalBeams)
                .totalWaste(totalWaste)
                .averageUtilization(completedRuns == 0 ? 0.0 : utilizationSum / completedRuns)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Snapshot {
        private long totalRequests;   // including rejected ones
        private long completedRuns;
        private long cancelledRuns;
        private long totalBeams;
        private double totalWaste;
        private double averageUtilization;
    }
}
