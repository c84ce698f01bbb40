package com.beamcut;

import com.beamcut.domain.CuttingReport;
import com.beamcut.domain.OptimizerParams;
import com.beamcut.domain.PatternUsage;
import com.beamcut.domain.RequiredPart;
import com.beamcut.service.CuttingService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
@ConditionalOnProperty(name = "beamcut.demo.enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final CuttingService service;

    public DemoRunner(CuttingService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) throws Exception {
        System.out.println("=== STARTING BEAM CUTTING DEMO ===");

        // 1. Stock: 6 m steel profile, lengths in mm
        double rawLength = 6000;

        // 2. Cut list of a small frame order
        List<RequiredPart> parts = Arrays.asList(
                RequiredPart.of(2400, 4),
                RequiredPart.of(1800, 6),
                RequiredPart.of(1200, 8),
                RequiredPart.of(750, 10),
                RequiredPart.of(400, 12)
        );

        // 3. Params: balanced profile with a fixed seed so the demo repeats
        OptimizerParams params = OptimizerParams.defaults().toBuilder()
                .randomSeed(42L)
                .build();

        // 4. Run Optimization
        CuttingReport report = service.optimizeCutting(rawLength, parts, params, null);

        System.out.println("\nStop reason: " + report.getStopReason() + " after " + report.getGenerations() + " generations");
        System.out.println("Computation Time: " + report.getComputationTimeMs() + " ms");

        System.out.println("\n--- CUTTING PLAN ---");
        for (PatternUsage usage : report.getPatternUsages()) {
            System.out.printf("%d x %s (waste %.0f)%n", usage.getRepetition(), usage.getCuts(), usage.getWaste());
        }

        System.out.println("\n--- SUMMARY ---");
        System.out.printf("Beams used:     %d x %.0f (lower bound %d)%n", report.getBeamCount(), rawLength, report.getLowerBoundBeamCount());
        System.out.printf("Parts length:   %.0f%n", report.getAllElementsLength());
        System.out.printf("Total waste:    %.0f%n", report.getGenotypeWaste());
        System.out.printf("Utilization:    %.2f%%%n", report.getRawMaterialUtilization());
    }
}
