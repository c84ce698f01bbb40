package com.beamcut.web;

import com.beamcut.domain.CuttingReport;
import com.beamcut.domain.InvalidInputException;
import com.beamcut.domain.OptimizerParams;
import com.beamcut.service.CuttingService;
import com.beamcut.service.CuttingStatistics;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cutting")
@RequiredArgsConstructor
public class CuttingController {

    private final CuttingService cuttingService;
    private final CuttingStatistics statistics;

    @PostMapping
    public ResponseEntity<CuttingReport> optimize(@RequestBody CuttingRequest request) {
        if (request.getRawLength() == null) {
            throw new InvalidInputException("raw_length is required");
        }
        OptimizerParams params = null;
        if (request.getParams() != null) {
            params = request.getParams().applyTo(CuttingService.resolveProfile(request.getProfile()));
        }
        CuttingReport report = cuttingService.optimizeCutting(
                request.getRawLength(),
                request.getParts(),
                params,
                request.getProfile()
        );
        return ResponseEntity.ok(report);
    }

    @GetMapping("/{id}")
    public ResponseEntity<CuttingReport> report(@PathVariable("id") long id) {
        return ResponseEntity.ok(cuttingService.findReport(id));
    }

    @GetMapping("/stats")
    public ResponseEntity<CuttingStatistics.Snapshot> stats() {
        return ResponseEntity.ok(statistics.snapshot());
    }
}
