package com.beamcut.service;

import com.beamcut.domain.CuttingReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory history of served reports, keyed by request id.
 * Only the newest {@code maxEntries} reports are kept.
 */
@Slf4j
@Component
public class CuttingReportRepository {

    private final Map<Long, CuttingReport> reports = new ConcurrentHashMap<>();
    private final Queue<Long> insertionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final int maxEntries;

    public CuttingReportRepository(@Value("${beamcut.history.max-entries:1000}") int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("beamcut.history.max-entries must be at least 1, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Assigns the next request id to the report and stores it.
     */
    public CuttingReport save(CuttingReport report) {
        long id = nextId.getAndIncrement();
        report.setRequestId(id);
        reports.put(id, report);
        insertionOrder.add(id);

        while (insertionOrder.size() > maxEntries) {
            Long evicted = insertionOrder.poll();
            if (evicted != null) {
                reports.remove(evicted);
                log.debug("Evicted cutting report {}", evicted);
            }
        }
        return report;
    }

    public Optional<CuttingReport> findById(long id) {
        return Optional.ofNullable(reports.get(id));
    }

    public int size() {
        return reports.size();
    }
}
