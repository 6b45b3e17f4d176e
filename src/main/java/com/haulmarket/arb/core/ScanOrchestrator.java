package com.haulmarket.arb.core;

import com.haulmarket.arb.config.ArbitrageProperties;
import com.haulmarket.arb.domain.Opportunity;
import com.haulmarket.arb.domain.Route;
import com.haulmarket.arb.domain.RouteFailure;
import com.haulmarket.arb.domain.ScanReport;
import com.haulmarket.arb.infra.sqlite.OpportunityDao;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the matcher over a set of routes on a bounded worker pool.
 *
 * <p>A failing route is recorded and the others carry on. Each route that completes has
 * its stored results replaced in one transaction as soon as it finishes, so routes that
 * finished before a deadline or interrupt keep their fresh results. Routes that failed or
 * were not part of the scan keep whatever was stored before.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanOrchestrator {

    private final OpportunityMatcher matcher;
    private final OpportunityDao opportunityDao;
    private final ArbitrageProperties properties;
    private final Clock clock;

    /**
     * Scan every configured pair in both directions.
     */
    public ScanReport runScan() {
        return runScan(null, properties.getScan().getDeadline());
    }

    public ScanReport runScan(List<Route> routes) {
        return runScan(routes, properties.getScan().getDeadline());
    }

    /**
     * @param routes   routes to scan, or {@code null} for all configured pairs
     * @param deadline overall time budget, or {@code null} for none
     * @throws ScanPersistenceException if a finished route's results cannot be stored
     */
    public ScanReport runScan(List<Route> routes, Duration deadline) {
        ScanSnapshot snapshot = ScanSnapshot.from(properties);
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        ScanReport.ScanReportBuilder report = ScanReport.builder().startedAt(startedAt);

        List<Route> requested = snapshot.distinct(routes != null ? routes : snapshot.getConfiguredRoutes());
        List<Route> valid = new ArrayList<>();
        for (Route route : requested) {
            if (!snapshot.knows(route)) {
                log.warn("Unknown market in route {}, skipping", route);
                report.skippedRoute(route);
                continue;
            }
            valid.add(route);
        }

        log.info("Starting scan of {} routes", valid.size());
        List<Opportunity> results = new ArrayList<>();

        if (!snapshot.isValid()) {
            String detail = "invalid configuration: " + String.join("; ", snapshot.getValidationErrors());
            log.warn("Rejecting {} routes: {}", valid.size(), detail);
            for (Route route : valid) {
                report.failure(new RouteFailure(route, "ValidationError", detail));
            }
        } else if (!valid.isEmpty()) {
            scanRoutes(valid, snapshot, deadline, startedAt, startNanos, report, results);
        }

        results.sort(OpportunityMatcher.BY_TOTAL_PROFIT_DESC);
        ScanReport finished = report
                .opportunities(List.copyOf(results))
                .elapsed(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();
        finished.summaryLines().forEach(log::info);
        return finished;
    }

    private void scanRoutes(List<Route> routes, ScanSnapshot snapshot, Duration deadline, Instant startedAt,
                            long startNanos, ScanReport.ScanReportBuilder report, List<Opportunity> results) {
        int workers = Math.max(1, Math.min(routes.size(), properties.getScan().getMaxWorkers()));
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        CompletionService<List<Opportunity>> completion = new ExecutorCompletionService<>(pool);
        Map<Future<List<Opportunity>>, Route> pending = new LinkedHashMap<>();

        long deadlineNanos = deadline == null || deadline.isZero() || deadline.isNegative()
                ? Long.MAX_VALUE
                : startNanos + deadline.toNanos();

        try {
            for (Route route : routes) {
                pending.put(completion.submit(() -> scanRoute(route, snapshot)), route);
            }

            while (!pending.isEmpty()) {
                Future<List<Opportunity>> done = awaitNext(completion, deadlineNanos);
                if (done == null) {
                    log.warn("Scan deadline of {} exceeded with {} routes outstanding", deadline, pending.size());
                    abandon(pending, report, "DeadlineExceeded", "scan deadline of " + deadline + " exceeded");
                    break;
                }

                Route route = pending.remove(done);
                try {
                    List<Opportunity> found = done.get();
                    persist(route, found, startedAt);
                    results.addAll(found);
                    report.succeededRoute(route);
                    log.info("  OK {}: {} opportunities", route, found.size());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("  FAILED {}: {}", route, cause.toString());
                    report.failure(RouteFailure.of(route, cause));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan interrupted with {} routes outstanding", pending.size());
            abandon(pending, report, "Interrupted", "scan interrupted");
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Opportunity> scanRoute(Route route, ScanSnapshot snapshot) {
        return matcher.findOpportunities(
                snapshot.market(route.getSource()),
                snapshot.market(route.getDestination()),
                snapshot.getFeeConfig(),
                snapshot.getFilters(),
                snapshot.getOrderTtl());
    }

    private void persist(Route route, List<Opportunity> opportunities, Instant scannedAt) {
        try {
            opportunityDao.replaceRoute(route, opportunities, scannedAt);
        } catch (SQLException e) {
            log.error("Failed to persist results for {}", route, e);
            throw new ScanPersistenceException(route, e);
        }
    }

    private static Future<List<Opportunity>> awaitNext(CompletionService<List<Opportunity>> completion,
                                                       long deadlineNanos) throws InterruptedException {
        if (deadlineNanos == Long.MAX_VALUE) {
            return completion.take();
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            return completion.poll();
        }
        return completion.poll(remaining, TimeUnit.NANOSECONDS);
    }

    private static void abandon(Map<Future<List<Opportunity>>, Route> pending, ScanReport.ScanReportBuilder report,
                                String errorType, String detail) {
        for (Map.Entry<Future<List<Opportunity>>, Route> entry : pending.entrySet()) {
            entry.getKey().cancel(true);
            report.failure(new RouteFailure(entry.getValue(), errorType, detail));
        }
        pending.clear();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "scan-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
