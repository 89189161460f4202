package com.storescout.scan.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.storescout.config.RetailerProperties;
import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.grid.BoundingBox;
import com.storescout.scan.grid.GridGenerator;
import com.storescout.scan.http.SearchSession;
import com.storescout.scan.http.SearchSessionFactories;
import com.storescout.scan.http.SearchSessionFactory;
import com.storescout.scan.model.GridPoint;
import com.storescout.scan.model.ScanRequest;
import com.storescout.scan.model.ScanResult;
import com.storescout.scan.model.StoreRecord;
import com.storescout.scan.model.ValidationSummary;
import com.storescout.scan.normalize.StoreNormalizer;
import com.storescout.scan.search.PointFetcher;
import com.storescout.scan.search.SearchUrlBuilder;
import com.storescout.scan.validation.StoreValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
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
 * Fans every grid point out to a fixed worker pool and merges the normalized stores in completion
 * order. Point-level failures are logged and count as empty points; only setup failures
 * (bounds, spacing, radius, search API and proxy configuration) propagate to the caller.
 */
@Service
public class GridScanService {
    private static final Logger log = LoggerFactory.getLogger(GridScanService.class);

    private final StoreScoutProperties properties;
    private final PointFetcher pointFetcher;
    private final StoreNormalizer normalizer;
    private final StoreValidator validator;
    private final SearchSessionFactories sessionFactories;

    public GridScanService(
        StoreScoutProperties properties,
        PointFetcher pointFetcher,
        StoreNormalizer normalizer,
        StoreValidator validator,
        SearchSessionFactories sessionFactories
    ) {
        this.properties = properties;
        this.pointFetcher = pointFetcher;
        this.normalizer = normalizer;
        this.validator = validator;
        this.sessionFactories = sessionFactories;
    }

    public ScanResult run(String retailer, ScanRequest request) {
        return scan(retailer, retailerConfig(retailer), request);
    }

    public RetailerProperties retailerConfig(String retailer) {
        String key = retailer == null ? "" : retailer.trim().toLowerCase(Locale.ROOT);
        RetailerProperties retailerProperties = properties.getRetailers().get(key);
        if (retailerProperties == null) {
            throw new UnknownRetailerException(retailer);
        }
        return retailerProperties;
    }

    public ScanResult scan(String retailer, RetailerProperties retailerProperties, ScanRequest request) {
        return scan(retailer, retailerProperties, request, sessionFactories.forRetailer(retailer, retailerProperties));
    }

    public ScanResult scan(
        String retailer,
        RetailerProperties retailerProperties,
        ScanRequest request,
        SearchSessionFactory sessionFactory
    ) {
        ScanRequest effective = request == null ? ScanRequest.defaults() : request;
        Integer limit = effective.effectiveLimit();
        log.info("[{}] Starting scrape run", retailer);
        log.info("[{}] Using proxy mode: {}", retailer, retailerProperties.getProxy().getMode());

        ScanPhase phase = advance(retailer, ScanPhase.IDLE, ScanPhase.GENERATING);
        double spacing = retailerProperties.getGridSpacingMiles();
        if (effective.testMode()) {
            spacing = properties.getTestMode().getGridSpacingMiles();
            log.info("[{}] Test mode: using {}-mile grid spacing", retailer, spacing);
        }
        List<GridPoint> grid = GridGenerator.generate(BoundingBox.from(retailerProperties.getBounds()), spacing);
        SearchUrlBuilder.radiusMeters(retailerProperties.getSearchRadiusMiles());
        SearchUrlBuilder.requireConfigured(retailerProperties.getApi());
        int totalPoints = grid.size();
        log.info("[{}] Generated {} grid points at {}-mile spacing", retailer, totalPoints, spacing);

        phase = advance(retailer, phase, ScanPhase.SCANNING);
        int workers = Math.min(resolveWorkerCount(retailerProperties), Math.max(1, totalPoints));
        log.info("[{}] Scanning grid with {} parallel workers", retailer, workers);

        ScanState state = new ScanState();
        AtomicInteger pointsCompleted = new AtomicInteger();
        int progressInterval = properties.getProgress().getInterval();
        boolean limitReached = false;

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads(retailer));
        try {
            CompletionService<List<StoreRecord>> completion = new ExecutorCompletionService<>(executor);
            List<Future<List<StoreRecord>>> futures = new ArrayList<>(totalPoints);
            for (GridPoint point : grid) {
                futures.add(completion.submit(
                    () -> scanPoint(point, sessionFactory, retailer, retailerProperties, effective.forceRefresh())
                ));
            }

            for (int i = 0; i < totalPoints; i++) {
                List<StoreRecord> records = resultOf(completion.take(), retailer);
                boolean reached = state.merge(records, limit);

                int done = pointsCompleted.incrementAndGet();
                if (done % progressInterval == 0 || done == totalPoints) {
                    log.info(
                        "[{}] Progress: {}/{} points ({}%), {} unique stores found",
                        retailer,
                        done,
                        totalPoints,
                        String.format(Locale.ROOT, "%.1f", done * 100.0 / totalPoints),
                        state.size()
                    );
                }
                if (reached) {
                    log.info("[{}] Reached limit of {} stores", retailer, limit);
                    limitReached = true;
                    futures.forEach(future -> future.cancel(false));
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Grid scan for " + retailer + " was interrupted", e);
        } finally {
            shutdown(executor, retailer);
        }

        phase = advance(retailer, phase, ScanPhase.FINALIZING);
        if (limit != null && state.size() > limit) {
            log.info("[{}] Trimming to {} stores (from {})", retailer, limit, state.size());
        }
        List<StoreRecord> stores = state.snapshot(limit);
        ValidationSummary validation = ValidationSummary.empty();
        if (!stores.isEmpty()) {
            List<Map<String, Object>> fieldMaps = stores.stream().map(StoreRecord::toFieldMap).toList();
            validation = validator.validateBatch(fieldMaps, properties.getValidation().isStrict(), true);
            log.info(
                "[{}] Validation: {}/{} valid, {} warnings",
                retailer,
                validation.valid(),
                validation.total(),
                validation.warningCount()
            );
        }
        advance(retailer, phase, ScanPhase.DONE);
        log.info("[{}] Completed: {} stores scraped", retailer, stores.size());

        return new ScanResult(
            retailer,
            stores,
            stores.size(),
            false,
            limitReached,
            totalPoints,
            pointsCompleted.get(),
            validation
        );
    }

    int resolveWorkerCount(RetailerProperties retailerProperties) {
        if (retailerProperties.getParallelWorkers() != null) {
            return retailerProperties.getParallelWorkers();
        }
        return retailerProperties.getProxy().isProxied()
            ? properties.getWorkers().getProxied()
            : properties.getWorkers().getDirect();
    }

    private List<StoreRecord> scanPoint(
        GridPoint point,
        SearchSessionFactory sessionFactory,
        String retailer,
        RetailerProperties retailerProperties,
        boolean forceRefresh
    ) {
        try (SearchSession session = sessionFactory.open()) {
            List<JsonNode> rawStores = pointFetcher.fetch(session, point, retailer, retailerProperties, forceRefresh);
            List<StoreRecord> parsed = new ArrayList<>(rawStores.size());
            for (JsonNode rawStore : rawStores) {
                normalizer.normalize(retailer, rawStore, retailerProperties).ifPresent(parsed::add);
            }
            return parsed;
        } catch (RuntimeException e) {
            log.warn("[{}] Error at point {}: {}", retailer, point, e.getMessage());
            return List.of();
        }
    }

    private List<StoreRecord> resultOf(Future<List<StoreRecord>> future, String retailer) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("[{}] Grid point worker failed", retailer, e.getCause());
            return List.of();
        }
    }

    private void shutdown(ExecutorService executor, String retailer) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                log.warn("[{}] Workers still running after {}s, interrupting", retailer, properties.getShutdownGraceSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ScanPhase advance(String retailer, ScanPhase from, ScanPhase to) {
        log.debug("[{}] Scan phase {} -> {}", retailer, from, to);
        return to;
    }

    private ThreadFactory workerThreads(String retailer) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "grid-scan-" + retailer + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
