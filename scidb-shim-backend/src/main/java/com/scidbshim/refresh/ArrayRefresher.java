package com.scidbshim.refresh;

import com.scidbshim.config.ShimProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loads the arrays catalog once at startup and, when {@code shim.arrays.refresh-interval-sec}
 * is positive, again on a fixed delay.
 *
 * <p>A refresh that fires while the previous one is still running is skipped. Buffers of the
 * previous refresh are deleted once the new results are published.
 */
@Component
public class ArrayRefresher {
    private static final Logger log = LoggerFactory.getLogger(ArrayRefresher.class);

    private final ArrayCatalog catalog;
    private final ArrayLoader loader;
    private final ShimProperties properties;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> scheduledTask;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean refreshing = new AtomicBoolean(false);
    private volatile CountDownLatch currentTaskLatch;

    private volatile Map<String, ArrayLoadResult> latestResults = Map.of();

    public ArrayRefresher(ArrayCatalog catalog, ArrayLoader loader, ShimProperties properties) {
        this.catalog = catalog;
        this.loader = loader;
        this.properties = properties;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "array-refresher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start when a catalog path is configured. The file may still be missing, invalid or
     * empty; each refresh reloads it.
     *
     * @return true if the refresher was started
     */
    public boolean startIfConfigured() {
        String config = properties.getArrays().getConfig();
        if (config == null || config.isBlank()) {
            log.info("Array refresher not started: shim.arrays.config is blank");
            return false;
        }
        start();
        return true;
    }

    /**
     * Schedule the initial load and, if configured, the periodic refresh.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Array refresher already running");
            return;
        }

        int intervalSec = properties.getArrays().getRefreshIntervalSec();
        if (intervalSec > 0) {
            scheduledTask = scheduler.scheduleWithFixedDelay(this::refreshOnce, 0, intervalSec, TimeUnit.SECONDS);
            log.info("Started array refresher: interval_sec={}", intervalSec);
        } else {
            scheduledTask = scheduler.schedule(this::refreshOnce, 0, TimeUnit.SECONDS);
            log.info("Scheduled one-off array load");
        }
    }

    @PreDestroy
    public void stop() {
        if (running.getAndSet(false) && scheduledTask != null) {
            scheduledTask.cancel(false);
        }

        CountDownLatch latch = currentTaskLatch;
        if (latch != null) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for array refresh to finish");
            }
        }
        scheduler.shutdownNow();

        Map<String, ArrayLoadResult> previous = latestResults;
        latestResults = Map.of();
        previous.values().forEach(ArrayLoadResult::discard);
        log.info("Stopped array refresher");
    }

    /**
     * Reload the catalog and load every array.
     *
     * @return true if the refresh ran, false if another refresh was in progress
     */
    public boolean refreshOnce() {
        if (!refreshing.compareAndSet(false, true)) {
            log.debug("Array refresh still in progress; skipping");
            return false;
        }

        CountDownLatch latch = new CountDownLatch(1);
        currentTaskLatch = latch;
        try {
            catalog.reload();
            List<ArrayLoadResult> results = loader.loadAll(catalog.getArrays());

            Map<String, ArrayLoadResult> next = new LinkedHashMap<>();
            for (ArrayLoadResult result : results) {
                next.put(result.getName(), result);
            }
            Map<String, ArrayLoadResult> previous = latestResults;
            latestResults = Map.copyOf(next);
            previous.values().forEach(ArrayLoadResult::discard);

            long failed = results.stream().filter(r -> !r.isLoaded()).count();
            log.info("Array refresh done: arrays={}, failed={}", results.size(), failed);
        } catch (RuntimeException e) {
            log.error("Array refresh failed", e);
        } finally {
            latch.countDown();
            refreshing.set(false);
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Results of the last completed refresh, keyed by array name.
     */
    public Map<String, ArrayLoadResult> getLatestResults() {
        return latestResults;
    }

    public ArrayLoadResult getLatestResult(String name) {
        return latestResults.get(name);
    }
}
