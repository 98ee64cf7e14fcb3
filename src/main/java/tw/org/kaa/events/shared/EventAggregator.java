/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tw.org.kaa.events.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tw.org.kaa.events.export.EventCsvExporter;
import tw.org.kaa.events.phase3.detail.DetailCache;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main application for aggregating the KAA activity list into events.json.
 *
 * Each run goes through three phases:
 * 1. List phase: fetches the list pages and extracts one record per event
 * 2. Merge phase: merges with the previous snapshot and decides which detail pages to fetch
 * 3. Detail phase: fetches detail pages concurrently for remarks, downloads and registration
 * Records are then classified and written as a new snapshot.
 */
public class EventAggregator {

    private static final Logger logger = LoggerFactory.getLogger(EventAggregator.class);

    private final Configuration config;
    private final PageSource pageSource;
    private final SnapshotStore snapshotStore;
    private final EventCsvExporter csvExporter;
    private final ScheduledExecutorService scheduler;

    public EventAggregator(Configuration config, PageSource pageSource) {
        this(config, pageSource, new SnapshotStore(Paths.get(config.getSnapshotPath())));
    }

    public EventAggregator(Configuration config, PageSource pageSource, SnapshotStore snapshotStore) {
        this.config = config;
        this.pageSource = pageSource;
        this.snapshotStore = snapshotStore;
        this.csvExporter = new EventCsvExporter(config);
        this.scheduler = Executors.newScheduledThreadPool(1);
    }

    /**
     * Starts the scheduled task.
     *
     * @param initialDelay Initial delay before first run (in seconds)
     * @param period       Interval between runs (in seconds)
     */
    public void start(int initialDelay, int period) {
        logger.info("Starting event aggregator in scheduled mode...");
        logger.info("Initial delay: {} seconds, interval: {} seconds", initialDelay, period);

        scheduler.scheduleAtFixedRate(this::runScheduled, initialDelay, period, TimeUnit.SECONDS);
    }

    /**
     * One scheduled run. Failures are logged so later runs still happen; an
     * interrupt is passed back to the scheduler thread.
     */
    void runScheduled() {
        try {
            aggregate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Scheduled run interrupted");
        } catch (Exception e) {
            logger.error("Error during scheduled run: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one aggregation and writes the snapshot.
     *
     * @throws IOException if a list page fails or the snapshot cannot be written
     */
    public AggregationResult aggregate() throws IOException, InterruptedException {
        logger.info("Starting aggregation of {}", config.getListUrl());

        // A fresh cache per run keeps detail pages from going stale between scheduled runs
        AggregationPipeline pipeline = new AggregationPipeline(config, pageSource, snapshotStore,
            new CategoryClassifier(), new DetailCache(config.getDetailCacheCapacity()));
        AggregationResult result = pipeline.run();

        snapshotStore.write(config.getListUrl(), result.getRecords());
        if (config.isWriteCsvExport()) {
            try {
                csvExporter.export(result.getRecords());
            } catch (IOException e) {
                logger.warn("CSV export failed: {}", e.getMessage());
            }
        }

        logSummary(result);
        return result;
    }

    private void logSummary(AggregationResult result) {
        Map<String, Integer> byCategory = new TreeMap<>();
        for (EventRecord record : result.getRecords()) {
            byCategory.merge(record.getCategory().getId(), 1, Integer::sum);
        }
        logger.info("=".repeat(60));
        logger.info("Saved {} events ({}), {} detail pages queued",
            result.getRecords().size(), byCategory, result.getDetailFetchesQueued());
        if (result.hasWarnings()) {
            logger.warn("{} warnings during this run:", result.getWarnings().size());
            for (String warning : result.getWarnings()) {
                logger.warn("  {}", warning);
            }
        }
        logger.info("=".repeat(60));
    }

    /**
     * Runs a single aggregation and stops all services.
     *
     * @return process exit code: 0 on success, 1 on failure
     */
    public int runOnce() {
        try {
            aggregate();
            return 0;
        } catch (IOException e) {
            logger.error("Aggregation failed: {}", e.getMessage(), e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Aggregation interrupted");
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Stops the scheduler.
     */
    public void stop() {
        scheduler.shutdown();
    }

    public static void main(String[] args) {
        Configuration config;
        try {
            config = Configuration.load();
        } catch (IOException e) {
            logger.error("Failed to initialize application: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        HttpPageFetcher fetcher = new HttpPageFetcher(config);
        EventAggregator aggregator = new EventAggregator(config, fetcher);

        // By default, run once and exit
        // Use --schedule or --daemon to enable continuous scheduled mode
        boolean scheduleMode = args != null && args.length > 0 &&
            ("--schedule".equalsIgnoreCase(args[0]) || "--daemon".equalsIgnoreCase(args[0]));

        if (scheduleMode) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received, stopping...");
                aggregator.stop();
                fetcher.close();
            }));
            aggregator.start(0, config.getCheckIntervalSeconds());
        } else {
            int exitCode = aggregator.runOnce();
            fetcher.close();
            System.exit(exitCode);
        }
    }
}
