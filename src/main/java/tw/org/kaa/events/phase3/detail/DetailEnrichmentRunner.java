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
package tw.org.kaa.events.phase3.detail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tw.org.kaa.events.phase2.merge.MergeResult;
import tw.org.kaa.events.shared.EventRecord;
import tw.org.kaa.events.shared.LinkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Phase 3: Fetches the queued detail pages on a bounded worker pool and applies
 * the results to the merged records.
 *
 * <p>Workers only fetch and parse. Results are applied on the calling thread as
 * tasks complete, and {@link #enrich} returns once every task has completed or
 * failed. A failed page is logged and reported as a warning; its record keeps
 * the merged values.</p>
 */
public class DetailEnrichmentRunner {

    private static final Logger logger = LoggerFactory.getLogger(DetailEnrichmentRunner.class);

    private final DetailEnricher enricher;
    private final int concurrency;
    private final long delayMs;

    public DetailEnrichmentRunner(DetailEnricher enricher, int concurrency, long delayMs) {
        this.enricher = enricher;
        this.concurrency = Math.max(1, concurrency);
        this.delayMs = Math.max(0, delayMs);
    }

    // Outcome of one detail task; exactly one of page/error is set.
    private static class TaskResult {
        final int index;
        final DetailPage page;
        final Exception error;

        TaskResult(int index, DetailPage page, Exception error) {
            this.index = index;
            this.page = page;
            this.error = error;
        }
    }

    /**
     * Enriches the merged records queued for a detail fetch, in place.
     *
     * @return one warning per detail page that could not be loaded
     */
    public List<String> enrich(MergeResult merge) throws InterruptedException {
        List<EventRecord> records = merge.getRecords();
        List<Integer> targets = merge.getDetailTargets();
        List<String> warnings = new ArrayList<>();
        if (targets.isEmpty()) {
            logger.info("Phase 3: No detail pages to fetch");
            return warnings;
        }

        int poolSize = Math.min(concurrency, targets.size());
        logger.info("Phase 3: Fetching {} detail pages with {} workers", targets.size(), poolSize);

        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            ExecutorCompletionService<TaskResult> completion = new ExecutorCompletionService<>(pool);
            for (Integer index : targets) {
                String detailUrl = records.get(index).getDetailUrl();
                completion.submit(() -> fetch(index, detailUrl));
            }

            int enriched = 0;
            for (int i = 0; i < targets.size(); i++) {
                Future<TaskResult> future = completion.take();
                TaskResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    // fetch() catches its own failures; anything here is a bug in parsing
                    logger.error("Detail task crashed: {}", String.valueOf(e.getCause()), e.getCause());
                    warnings.add("Detail task crashed: " + e.getCause());
                    continue;
                }

                EventRecord record = records.get(result.index);
                if (result.error != null) {
                    logger.warn("Unable to load detail page {}: {}", record.getDetailUrl(), result.error.getMessage());
                    warnings.add("Unable to load detail page " + record.getDetailUrl() + ": " + result.error.getMessage());
                    continue;
                }
                boolean listHasRegister = merge.getFreshRecords().get(result.index).hasRegister();
                apply(record, result.page, listHasRegister);
                enriched++;
            }

            logger.info("Phase 3 complete. Enriched {} events, {} failed", enriched, warnings.size());
            return warnings;
        } finally {
            pool.shutdown();
        }
    }

    private TaskResult fetch(int index, String detailUrl) {
        TaskResult result;
        try {
            result = new TaskResult(index, enricher.lookup(detailUrl), null);
        } catch (Exception e) {
            result = new TaskResult(index, null, e);
        }

        // Rate limit this worker only
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return result;
    }

    /**
     * Copies detail-derived values onto the record. Values missing from the page
     * leave the merged values untouched. Registration from the page is used only
     * when the list row had none.
     */
    static void apply(EventRecord record, DetailPage page, boolean listHasRegister) {
        String remarks = DetailPageParser.extractRemarks(page.getFields());
        if (remarks != null) {
            record.setRemarks(remarks);
        }

        RegisterInfo registerInfo = page.getRegisterInfo();
        if (registerInfo != null && !listHasRegister) {
            if (registerInfo.getLabel() != null && !registerInfo.getLabel().isEmpty()) {
                record.setRegister(registerInfo.getLabel());
            }
            if (registerInfo.getUrl() != null && !registerInfo.getUrl().isEmpty()) {
                record.setRegisterUrl(registerInfo.getUrl());
            }
        }

        List<LinkItem> validDownloads = new ArrayList<>();
        for (LinkItem download : page.getDownloads()) {
            if (download.getUrl() != null && !download.getUrl().isEmpty()) {
                validDownloads.add(download);
            }
        }
        if (!validDownloads.isEmpty()) {
            record.setDownloads(validDownloads);
        }
    }
}
