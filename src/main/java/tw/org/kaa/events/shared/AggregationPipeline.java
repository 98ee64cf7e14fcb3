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
import tw.org.kaa.events.phase1.list.EventListCollector;
import tw.org.kaa.events.phase2.merge.MergeResult;
import tw.org.kaa.events.phase2.merge.SnapshotMerger;
import tw.org.kaa.events.phase3.detail.DetailCache;
import tw.org.kaa.events.phase3.detail.DetailEnricher;
import tw.org.kaa.events.phase3.detail.DetailEnrichmentRunner;
import tw.org.kaa.events.phase3.detail.DetailPageParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one aggregation: list pages, merge with the prior snapshot, detail pages,
 * classification.
 *
 * <p>A failure on any list page aborts the run. Detail page failures are
 * reported in the result's warnings and the run continues. Persisting the
 * result is left to the caller.</p>
 */
public class AggregationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AggregationPipeline.class);

    public enum Stage {
        LIST_FETCH, MERGE, DETAIL_FETCH, CLASSIFY, DONE
    }

    private final Configuration config;
    private final PageSource pageSource;
    private final SnapshotStore snapshotStore;
    private final CategoryClassifier classifier;
    private final DetailCache detailCache;
    private volatile Stage stage;

    public AggregationPipeline(Configuration config, PageSource pageSource, SnapshotStore snapshotStore) {
        this(config, pageSource, snapshotStore, new CategoryClassifier(),
            new DetailCache(config.getDetailCacheCapacity()));
    }

    public AggregationPipeline(Configuration config, PageSource pageSource, SnapshotStore snapshotStore,
                               CategoryClassifier classifier, DetailCache detailCache) {
        this.config = config;
        this.pageSource = pageSource;
        this.snapshotStore = snapshotStore;
        this.classifier = classifier;
        this.detailCache = detailCache;
    }

    public AggregationResult run() throws IOException, InterruptedException {
        enter(Stage.LIST_FETCH);
        List<EventRecord> fresh = new EventListCollector(config, pageSource).collect();

        enter(Stage.MERGE);
        Map<String, EventRecord> prior = snapshotStore.loadPrior();
        MergeResult merge = new SnapshotMerger(prior).merge(fresh);

        enter(Stage.DETAIL_FETCH);
        DetailEnricher enricher = new DetailEnricher(pageSource, detailCache,
            new DetailPageParser(config.getBaseUrl()));
        DetailEnrichmentRunner runner = new DetailEnrichmentRunner(enricher,
            config.getDetailConcurrency(), config.getDetailDelayMs());
        List<String> warnings = runner.enrich(merge);

        enter(Stage.CLASSIFY);
        List<EventRecord> records = new ArrayList<>(merge.getRecords());
        for (EventRecord record : records) {
            record.setCategory(classifier.classify(record.getTitle()));
        }

        enter(Stage.DONE);
        return new AggregationResult(records, merge.getDetailTargets().size(), warnings);
    }

    public Stage getStage() {
        return stage;
    }

    private void enter(Stage next) {
        stage = next;
        logger.info("=".repeat(60));
        logger.info("Stage: {}", next);
        logger.info("=".repeat(60));
    }
}
