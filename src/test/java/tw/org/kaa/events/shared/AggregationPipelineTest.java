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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static tw.org.kaa.events.shared.HtmlFixtures.BASE_URL;
import static tw.org.kaa.events.shared.HtmlFixtures.completeDetailPage;
import static tw.org.kaa.events.shared.HtmlFixtures.detailPage;
import static tw.org.kaa.events.shared.HtmlFixtures.detailRow;
import static tw.org.kaa.events.shared.HtmlFixtures.listPage;
import static tw.org.kaa.events.shared.HtmlFixtures.simpleRow;

/**
 * End-to-end tests of the aggregation stages against fake pages.
 */
public class AggregationPipelineTest {

    private static final String DETAIL_A = BASE_URL + "/news_view.php?id=1";

    @TempDir
    Path tempDir;

    private Configuration config;
    private SnapshotStore store;
    private FakePageSource source;

    @BeforeEach
    public void setUp() {
        config = new Configuration();
        config.setPageCount(1);
        config.setDetailConcurrency(2);
        store = new SnapshotStore(tempDir.resolve("events.json"));
        source = new FakePageSource()
            .page(config.getListPageUrl(1), listPage(
                simpleRow("建築講座", "news_view.php?id=1"),
                simpleRow("理事會議", null)))
            .page(DETAIL_A, completeDetailPage("Bring ID"));
    }

    @Test
    public void testTwoRowsAreEnrichedAndClassified() throws Exception {
        AggregationPipeline pipeline = new AggregationPipeline(config, source, store);
        assertNull(pipeline.getStage());

        AggregationResult result = pipeline.run();

        assertEquals(AggregationPipeline.Stage.DONE, pipeline.getStage());
        assertFalse(result.hasWarnings());
        assertEquals(1, result.getDetailFetchesQueued());

        List<EventRecord> records = result.getRecords();
        assertEquals(2, records.size());

        EventRecord a = records.get(0);
        assertEquals("建築講座", a.getTitle());
        assertEquals(DETAIL_A, a.getDetailUrl());
        assertEquals("Bring ID", a.getRemarks());
        assertEquals(EventCategory.WORKSHOP, a.getCategory());
        assertEquals("線上報名", a.getRegister());
        assertEquals(1, a.getDownloads().size());

        EventRecord b = records.get(1);
        assertEquals("理事會議", b.getTitle());
        assertNull(b.getDetailUrl());
        assertEquals(EventCategory.MEETING, b.getCategory());
        assertNull(b.getRemarks());
        assertEquals(1, source.fetchCount(DETAIL_A));
    }

    @Test
    public void testSecondRunFetchesNoDetailsAndChangesNothing() throws Exception {
        AggregationResult first = new AggregationPipeline(config, source, store).run();
        store.write(config.getListUrl(), first.getRecords());
        source.resetCounts();

        AggregationResult second = new AggregationPipeline(config, source, store).run();

        assertEquals(0, second.getDetailFetchesQueued());
        assertEquals(0, source.fetchCount(DETAIL_A));
        assertEquals(first.getRecords(), second.getRecords());
        assertEquals(first.getRecords(), store.read().getEvents());
    }

    @Test
    public void testIncompletePriorIsRefetched() throws Exception {
        source.page(DETAIL_A, detailPage(detailRow("備註：", "Bring ID")));
        AggregationResult first = new AggregationPipeline(config, source, store).run();
        store.write(config.getListUrl(), first.getRecords());
        source.resetCounts();

        AggregationResult second = new AggregationPipeline(config, source, store).run();

        assertEquals(1, second.getDetailFetchesQueued());
        assertEquals(1, source.fetchCount(DETAIL_A));
        assertEquals("Bring ID", second.getRecords().get(0).getRemarks());
    }

    @Test
    public void testDetailFailureIsNotFatal() throws Exception {
        source.failing(DETAIL_A);

        AggregationResult result = new AggregationPipeline(config, source, store).run();

        assertTrue(result.hasWarnings());
        assertEquals(2, result.getRecords().size());
        assertNull(result.getRecords().get(0).getRemarks());
        assertEquals(EventCategory.WORKSHOP, result.getRecords().get(0).getCategory());
    }

    @Test
    public void testPriorRemarksSurviveFailedDetailFetch() throws Exception {
        EventRecord prior = new EventRecord("建築講座");
        prior.setDetailUrl(DETAIL_A);
        prior.setRemarks("R");
        store.write(config.getListUrl(), List.of(prior));
        source.failing(DETAIL_A);

        AggregationResult result = new AggregationPipeline(config, source, store).run();

        assertEquals("R", result.getRecords().get(0).getRemarks());
    }

    @Test
    public void testListFailureIsFatal() {
        config.setPageCount(2);
        source.failing(config.getListPageUrl(2));
        AggregationPipeline pipeline = new AggregationPipeline(config, source, store);

        TransportException e = assertThrows(TransportException.class, pipeline::run);

        assertEquals(500, e.getStatusCode());
        assertEquals(AggregationPipeline.Stage.LIST_FETCH, pipeline.getStage());
        assertEquals(0, source.fetchCount(DETAIL_A));
    }
}
