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
package tw.org.kaa.events.phase1.list;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tw.org.kaa.events.shared.Configuration;
import tw.org.kaa.events.shared.EventRecord;
import tw.org.kaa.events.shared.PageSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Phase 1: Fetches list pages 1..N in order and extracts one record per
 * distinct key. The first occurrence in page and row order wins.
 * Any failure on a list page propagates to the caller.
 */
public class EventListCollector {

    private static final Logger logger = LoggerFactory.getLogger(EventListCollector.class);

    private final Configuration config;
    private final PageSource pageSource;
    private final ListPageParser parser;
    private final ListRecordBuilder builder;

    public EventListCollector(Configuration config, PageSource pageSource) {
        this.config = config;
        this.pageSource = pageSource;
        this.parser = new ListPageParser(config.getBaseUrl());
        this.builder = new ListRecordBuilder();
    }

    public List<EventRecord> collect() throws IOException {
        int pageCount = config.getPageCount();
        logger.info("Phase 1: Collecting {} list pages from {}", pageCount, config.getListUrl());

        Set<String> seen = new HashSet<>();
        List<EventRecord> aggregated = new ArrayList<>();
        int duplicateCount = 0;

        for (int page = 1; page <= pageCount; page++) {
            String pageUrl = config.getListPageUrl(page);
            String html = pageSource.fetch(pageUrl);
            Elements rows = parser.parseRows(html, pageUrl);

            int added = 0;
            for (Element row : rows) {
                EventRecord record = builder.build(row);
                if (record == null) {
                    continue;
                }
                if (!seen.add(record.getKey())) {
                    duplicateCount++;
                    logger.debug("Skipped duplicate event: {}", record.getKey());
                    continue;
                }
                aggregated.add(record);
                added++;
            }
            logger.info("Page {}: {} new events", page, added);
        }

        logger.info("Phase 1 complete. Found {} events, {} duplicates skipped", aggregated.size(), duplicateCount);
        return aggregated;
    }
}
