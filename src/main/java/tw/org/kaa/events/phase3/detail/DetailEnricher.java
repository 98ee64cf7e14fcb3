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
import tw.org.kaa.events.shared.PageSource;

import java.io.IOException;

/**
 * Looks up detail pages through the run's cache, fetching and parsing on a miss.
 * Failed fetches are not cached.
 */
public class DetailEnricher {

    private static final Logger logger = LoggerFactory.getLogger(DetailEnricher.class);

    private final PageSource pageSource;
    private final DetailCache cache;
    private final DetailPageParser parser;

    public DetailEnricher(PageSource pageSource, DetailCache cache, DetailPageParser parser) {
        this.pageSource = pageSource;
        this.cache = cache;
        this.parser = parser;
    }

    public DetailPage lookup(String detailUrl) throws IOException {
        DetailPage cached = cache.get(detailUrl);
        if (cached != null) {
            logger.debug("Detail cache hit: {}", detailUrl);
            return cached;
        }

        String html = pageSource.fetch(detailUrl);
        DetailPage page = parser.parse(html);
        cache.put(detailUrl, page);
        logger.debug("Parsed detail page {} ({} fields, {} downloads)",
            detailUrl, page.getFields().size(), page.getDownloads().size());
        return page;
    }
}
