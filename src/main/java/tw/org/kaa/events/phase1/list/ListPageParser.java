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

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import tw.org.kaa.events.shared.MalformedMarkupException;

/**
 * Locates the rows of the activity list table.
 */
public class ListPageParser {

    static final String LIST_TABLE_SELECTOR = ".mtable table";

    private final String baseUrl;

    /**
     * @param baseUrl site root that relative links are resolved against
     */
    public ListPageParser(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Returns every row of the list table, header rows included.
     *
     * @param html markup of one list page
     * @param pageUrl URL the markup came from, for error messages
     * @throws MalformedMarkupException if the page has no list table
     */
    public Elements parseRows(String html, String pageUrl) throws MalformedMarkupException {
        Document doc = Jsoup.parse(html, baseUrl);
        Element table = doc.selectFirst(LIST_TABLE_SELECTOR);
        if (table == null) {
            throw new MalformedMarkupException(pageUrl, "List table '" + LIST_TABLE_SELECTOR + "' not found");
        }
        return table.select("tr");
    }
}
