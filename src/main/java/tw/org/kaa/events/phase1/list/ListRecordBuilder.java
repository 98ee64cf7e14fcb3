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
import tw.org.kaa.events.shared.EventRecord;
import tw.org.kaa.events.shared.LinkItem;
import tw.org.kaa.events.shared.MarkupText;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one row of the list table into a candidate event record.
 *
 * Columns: 0 title (link to the detail page), 1 location, 2 dates, 3 time info,
 * 4 note link, 5+ registration and other links.
 */
public class ListRecordBuilder {

    static final String REGISTER_PATH_MARKER = "news_apply";
    static final String DEFAULT_REGISTER_LABEL = "線上報名";

    private static final int TITLE_COLUMN = 0;
    private static final int LOCATION_COLUMN = 1;
    private static final int DATES_COLUMN = 2;
    private static final int TIME_COLUMN = 3;
    private static final int NOTE_COLUMN = 4;
    private static final int FIRST_LINK_COLUMN = 5;

    /**
     * Builds a record from a list row.
     *
     * @return the record, or null for header and separator rows without title text
     */
    public EventRecord build(Element row) {
        Elements cells = row.getElementsByTag("td");
        if (cells.isEmpty()) {
            return null;
        }

        Element titleCell = cells.get(TITLE_COLUMN);
        String title = MarkupText.clean(titleCell.text());
        if (title.isEmpty()) {
            return null;
        }

        EventRecord record = new EventRecord(title);
        record.setDetailUrl(absoluteHref(titleCell.selectFirst("a")));
        record.setLocation(MarkupText.cleanOrNull(cellText(cells, LOCATION_COLUMN)));
        record.setDates(MarkupText.fragments(cell(cells, DATES_COLUMN)));
        record.setTimeInfo(MarkupText.fragments(cell(cells, TIME_COLUMN)));

        Element noteCell = cell(cells, NOTE_COLUMN);
        Element noteLink = noteCell != null ? noteCell.selectFirst("a") : null;
        if (noteLink != null) {
            record.setNote(MarkupText.cleanOrNull(noteLink.text()));
            record.setNoteUrl(absoluteHref(noteLink));
        }

        // First registration link beyond the fixed columns; left unset otherwise
        for (int i = FIRST_LINK_COLUMN; i < cells.size(); i++) {
            Element link = cells.get(i).selectFirst("a");
            if (link != null && link.attr("href").contains(REGISTER_PATH_MARKER)) {
                record.setRegisterUrl(absoluteHref(link));
                String label = MarkupText.clean(link.text());
                record.setRegister(label.isEmpty() ? DEFAULT_REGISTER_LABEL : label);
                break;
            }
        }

        record.setExtras(extraLinks(cells, record.getRegisterUrl()));
        return record;
    }

    private static List<LinkItem> extraLinks(Elements cells, String registerUrl) {
        List<LinkItem> extras = new ArrayList<>();
        for (int i = FIRST_LINK_COLUMN; i < cells.size(); i++) {
            for (Element link : cells.get(i).select("a[href]")) {
                String url = absoluteHref(link);
                if (url == null || url.equals(registerUrl)) {
                    continue;
                }
                String label = MarkupText.clean(link.text());
                extras.add(new LinkItem(label.isEmpty() ? url : label, url));
            }
        }
        return extras;
    }

    private static Element cell(Elements cells, int index) {
        return index < cells.size() ? cells.get(index) : null;
    }

    private static String cellText(Elements cells, int index) {
        Element cell = cell(cells, index);
        return cell != null ? cell.text() : null;
    }

    private static String absoluteHref(Element link) {
        if (link == null || link.attr("href").isEmpty()) {
            return null;
        }
        String absolute = link.absUrl("href");
        return absolute.isEmpty() ? null : absolute;
    }
}
