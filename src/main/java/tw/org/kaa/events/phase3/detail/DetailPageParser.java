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

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import tw.org.kaa.events.shared.LinkItem;
import tw.org.kaa.events.shared.MarkupText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the label/value table of a detail page, its file downloads and
 * its registration link.
 */
public class DetailPageParser {

    static final String DETAIL_ROW_SELECTOR = ".addtable table tr";
    static final String DEFAULT_DOWNLOAD_LABEL = "檔案下載";
    static final String DEFAULT_REGISTER_LABEL = "報名資訊";

    private static final List<String> DOWNLOAD_FIELD_NAMES = List.of("檔案下載", "相關檔案", "相關文件");
    private static final List<String> REGISTER_FIELD_NAMES = List.of("報名");
    private static final List<String> REMARK_FIELD_NAMES = List.of("備註", "備考", "注意事項");

    private final String baseUrl;

    public DetailPageParser(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public DetailPage parse(String html) {
        Document doc = Jsoup.parse(html, baseUrl);
        Elements rows = doc.select(DETAIL_ROW_SELECTOR);
        if (rows.isEmpty()) {
            rows = doc.select("tr");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        List<LinkItem> downloads = new ArrayList<>();
        RegisterInfo registerInfo = null;

        for (Element row : rows) {
            Element header = row.selectFirst("th");
            if (header == null) {
                continue;
            }
            String label = normalizeLabel(header.text());
            if (label.isEmpty()) {
                continue;
            }

            List<String> values = new ArrayList<>();
            for (Element cell : row.getElementsByTag("td")) {
                String text = MarkupText.joinedText(cell);
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
            String value = values.isEmpty() ? null : String.join("\n", values);
            fields.put(label, value);

            if (containsAny(label, DOWNLOAD_FIELD_NAMES)) {
                for (Element link : row.select("a[href]")) {
                    String url = link.absUrl("href");
                    if (url.isEmpty()) {
                        continue;
                    }
                    String linkText = MarkupText.clean(link.text());
                    downloads.add(new LinkItem(linkText.isEmpty() ? DEFAULT_DOWNLOAD_LABEL : linkText, url));
                }
            }

            if (containsAny(label, REGISTER_FIELD_NAMES)) {
                Element link = row.selectFirst("a[href]");
                if (link != null) {
                    String linkText = MarkupText.clean(link.text());
                    String registerLabel = !linkText.isEmpty() ? linkText
                        : value != null ? value : DEFAULT_REGISTER_LABEL;
                    String url = link.absUrl("href");
                    registerInfo = new RegisterInfo(registerLabel, url.isEmpty() ? null : url);
                } else if (value != null) {
                    registerInfo = new RegisterInfo(value, null);
                }
            }
        }

        return new DetailPage(fields, downloads, registerInfo);
    }

    /**
     * Strips half- and full-width colons and surrounding whitespace from a header label.
     */
    static String normalizeLabel(String rawLabel) {
        String label = MarkupText.clean(rawLabel);
        return MarkupText.clean(label.replace("：", "").replace(":", ""));
    }

    /**
     * Returns the value of the first remark-like field that has a value, or null.
     */
    public static String extractRemarks(Map<String, String> fields) {
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            String value = entry.getValue();
            if (value != null && !value.isEmpty() && containsAny(entry.getKey(), REMARK_FIELD_NAMES)) {
                return value;
            }
        }
        return null;
    }

    private static boolean containsAny(String label, List<String> names) {
        for (String name : names) {
            if (label.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
