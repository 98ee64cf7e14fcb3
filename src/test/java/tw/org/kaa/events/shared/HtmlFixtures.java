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

/**
 * Builds list and detail page markup shaped like the KAA site.
 */
public final class HtmlFixtures {

    public static final String BASE_URL = "https://www.kaa.org.tw";

    private HtmlFixtures() {
    }

    /**
     * A list page whose table has a header row followed by the given rows.
     */
    public static String listPage(String... rows) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body><div class=\"mtable\"><table>");
        html.append("<tr><th>活動名稱</th><th>地點</th><th>日期</th><th>時間</th><th>備註</th><th>報名</th></tr>");
        for (String row : rows) {
            html.append(row);
        }
        html.append("</table></div></body></html>");
        return html.toString();
    }

    /**
     * A list row; null arguments leave the cell empty.
     */
    public static String listRow(String title, String detailHref, String location,
                                 String datesHtml, String timeHtml, String noteLinkHtml, String registerCellHtml) {
        StringBuilder row = new StringBuilder("<tr>");
        row.append("<td>");
        if (detailHref != null) {
            row.append("<a href=\"").append(detailHref).append("\">").append(title).append("</a>");
        } else if (title != null) {
            row.append(title);
        }
        row.append("</td>");
        row.append("<td>").append(nullToEmpty(location)).append("</td>");
        row.append("<td>").append(nullToEmpty(datesHtml)).append("</td>");
        row.append("<td>").append(nullToEmpty(timeHtml)).append("</td>");
        row.append("<td>").append(nullToEmpty(noteLinkHtml)).append("</td>");
        row.append("<td>").append(nullToEmpty(registerCellHtml)).append("</td>");
        row.append("</tr>");
        return row.toString();
    }

    public static String simpleRow(String title, String detailHref) {
        return listRow(title, detailHref, "高雄", "2025/03/01", "09:00", null, null);
    }

    /**
     * A detail page whose table holds the given label/cell rows.
     */
    public static String detailPage(String... rows) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body><div class=\"addtable\"><table>");
        for (String row : rows) {
            html.append(row);
        }
        html.append("</table></div></body></html>");
        return html.toString();
    }

    public static String detailRow(String label, String cellHtml) {
        return "<tr><th>" + label + "</th><td>" + cellHtml + "</td></tr>";
    }

    /**
     * A detail page carrying remarks, one download and a registration link.
     */
    public static String completeDetailPage(String remarks) {
        return detailPage(
            detailRow("活動名稱：", "測試活動"),
            detailRow("備註：", remarks),
            detailRow("檔案下載：", "<a href=\"/upload/file.pdf\">簡章</a>"),
            detailRow("報名：", "<a href=\"/news_apply.php?id=9\">線上報名</a>"));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
