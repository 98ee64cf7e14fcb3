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

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers shared by the list and detail parsers.
 */
public final class MarkupText {

    private MarkupText() {
    }

    /**
     * Removes carriage returns and surrounding whitespace, including no-break
     * and ideographic spaces. Null becomes the empty string.
     */
    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        String text = value.replace("\r", "");
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Returns the cleaned value, or null when nothing is left.
     */
    public static String cleanOrNull(String value) {
        String cleaned = clean(value);
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Collects every non-empty text fragment below the element in document order.
     */
    public static List<String> fragments(Element element) {
        List<String> fragments = new ArrayList<>();
        if (element == null) {
            return fragments;
        }
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                String text = clean(((TextNode) node).getWholeText());
                if (!text.isEmpty()) {
                    fragments.add(text);
                }
            }
        }, element);
        return fragments;
    }

    /**
     * Joins the element's text fragments with newlines.
     */
    public static String joinedText(Element element) {
        return String.join("\n", fragments(element));
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
