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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Determines an event category from its title.
 *
 * Categories are tested in the iteration order of the keyword map; the first
 * category with a keyword contained in the trimmed title wins. Titles matching
 * no keyword fall back to the outing markers, then to {@link EventCategory#OTHER}.
 * Matching is case-sensitive substring containment.
 */
public class CategoryClassifier {

    private static final Map<EventCategory, List<String>> DEFAULT_KEYWORDS;
    private static final List<String> DEFAULT_OUTING_MARKERS = List.of("遊");

    static {
        Map<EventCategory, List<String>> keywords = new LinkedHashMap<>();
        // Priority order: movie > workshop > meeting > outing
        keywords.put(EventCategory.MOVIE, List.of("電影", "影展", "影唱", "電影活動", "改版播放"));
        keywords.put(EventCategory.WORKSHOP, List.of("講習", "課程", "研習", "培訓", "講座", "講堂", "工作坊", "訓練"));
        keywords.put(EventCategory.MEETING, List.of("會議", "理事", "理監事", "委員", "會員", "座談", "大會", "議"));
        keywords.put(EventCategory.OUTING, List.of("出遊", "旅遊", "旅行", "參訪", "觀摩", "遊程", "團遊"));
        DEFAULT_KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final Map<EventCategory, List<String>> keywordsByPriority;
    private final List<String> outingMarkers;

    public CategoryClassifier() {
        this(DEFAULT_KEYWORDS, DEFAULT_OUTING_MARKERS);
    }

    /**
     * @param keywordsByPriority keyword sets in evaluation order (use a LinkedHashMap)
     * @param outingMarkers fallback substrings that mark an outing
     */
    public CategoryClassifier(Map<EventCategory, List<String>> keywordsByPriority, List<String> outingMarkers) {
        this.keywordsByPriority = Collections.unmodifiableMap(new LinkedHashMap<>(keywordsByPriority));
        this.outingMarkers = List.copyOf(outingMarkers);
    }

    public EventCategory classify(String title) {
        if (title == null || title.isBlank()) {
            return EventCategory.OTHER;
        }
        String normalized = title.trim();

        for (Map.Entry<EventCategory, List<String>> entry : keywordsByPriority.entrySet()) {
            if (containsAny(normalized, entry.getValue())) {
                return entry.getKey();
            }
        }

        if (containsAny(normalized, outingMarkers)) {
            return EventCategory.OUTING;
        }
        return EventCategory.OTHER;
    }

    private static boolean containsAny(String text, List<String> candidates) {
        for (String candidate : candidates) {
            if (text.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
