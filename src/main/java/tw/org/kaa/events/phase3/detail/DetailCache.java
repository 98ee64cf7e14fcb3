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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run-scoped memo of parsed detail pages, keyed by URL.
 *
 * <p>Holds at most {@code capacity} entries; inserting beyond that evicts the
 * oldest entry. All access is synchronized. Two workers missing the same URL at
 * once both fetch it and the second put replaces the first with equal content.</p>
 */
public class DetailCache {

    private final int capacity;
    private final Map<String, DetailPage> entries;

    public DetailCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DetailPage> eldest) {
                return size() > DetailCache.this.capacity;
            }
        };
    }

    /**
     * @return the cached page, or null on a miss
     */
    public synchronized DetailPage get(String url) {
        return entries.get(url);
    }

    public synchronized void put(String url, DetailPage page) {
        entries.put(url, page);
    }

    public synchronized boolean contains(String url) {
        return entries.containsKey(url);
    }

    public synchronized int size() {
        return entries.size();
    }
}
