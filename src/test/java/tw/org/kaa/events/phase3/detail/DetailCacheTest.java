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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DetailCache.
 */
public class DetailCacheTest {

    private static DetailPage page() {
        return new DetailPage(Map.of(), List.of(), null);
    }

    @Test
    public void testOldestEntryIsEvicted() {
        DetailCache cache = new DetailCache(2);
        cache.put("a", page());
        cache.put("b", page());
        cache.get("a");
        cache.put("c", page());

        assertEquals(2, cache.size());
        assertFalse(cache.contains("a"));
        assertTrue(cache.contains("b"));
        assertTrue(cache.contains("c"));
    }

    @Test
    public void testMissReturnsNull() {
        assertNull(new DetailCache(4).get("https://www.kaa.org.tw/news_view.php?id=1"));
    }

    @Test
    public void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new DetailCache(0));
    }
}
