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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapshotStore.
 */
public class SnapshotStoreTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-01T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private static EventRecord record(String title, String detailUrl) {
        EventRecord record = new EventRecord(title);
        record.setDetailUrl(detailUrl);
        record.setDates(List.of("2025/03/01"));
        record.setCategory(EventCategory.MEETING);
        return record;
    }

    @Test
    public void testMissingSnapshotIsEmpty() {
        SnapshotStore store = new SnapshotStore(tempDir.resolve("events.json"));
        assertTrue(store.loadPrior().isEmpty());
    }

    @Test
    public void testUnreadableSnapshotIsEmpty() throws Exception {
        Path path = tempDir.resolve("events.json");
        Files.write(path, "{not json".getBytes(StandardCharsets.UTF_8));

        assertTrue(new SnapshotStore(path).loadPrior().isEmpty());
    }

    @Test
    public void testSnapshotWithoutEventsIsEmpty() throws Exception {
        Path path = tempDir.resolve("events.json");
        Files.write(path, "{\"sourceUrl\":\"x\"}".getBytes(StandardCharsets.UTF_8));

        assertTrue(new SnapshotStore(path).loadPrior().isEmpty());
    }

    @Test
    public void testWriteThenLoad() throws Exception {
        Path path = tempDir.resolve("data").resolve("events.json");
        SnapshotStore store = new SnapshotStore(path, FIXED_CLOCK);
        EventRecord withLink = record("理事會議", "https://www.kaa.org.tw/news_view.php?id=1");
        withLink.setRemarks("請攜帶證件");
        withLink.setDownloads(List.of(new LinkItem("簡章", "https://www.kaa.org.tw/upload/a.pdf")));
        EventRecord withoutLink = record("年終聚餐", null);

        store.write("https://www.kaa.org.tw/news_list.php?t1=1", List.of(withLink, withoutLink));
        Map<String, EventRecord> prior = store.loadPrior();

        assertEquals(2, prior.size());
        assertEquals(withLink, prior.get("https://www.kaa.org.tw/news_view.php?id=1"));
        assertEquals(withoutLink, prior.get("年終聚餐"));

        EventSnapshot snapshot = store.read();
        assertEquals("https://www.kaa.org.tw/news_list.php?t1=1", snapshot.getSourceUrl());
        assertEquals(FIXED_CLOCK.instant(), snapshot.getScrapedAt());
        assertEquals(List.of(withLink, withoutLink), snapshot.getEvents());
    }

    @Test
    public void testSnapshotDocumentShape() throws Exception {
        Path path = tempDir.resolve("events.json");
        new SnapshotStore(path, FIXED_CLOCK).write("https://www.kaa.org.tw/news_list.php?t1=1",
            List.of(record("理事會議", null)));

        JsonNode root = new ObjectMapper().readTree(path.toFile());
        assertEquals("2025-03-01T08:00:00Z", root.get("scrapedAt").asText());
        JsonNode event = root.get("events").get(0);
        assertEquals("meeting", event.get("category").asText());
        assertFalse(event.has("detailUrl"));
        assertFalse(event.has("remarks"));
        assertTrue(event.get("downloads").isArray());

        // Only the snapshot itself remains in the directory
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("events.json"),
                files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    public void testOverwritesExistingSnapshot() throws Exception {
        Path path = tempDir.resolve("events.json");
        SnapshotStore store = new SnapshotStore(path, FIXED_CLOCK);
        store.write("u", List.of(record("一", null), record("二", null)));
        store.write("u", List.of(record("三", null)));

        assertEquals(List.of("三"), List.copyOf(store.loadPrior().keySet()));
    }

    @Test
    public void testLoadsSnapshotFromEarlierTooling() throws Exception {
        String json = "{\n"
            + "  \"sourceUrl\": \"https://www.kaa.org.tw/news_list.php?t1=1\",\n"
            + "  \"scrapedAt\": \"2025-03-01T08:00:00.123456+00:00\",\n"
            + "  \"generator\": \"legacy\",\n"
            + "  \"events\": [\n"
            + "    {\"title\": \"理事會議\", \"detailUrl\": \"https://www.kaa.org.tw/news_view.php?id=1\",\n"
            + "     \"category\": \"meeting\", \"remarks\": \"R\", \"status\": \"past\"},\n"
            + "    {\"title\": \"重複\", \"detailUrl\": \"https://www.kaa.org.tw/news_view.php?id=1\"},\n"
            + "    {\"location\": \"高雄\"}\n"
            + "  ]\n"
            + "}";
        Path path = tempDir.resolve("events.json");
        Files.write(path, json.getBytes(StandardCharsets.UTF_8));

        Map<String, EventRecord> prior = new SnapshotStore(path).loadPrior();

        assertEquals(1, prior.size());
        EventRecord record = prior.get("https://www.kaa.org.tw/news_view.php?id=1");
        assertEquals("理事會議", record.getTitle());
        assertEquals("R", record.getRemarks());
        assertEquals(EventCategory.MEETING, record.getCategory());
    }
}
