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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the previous run's snapshot and writes the new one.
 */
public class SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path snapshotPath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotStore(Path snapshotPath) {
        this(snapshotPath, Clock.systemUTC());
    }

    public SnapshotStore(Path snapshotPath, Clock clock) {
        this.snapshotPath = snapshotPath;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        // ISO-8601 strings for scrapedAt instead of epoch numbers
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Loads the previous run's events indexed by record key. A missing, empty or
     * unreadable snapshot yields an empty map. The first entry wins for a repeated
     * key; entries with neither detail URL nor title are skipped.
     */
    public Map<String, EventRecord> loadPrior() {
        Path absolutePath = snapshotPath.toAbsolutePath();
        try {
            if (!Files.exists(snapshotPath) || Files.size(snapshotPath) == 0) {
                logger.info("No existing snapshot found at {} - starting fresh", absolutePath);
                return Collections.emptyMap();
            }

            String json = new String(Files.readAllBytes(snapshotPath), StandardCharsets.UTF_8);
            JsonNode events = objectMapper.readTree(json).path("events");
            if (!events.isArray()) {
                logger.warn("Snapshot {} has no events array - treating as empty", absolutePath);
                return Collections.emptyMap();
            }

            Map<String, EventRecord> prior = new LinkedHashMap<>();
            for (JsonNode node : events) {
                EventRecord record;
                try {
                    record = objectMapper.treeToValue(node, EventRecord.class);
                } catch (IOException e) {
                    logger.warn("Skipping unreadable snapshot entry: {}", e.getMessage());
                    continue;
                }
                String key = record.getKey();
                if (key != null) {
                    prior.putIfAbsent(key, record);
                }
            }
            logger.info("Loaded {} events from snapshot {}", prior.size(), absolutePath);
            return Collections.unmodifiableMap(prior);
        } catch (IOException e) {
            logger.warn("Could not load snapshot from {}: {} - treating as empty", absolutePath, e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * Writes a new snapshot stamped with the current time. The document is written
     * to a temporary file beside the target and then moved over it.
     */
    public EventSnapshot write(String sourceUrl, List<EventRecord> events) throws IOException {
        EventSnapshot snapshot = new EventSnapshot(sourceUrl, Instant.now(clock), events);

        Path absolutePath = snapshotPath.toAbsolutePath();
        Path directory = absolutePath.getParent();
        Files.createDirectories(directory);

        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
        Path tempFile = Files.createTempFile(directory, "." + absolutePath.getFileName(), ".tmp");
        try {
            Files.write(tempFile, json);
            try {
                Files.move(tempFile, absolutePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, replacing non-atomically", directory);
                Files.move(tempFile, absolutePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }

        logger.info("Saved {} events to {}", events.size(), absolutePath);
        return snapshot;
    }

    /**
     * Reads a full snapshot document, failing on unreadable input.
     */
    public EventSnapshot read() throws IOException {
        return objectMapper.readValue(snapshotPath.toFile(), EventSnapshot.class);
    }
}
