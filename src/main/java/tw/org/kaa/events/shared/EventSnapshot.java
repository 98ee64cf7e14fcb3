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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The persisted output document of a run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"sourceUrl", "scrapedAt", "events"})
public class EventSnapshot {

    private String sourceUrl;
    private Instant scrapedAt;
    private List<EventRecord> events = new ArrayList<>();

    /**
     * Default constructor for Jackson deserialization.
     */
    public EventSnapshot() {
    }

    public EventSnapshot(String sourceUrl, Instant scrapedAt, List<EventRecord> events) {
        this.sourceUrl = sourceUrl;
        this.scrapedAt = scrapedAt;
        this.events = new ArrayList<>(events);
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public Instant getScrapedAt() {
        return scrapedAt;
    }

    public void setScrapedAt(Instant scrapedAt) {
        this.scrapedAt = scrapedAt;
    }

    public List<EventRecord> getEvents() {
        return events;
    }

    public void setEvents(List<EventRecord> events) {
        this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    }
}
