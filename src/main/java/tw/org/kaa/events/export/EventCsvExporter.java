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
package tw.org.kaa.events.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tw.org.kaa.events.shared.Configuration;
import tw.org.kaa.events.shared.CsvWriterUtil;
import tw.org.kaa.events.shared.EventRecord;
import tw.org.kaa.events.shared.LinkItem;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the events of a run as CSV, one row per event, with the date status
 * evaluated against today in Taipei.
 */
public class EventCsvExporter {

    private static final Logger logger = LoggerFactory.getLogger(EventCsvExporter.class);

    public static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");

    static final String[] EVENT_HEADERS = {
        "title", "category", "status", "days_until_start", "dates", "time_info", "location",
        "register", "register_url", "remarks", "downloads", "detail_url"
    };

    private final Configuration config;
    private final Clock clock;

    public EventCsvExporter(Configuration config) {
        this(config, Clock.system(TAIPEI));
    }

    public EventCsvExporter(Configuration config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public Path export(List<EventRecord> records) throws IOException {
        LocalDate today = LocalDate.now(clock.withZone(TAIPEI));
        List<String[]> rows = new ArrayList<>();
        for (EventRecord record : records) {
            rows.add(createRow(record, today));
        }

        Path outputDir = Paths.get(config.getCsvOutputPath());
        Path csvPath = CsvWriterUtil.writeCsvWithLatestCopy(EVENT_HEADERS, rows, outputDir, "events",
            LocalDateTime.now(clock.withZone(TAIPEI)), config.isWriteLatestCopy());
        logger.info("Exported {} events to {}", rows.size(), csvPath);
        return csvPath;
    }

    String[] createRow(EventRecord record, LocalDate today) {
        EventStatus status = EventStatus.evaluate(record.getDates(), today, config.getUpcomingSoonDays());
        Long days = EventStatus.daysUntilReference(record.getDates(), today);
        return new String[] {
            nullToEmpty(record.getTitle()),
            record.getCategory() != null ? record.getCategory().getId() : "",
            status.getId(),
            days != null ? days.toString() : "",
            String.join(" | ", record.getDates()),
            String.join(" | ", record.getTimeInfo()),
            nullToEmpty(record.getLocation()),
            nullToEmpty(record.getRegister()),
            nullToEmpty(record.getRegisterUrl()),
            nullToEmpty(record.getRemarks()),
            record.getDownloads().stream().map(LinkItem::getUrl).collect(Collectors.joining(" | ")),
            nullToEmpty(record.getDetailUrl())
        };
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
