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

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where an event stands relative to today, judged from its displayed dates.
 *
 * <p>The reference date is the earliest date on or after today, or the last
 * date if all are past. Dates that do not contain a {@code yyyy/MM/dd} or
 * {@code yyyy-MM-dd} value are ignored.</p>
 */
public enum EventStatus {
    PAST("past"),
    COMING_SOON("coming-soon"),
    UPCOMING("upcoming"),
    NO_DATE("no-date");

    private static final Pattern DATE_PATTERN = Pattern.compile("(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})");

    private final String id;

    EventStatus(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static EventStatus evaluate(List<String> dates, LocalDate today, int soonDays) {
        Long days = daysUntilReference(dates, today);
        if (days == null) {
            return NO_DATE;
        }
        if (days < 0) {
            return PAST;
        }
        return days <= soonDays ? COMING_SOON : UPCOMING;
    }

    /**
     * @return days from today to the reference date (negative when past), or null without dates
     */
    public static Long daysUntilReference(List<String> dates, LocalDate today) {
        List<LocalDate> parsed = parseDates(dates);
        if (parsed.isEmpty()) {
            return null;
        }
        LocalDate reference = parsed.get(parsed.size() - 1);
        for (LocalDate date : parsed) {
            if (!date.isBefore(today)) {
                reference = date;
                break;
            }
        }
        return ChronoUnit.DAYS.between(today, reference);
    }

    /**
     * Parses and sorts the recognizable dates.
     */
    static List<LocalDate> parseDates(List<String> dates) {
        List<LocalDate> parsed = new ArrayList<>();
        for (String value : dates) {
            if (value == null) {
                continue;
            }
            Matcher matcher = DATE_PATTERN.matcher(value);
            if (!matcher.find()) {
                continue;
            }
            try {
                parsed.add(LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))));
            } catch (DateTimeException e) {
                // e.g. 2025/02/30
                continue;
            }
        }
        Collections.sort(parsed);
        return parsed;
    }
}
