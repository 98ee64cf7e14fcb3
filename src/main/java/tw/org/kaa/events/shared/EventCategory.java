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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category assigned to an event from its title.
 */
public enum EventCategory {
    MEETING("meeting"),
    OUTING("outing"),
    MOVIE("movie"),
    WORKSHOP("workshop"),
    OTHER("other");

    private final String id;

    EventCategory(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Resolves a persisted category id; unknown ids map to {@link #OTHER}.
     */
    @JsonCreator
    public static EventCategory fromId(String id) {
        for (EventCategory category : values()) {
            if (category.id.equals(id)) {
                return category;
            }
        }
        return OTHER;
    }
}
