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
import java.util.List;

/**
 * Final ordered records of a run, with what the detail phase did.
 */
public class AggregationResult {

    private final List<EventRecord> records;
    private final int detailFetchesQueued;
    private final List<String> warnings;

    public AggregationResult(List<EventRecord> records, int detailFetchesQueued, List<String> warnings) {
        this.records = Collections.unmodifiableList(records);
        this.detailFetchesQueued = detailFetchesQueued;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public List<EventRecord> getRecords() {
        return records;
    }

    public int getDetailFetchesQueued() {
        return detailFetchesQueued;
    }

    /**
     * Per-item problems that did not stop the run, such as unreachable detail pages.
     */
    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
