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
package tw.org.kaa.events.phase2.merge;

import tw.org.kaa.events.shared.EventRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Merged records in list order, the fresh list records they came from, and the
 * decision made for each.
 */
public class MergeResult {

    private final List<EventRecord> records;
    private final List<EventRecord> freshRecords;
    private final List<MergeDecision> decisions;

    public MergeResult(List<EventRecord> records, List<EventRecord> freshRecords, List<MergeDecision> decisions) {
        if (records.size() != decisions.size() || freshRecords.size() != decisions.size()) {
            throw new IllegalArgumentException("Expected one fresh record and one decision per merged record");
        }
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.freshRecords = Collections.unmodifiableList(new ArrayList<>(freshRecords));
        this.decisions = Collections.unmodifiableList(new ArrayList<>(decisions));
    }

    /**
     * Merged records; the detail phase updates these in place.
     */
    public List<EventRecord> getRecords() {
        return records;
    }

    /**
     * The records as built from the list pages, before merging.
     */
    public List<EventRecord> getFreshRecords() {
        return freshRecords;
    }

    public List<MergeDecision> getDecisions() {
        return decisions;
    }

    /**
     * Indexes of the records whose detail page must be fetched, ascending.
     */
    public List<Integer> getDetailTargets() {
        List<Integer> targets = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            if (decisions.get(i).needsDetailFetch()) {
                targets.add(i);
            }
        }
        return targets;
    }

    public long count(MergeDecision decision) {
        return decisions.stream().filter(d -> d == decision).count();
    }
}
