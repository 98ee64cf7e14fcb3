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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tw.org.kaa.events.shared.EventRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Phase 2: Merges freshly collected records with the prior snapshot and decides
 * which detail pages need fetching.
 *
 * <p>A merged record starts from the prior record and takes every field the list
 * page owns from the fresh record. Registration fields are taken only when the
 * fresh row has them, since they may have come from the detail page. Remarks and
 * downloads always survive from the prior record.</p>
 */
public class SnapshotMerger {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotMerger.class);

    private final Map<String, EventRecord> prior;

    /**
     * @param prior previous run's records by key; only read
     */
    public SnapshotMerger(Map<String, EventRecord> prior) {
        this.prior = prior;
    }

    public MergeResult merge(List<EventRecord> fresh) {
        logger.info("Phase 2: Merging {} events with {} from the prior snapshot", fresh.size(), prior.size());

        List<EventRecord> merged = new ArrayList<>(fresh.size());
        List<MergeDecision> decisions = new ArrayList<>(fresh.size());

        for (EventRecord current : fresh) {
            EventRecord existing = prior.get(current.getKey());
            MergeDecision decision = decide(current, existing);
            merged.add(existing != null ? mergeRecords(existing, current) : new EventRecord(current));
            decisions.add(decision);

            switch (decision) {
                case NEW:
                    logger.info("NEW event: {} - not in snapshot", current.getTitle());
                    break;
                case INCOMPLETE:
                    logger.info("INCOMPLETE event: {} - {}", current.getTitle(), missingDetails(existing));
                    break;
                default:
                    logger.debug("{} event: {}", decision, current.getTitle());
                    break;
            }
        }

        MergeResult result = new MergeResult(merged, fresh, decisions);
        logger.info("Phase 2 complete. {} new, {} incomplete, {} complete, {} without detail page",
            result.count(MergeDecision.NEW), result.count(MergeDecision.INCOMPLETE),
            result.count(MergeDecision.COMPLETE), result.count(MergeDecision.NO_DETAIL));
        return result;
    }

    /**
     * Decides whether a detail fetch is needed, judged on the prior record alone.
     */
    static MergeDecision decide(EventRecord current, EventRecord existing) {
        if (!current.hasDetailUrl()) {
            return MergeDecision.NO_DETAIL;
        }
        if (existing == null) {
            return MergeDecision.NEW;
        }
        if (existing.hasDownloads() && existing.hasRemarks() && existing.hasRegister()) {
            return MergeDecision.COMPLETE;
        }
        return MergeDecision.INCOMPLETE;
    }

    /**
     * Overlays the list-page fields of {@code current} onto a copy of {@code existing}.
     */
    static EventRecord mergeRecords(EventRecord existing, EventRecord current) {
        EventRecord merged = new EventRecord(existing);
        merged.setTitle(current.getTitle());
        merged.setDetailUrl(current.getDetailUrl());
        merged.setLocation(current.getLocation());
        merged.setDates(current.getDates());
        merged.setTimeInfo(current.getTimeInfo());
        merged.setNote(current.getNote());
        merged.setNoteUrl(current.getNoteUrl());
        merged.setExtras(current.getExtras());
        if (current.getRegister() != null) {
            merged.setRegister(current.getRegister());
        }
        if (current.getRegisterUrl() != null) {
            merged.setRegisterUrl(current.getRegisterUrl());
        }
        return merged;
    }

    private static String missingDetails(EventRecord existing) {
        List<String> missing = new ArrayList<>();
        if (!existing.hasDownloads()) {
            missing.add("downloads");
        }
        if (!existing.hasRemarks()) {
            missing.add("remarks");
        }
        if (!existing.hasRegister()) {
            missing.add("registration");
        }
        return "missing " + String.join(", ", missing);
    }
}
