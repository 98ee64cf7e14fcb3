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

/**
 * Outcome of comparing a fresh record with the prior snapshot.
 */
public enum MergeDecision {
    /** No prior record; the detail page is fetched. */
    NEW,
    /** Prior record lacks downloads, remarks or registration; the detail page is fetched again. */
    INCOMPLETE,
    /** Prior record already carries every detail-derived field; no fetch. */
    COMPLETE,
    /** Record has no detail link; nothing to fetch. */
    NO_DETAIL;

    public boolean needsDetailFetch() {
        return this == NEW || this == INCOMPLETE;
    }
}
