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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One announcement from the activity list, optionally enriched from its detail page.
 * The record key is the detail URL when present, otherwise the title.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    "title", "detailUrl", "location", "dates", "timeInfo", "note", "noteUrl",
    "register", "registerUrl", "extras", "category", "remarks", "downloads"
})
public class EventRecord {

    // Fields taken from the list row
    private String title;
    private String detailUrl;
    private String location;
    private List<String> dates = new ArrayList<>();
    private List<String> timeInfo = new ArrayList<>();
    private String note;
    private String noteUrl;
    private List<LinkItem> extras = new ArrayList<>();

    // From the list row, or from the detail page when the row has none
    private String register;
    private String registerUrl;

    // Derived from the title, never trusted from input
    private EventCategory category;

    // Only available from the detail page
    private String remarks;
    private List<LinkItem> downloads = new ArrayList<>();

    /**
     * Default constructor for Jackson deserialization.
     */
    public EventRecord() {
    }

    public EventRecord(String title) {
        this.title = title;
    }

    /**
     * Copy constructor. Lists are copied, list elements are immutable.
     */
    public EventRecord(EventRecord other) {
        this.title = other.title;
        this.detailUrl = other.detailUrl;
        this.location = other.location;
        this.dates = new ArrayList<>(other.dates);
        this.timeInfo = new ArrayList<>(other.timeInfo);
        this.note = other.note;
        this.noteUrl = other.noteUrl;
        this.extras = new ArrayList<>(other.extras);
        this.register = other.register;
        this.registerUrl = other.registerUrl;
        this.category = other.category;
        this.remarks = other.remarks;
        this.downloads = new ArrayList<>(other.downloads);
    }

    /**
     * Identity used for deduplication and snapshot merging.
     */
    @JsonIgnore
    public String getKey() {
        return keyOf(detailUrl, title);
    }

    /**
     * Returns the detail URL if non-empty, else the title if non-empty, else null.
     */
    public static String keyOf(String detailUrl, String title) {
        if (detailUrl != null && !detailUrl.isEmpty()) {
            return detailUrl;
        }
        if (title != null && !title.isEmpty()) {
            return title;
        }
        return null;
    }

    @JsonIgnore
    public boolean hasDetailUrl() {
        return detailUrl != null && !detailUrl.isEmpty();
    }

    @JsonIgnore
    public boolean hasRegister() {
        return (register != null && !register.isEmpty()) || (registerUrl != null && !registerUrl.isEmpty());
    }

    @JsonIgnore
    public boolean hasRemarks() {
        return remarks != null && !remarks.isEmpty();
    }

    @JsonIgnore
    public boolean hasDownloads() {
        return !downloads.isEmpty();
    }

    // Getters and Setters
    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDetailUrl() {
        return detailUrl;
    }

    public void setDetailUrl(String detailUrl) {
        this.detailUrl = detailUrl;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getDates() {
        return dates;
    }

    public void setDates(List<String> dates) {
        this.dates = dates != null ? new ArrayList<>(dates) : new ArrayList<>();
    }

    public List<String> getTimeInfo() {
        return timeInfo;
    }

    public void setTimeInfo(List<String> timeInfo) {
        this.timeInfo = timeInfo != null ? new ArrayList<>(timeInfo) : new ArrayList<>();
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }

    public String getNoteUrl() {
        return noteUrl;
    }

    public void setNoteUrl(String noteUrl) {
        this.noteUrl = noteUrl;
    }

    public String getRegister() {
        return register;
    }

    public void setRegister(String register) {
        this.register = register;
    }

    public String getRegisterUrl() {
        return registerUrl;
    }

    public void setRegisterUrl(String registerUrl) {
        this.registerUrl = registerUrl;
    }

    public List<LinkItem> getExtras() {
        return extras;
    }

    public void setExtras(List<LinkItem> extras) {
        this.extras = extras != null ? new ArrayList<>(extras) : new ArrayList<>();
    }

    public EventCategory getCategory() {
        return category;
    }

    public void setCategory(EventCategory category) {
        this.category = category;
    }

    public String getRemarks() {
        return remarks;
    }

    public void setRemarks(String remarks) {
        this.remarks = remarks;
    }

    public List<LinkItem> getDownloads() {
        return downloads;
    }

    public void setDownloads(List<LinkItem> downloads) {
        this.downloads = downloads != null ? new ArrayList<>(downloads) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventRecord that = (EventRecord) o;
        return Objects.equals(title, that.title)
            && Objects.equals(detailUrl, that.detailUrl)
            && Objects.equals(location, that.location)
            && Objects.equals(dates, that.dates)
            && Objects.equals(timeInfo, that.timeInfo)
            && Objects.equals(note, that.note)
            && Objects.equals(noteUrl, that.noteUrl)
            && Objects.equals(register, that.register)
            && Objects.equals(registerUrl, that.registerUrl)
            && Objects.equals(extras, that.extras)
            && category == that.category
            && Objects.equals(remarks, that.remarks)
            && Objects.equals(downloads, that.downloads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, detailUrl, location, dates, timeInfo, note, noteUrl,
            register, registerUrl, extras, category, remarks, downloads);
    }

    @Override
    public String toString() {
        return "EventRecord{" + getKey() + "}";
    }
}
