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
package tw.org.kaa.events.phase3.detail;

import tw.org.kaa.events.shared.LinkItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields extracted from one detail page. Field values may be null when the
 * row had a label but no data.
 */
public final class DetailPage {

    private final Map<String, String> fields;
    private final List<LinkItem> downloads;
    private final RegisterInfo registerInfo;

    public DetailPage(Map<String, String> fields, List<LinkItem> downloads, RegisterInfo registerInfo) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.downloads = List.copyOf(downloads);
        this.registerInfo = registerInfo;
    }

    /**
     * Label to value, in page order.
     */
    public Map<String, String> getFields() {
        return fields;
    }

    public List<LinkItem> getDownloads() {
        return downloads;
    }

    /**
     * @return the registration info, or null if the page has none
     */
    public RegisterInfo getRegisterInfo() {
        return registerInfo;
    }
}
