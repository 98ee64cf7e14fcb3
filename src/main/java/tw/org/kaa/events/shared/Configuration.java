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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Configuration management for the event aggregator.
 * Values come from config.json and may be overridden by environment variables.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Configuration {

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    public static final String ENV_DETAIL_CONCURRENCY = "DETAIL_CONCURRENCY";
    public static final String ENV_DETAIL_DELAY_MS = "DETAIL_DELAY_MS";
    public static final String ENV_PAGE_COUNT = "PAGE_COUNT";

    // Default values
    private static final String DEFAULT_BASE_URL = "https://www.kaa.org.tw";
    private static final String DEFAULT_LIST_URL = DEFAULT_BASE_URL + "/news_list.php?t1=1";
    private static final int DEFAULT_PAGE_COUNT = 5;
    private static final int DEFAULT_DETAIL_CONCURRENCY = 4;
    private static final long DEFAULT_DETAIL_DELAY_MS = 0;
    private static final int DEFAULT_DETAIL_CACHE_CAPACITY = 256;
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_READ_TIMEOUT_MS = 30000;
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/129.0.0.0 Safari/537.36";
    private static final String DEFAULT_REFERER = DEFAULT_BASE_URL + "/";
    private static final String DEFAULT_SNAPSHOT_PATH = "data/events.json";
    private static final String DEFAULT_CSV_OUTPUT_PATH = "data/csv";
    private static final boolean DEFAULT_WRITE_CSV_EXPORT = true;
    private static final boolean DEFAULT_WRITE_LATEST_COPY = true;
    private static final int DEFAULT_CHECK_INTERVAL_SECONDS = 86400; // 24 hours
    private static final int DEFAULT_UPCOMING_SOON_DAYS = 7;

    private String baseUrl;
    private String listUrl;
    private int pageCount;
    private int detailConcurrency;
    private long detailDelayMs;        // Pause after each detail fetch, per worker
    private int detailCacheCapacity;
    private int connectTimeoutMs;
    private int readTimeoutMs;
    private String userAgent;
    private String referer;
    private String snapshotPath;
    private String csvOutputPath;
    private boolean writeCsvExport;
    private boolean writeLatestCopy;   // Whether to write events-latest.csv for easy Git diffing
    private int checkIntervalSeconds;
    private int upcomingSoonDays;

    // Default constructor for Jackson
    public Configuration() {
        this.baseUrl = DEFAULT_BASE_URL;
        this.listUrl = DEFAULT_LIST_URL;
        this.pageCount = DEFAULT_PAGE_COUNT;
        this.detailConcurrency = DEFAULT_DETAIL_CONCURRENCY;
        this.detailDelayMs = DEFAULT_DETAIL_DELAY_MS;
        this.detailCacheCapacity = DEFAULT_DETAIL_CACHE_CAPACITY;
        this.connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        this.readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        this.userAgent = DEFAULT_USER_AGENT;
        this.referer = DEFAULT_REFERER;
        this.snapshotPath = DEFAULT_SNAPSHOT_PATH;
        this.csvOutputPath = DEFAULT_CSV_OUTPUT_PATH;
        this.writeCsvExport = DEFAULT_WRITE_CSV_EXPORT;
        this.writeLatestCopy = DEFAULT_WRITE_LATEST_COPY;
        this.checkIntervalSeconds = DEFAULT_CHECK_INTERVAL_SECONDS;
        this.upcomingSoonDays = DEFAULT_UPCOMING_SOON_DAYS;
    }

    /**
     * Loads configuration from config.json, creating it with defaults when missing,
     * then applies environment overrides.
     */
    public static Configuration load() throws IOException {
        Configuration config = load(new File("config.json"));
        config.applyEnvironment(System.getenv());
        return config;
    }

    /**
     * Loads configuration from the given file without applying environment overrides.
     */
    public static Configuration load(File configFile) throws IOException {
        if (configFile.exists() && configFile.length() > 0) {
            logger.info("Loading configuration from {}", configFile);
            try {
                ObjectMapper mapper = new ObjectMapper();
                Configuration config = mapper.readValue(configFile, Configuration.class);
                config.resetInvalidValues();
                return config;
            } catch (IOException e) {
                logger.warn("Error reading {}, using defaults: {}", configFile, e.getMessage());
            }
        }

        logger.info("No valid {} found, using default configuration", configFile.getName());
        Configuration config = new Configuration();

        // Save default configuration for user to edit
        if (!configFile.exists()) {
            config.save(configFile.getPath());
        }

        return config;
    }

    /**
     * Overrides pool size, delay and page count from environment-style variables.
     * Values that are not numbers, or out of range, are ignored.
     */
    public void applyEnvironment(Map<String, String> env) {
        Long concurrency = parseOverride(env, ENV_DETAIL_CONCURRENCY, 1, Integer.MAX_VALUE);
        if (concurrency != null) {
            this.detailConcurrency = concurrency.intValue();
        }
        Long delay = parseOverride(env, ENV_DETAIL_DELAY_MS, 0, Long.MAX_VALUE);
        if (delay != null) {
            this.detailDelayMs = delay;
        }
        Long pages = parseOverride(env, ENV_PAGE_COUNT, 1, Integer.MAX_VALUE);
        if (pages != null) {
            this.pageCount = pages.intValue();
        }
    }

    /**
     * Replaces out-of-range values read from a config file with their defaults.
     */
    void resetInvalidValues() {
        if (pageCount < 1) {
            logger.warn("Ignoring pageCount={}: must be at least 1", pageCount);
            pageCount = DEFAULT_PAGE_COUNT;
        }
        if (detailConcurrency < 1) {
            logger.warn("Ignoring detailConcurrency={}: must be at least 1", detailConcurrency);
            detailConcurrency = DEFAULT_DETAIL_CONCURRENCY;
        }
        if (detailDelayMs < 0) {
            logger.warn("Ignoring detailDelayMs={}: must be at least 0", detailDelayMs);
            detailDelayMs = DEFAULT_DETAIL_DELAY_MS;
        }
        if (detailCacheCapacity < 1) {
            logger.warn("Ignoring detailCacheCapacity={}: must be at least 1", detailCacheCapacity);
            detailCacheCapacity = DEFAULT_DETAIL_CACHE_CAPACITY;
        }
    }

    private static Long parseOverride(Map<String, String> env, String name, long minimum, long maximum) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value > maximum) {
                logger.warn("Ignoring {}={}: must be at most {}", name, raw, maximum);
                return null;
            }
            if (value < minimum) {
                logger.warn("Ignoring {}={}: must be at least {}", name, raw, minimum);
                return null;
            }
            logger.info("Using {}={} from environment", name, value);
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not a number", name, raw);
            return null;
        }
    }

    /**
     * Saves configuration to the specified file path.
     */
    public void save(String filePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        File configFile = new File(filePath);
        mapper.writerWithDefaultPrettyPrinter()
              .writeValue(configFile, this);
        logger.info("Configuration saved to {}", filePath);
    }

    // Getters and setters
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getListUrl() {
        return listUrl;
    }

    public void setListUrl(String listUrl) {
        this.listUrl = listUrl;
    }

    public int getPageCount() {
        return pageCount;
    }

    public void setPageCount(int pageCount) {
        this.pageCount = pageCount;
    }

    public int getDetailConcurrency() {
        return detailConcurrency;
    }

    public void setDetailConcurrency(int detailConcurrency) {
        this.detailConcurrency = detailConcurrency;
    }

    public long getDetailDelayMs() {
        return detailDelayMs;
    }

    public void setDetailDelayMs(long detailDelayMs) {
        this.detailDelayMs = detailDelayMs;
    }

    public int getDetailCacheCapacity() {
        return detailCacheCapacity;
    }

    public void setDetailCacheCapacity(int detailCacheCapacity) {
        this.detailCacheCapacity = detailCacheCapacity;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getReferer() {
        return referer;
    }

    public void setReferer(String referer) {
        this.referer = referer;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }

    public String getCsvOutputPath() {
        return csvOutputPath;
    }

    public void setCsvOutputPath(String csvOutputPath) {
        this.csvOutputPath = csvOutputPath;
    }

    public boolean isWriteCsvExport() {
        return writeCsvExport;
    }

    public void setWriteCsvExport(boolean writeCsvExport) {
        this.writeCsvExport = writeCsvExport;
    }

    public boolean isWriteLatestCopy() {
        return writeLatestCopy;
    }

    public void setWriteLatestCopy(boolean writeLatestCopy) {
        this.writeLatestCopy = writeLatestCopy;
    }

    public int getCheckIntervalSeconds() {
        return checkIntervalSeconds;
    }

    public void setCheckIntervalSeconds(int checkIntervalSeconds) {
        this.checkIntervalSeconds = checkIntervalSeconds;
    }

    public int getUpcomingSoonDays() {
        return upcomingSoonDays;
    }

    public void setUpcomingSoonDays(int upcomingSoonDays) {
        this.upcomingSoonDays = upcomingSoonDays;
    }

    /**
     * Returns the URL of the given list page. Page 1 is the plain list URL,
     * later pages add the "b" offset parameter.
     */
    @JsonIgnore
    public String getListPageUrl(int page) {
        if (page <= 1) {
            return listUrl;
        }
        String separator = listUrl.contains("?") ? "&" : "?";
        return listUrl + separator + "b=" + page;
    }
}
