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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Utility class for writing CSV files with consistent formatting.
 */
public class CsvWriterUtil {

    private static final Logger logger = LoggerFactory.getLogger(CsvWriterUtil.class);

    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private CsvWriterUtil() {
    }

    /**
     * Writes a CSV file with headers and data rows, every field quoted.
     *
     * @param headers Array of column headers
     * @param data List of data rows (each row is an array of strings)
     * @param outputPath Path to the output CSV file
     * @throws IOException if writing fails
     */
    public static void writeCsv(String[] headers, List<String[]> data, Path outputPath) throws IOException {
        Files.createDirectories(outputPath.toAbsolutePath().getParent());

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(headers)
            .setQuoteMode(QuoteMode.ALL)
            .setRecordSeparator(System.lineSeparator())
            .build();

        try (CSVPrinter printer = new CSVPrinter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                format)) {
            for (String[] row : data) {
                printer.printRecord((Object[]) row);
            }
        }
        logger.debug("Wrote CSV file: {} with {} rows", outputPath, data.size());
    }

    /**
     * Generates a timestamped filename such as {@code events-20250101-120000.csv}.
     */
    public static String generateTimestampedFilename(String baseName, LocalDateTime time) {
        return String.format("%s-%s.csv", baseName, time.format(TIMESTAMP_FORMATTER));
    }

    /**
     * Writes a timestamped CSV file and optionally a {@code <baseName>-latest.csv} copy.
     *
     * @return Path to the timestamped CSV file
     */
    public static Path writeCsvWithLatestCopy(String[] headers, List<String[]> data, Path outputDir,
                                              String baseFilename, LocalDateTime time,
                                              boolean writeLatestCopy) throws IOException {
        Path csvPath = outputDir.resolve(generateTimestampedFilename(baseFilename, time));
        writeCsv(headers, data, csvPath);

        if (writeLatestCopy) {
            Path latestPath = outputDir.resolve(baseFilename + "-latest.csv");
            writeCsv(headers, data, latestPath);
            logger.debug("Wrote latest copy: {}", latestPath);
        }
        return csvPath;
    }
}
