package com.streamhistory.pipeline;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads Apple Music "Play History Daily Tracks" CSV exports using OpenCSV.
 * <p>
 * The first row is the header. Each data row becomes an {@link AppleMusicRawRecord} keyed by header name.
 * Rows with fewer cells than the header are counted as parse failures; blank lines are ignored.
 * A file without the required columns is rejected as a whole.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class AppleMusicHistoryReader implements HistoryReaderInterface<AppleMusicRawRecord> {
    private static final Logger logger = LoggerFactory.getLogger(AppleMusicHistoryReader.class);

    private static final char BOM = '\uFEFF';

    private final int failureSampleSize;

    public AppleMusicHistoryReader(int failureSampleSize) {
        this.failureSampleSize = Math.max(0, failureSampleSize);
    }

    public AppleMusicHistoryReader() {
        this(PipelineSettings.DEFAULT_FAILURE_SAMPLE_SIZE);
    }

    @Override
    public RawBatch<AppleMusicRawRecord> read(List<Path> files) {
        if (files == null) {
            throw new IllegalArgumentException("File list cannot be null");
        }
        List<AppleMusicRawRecord> records = new ArrayList<>();
        List<String> samples = new ArrayList<>();
        int failed = 0;
        long rowNumber = 0;
        for (Path file : files) {
            if (file == null || !Files.isRegularFile(file)) {
                throw new MissingInputException(String.valueOf(file), "Apple Music play history file not found: " + file);
            }
            try (CSVReader reader = new CSVReader(Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
                String[] header = reader.readNext();
                if (header == null) {
                    logger.warn("Apple Music file {} is empty", file);
                    continue;
                }
                header = cleanHeader(header);
                checkRequiredColumns(file, header);
                String[] row;
                while ((row = reader.readNext()) != null) {
                    if (row.length == 1 && row[0].isBlank()) continue;
                    rowNumber++;
                    if (row.length < header.length) {
                        failed++;
                        String message = "Apple Music row " + rowNumber + ": expected " + header.length + " cells, found " + row.length;
                        logger.debug("Skipping short row in {}: {}", file, message);
                        if (samples.size() < failureSampleSize) samples.add(message);
                        continue;
                    }
                    Map<String, String> columns = new LinkedHashMap<>();
                    for (int i = 0; i < header.length; i++) {
                        columns.put(header[i], row[i]);
                    }
                    records.add(new AppleMusicRawRecord(rowNumber, columns));
                }
            } catch (IOException | CsvValidationException e) {
                throw new MissingInputException(file.toString(), "Unreadable Apple Music play history " + file + ": " + e.getMessage(), e);
            }
            logger.info("Read Apple Music play history from {} ({} rows so far)", file, rowNumber);
        }
        return new RawBatch<>(records, failed, samples);
    }

    private static String[] cleanHeader(String[] header) {
        String[] cleaned = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i];
            if (i == 0 && !h.isEmpty() && h.charAt(0) == BOM) h = h.substring(1);
            cleaned[i] = h.trim();
        }
        return cleaned;
    }

    private static void checkRequiredColumns(Path file, String[] header) {
        AppleMusicRawRecord probe = new AppleMusicRawRecord(0, headerOnly(header));
        List<String> missing = new ArrayList<>();
        for (RecordField field : RecordFieldRegistry.getAppleMusicRequiredFields()) {
            if (!probe.hasColumn(field)) missing.add(field.fieldName());
        }
        if (!missing.isEmpty()) {
            throw new MissingInputException(file.toString(), "Apple Music file " + file + " lacks required columns " + missing);
        }
    }

    private static Map<String, String> headerOnly(String[] header) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (String h : header) columns.put(h, "");
        return columns;
    }
}
