package com.streamhistory.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Spotify extended streaming history exports ({@code Streaming_History_Audio_*.json}).
 * <p>
 * Each file must hold a JSON array. Array elements are decoded one by one so that a single bad
 * element is counted as a parse failure instead of failing the file. Spotify is the reference
 * provider: a missing or unreadable file, or no records at all, is fatal.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class SpotifyHistoryReader implements HistoryReaderInterface<SpotifyRawRecord> {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyHistoryReader.class);

    private final ObjectMapper mapper;
    private final int failureSampleSize;

    public SpotifyHistoryReader(ObjectMapper mapper, int failureSampleSize) {
        this.mapper = mapper;
        this.failureSampleSize = Math.max(0, failureSampleSize);
    }

    public SpotifyHistoryReader() {
        this(new ObjectMapper(), PipelineSettings.DEFAULT_FAILURE_SAMPLE_SIZE);
    }

    @Override
    public RawBatch<SpotifyRawRecord> read(List<Path> files) {
        if (files == null || files.isEmpty()) {
            throw new MissingInputException("spotify", "No Spotify streaming history files were supplied");
        }
        List<SpotifyRawRecord> records = new ArrayList<>();
        List<String> samples = new ArrayList<>();
        int failed = 0;
        for (Path file : files) {
            JsonNode root = readTree(file);
            int index = 0;
            for (JsonNode element : root) {
                try {
                    records.add(mapper.treeToValue(element, SpotifyRawRecord.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    failed++;
                    String message = file.getFileName() + "[" + index + "]: " + e.getMessage();
                    logger.debug("Undecodable Spotify element {}", message);
                    if (samples.size() < failureSampleSize) samples.add(message);
                }
                index++;
            }
            logger.info("Read {} Spotify elements from {}", index, file);
        }
        if (records.isEmpty()) {
            throw new MissingInputException(files.toString(), "Spotify input contains no streaming records: " + files);
        }
        return new RawBatch<>(records, failed, samples);
    }

    private JsonNode readTree(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new MissingInputException(String.valueOf(file), "Spotify streaming history file not found: " + file);
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isArray()) {
                throw new MissingInputException(file.toString(), "Spotify streaming history is not a JSON array: " + file);
            }
            return root;
        } catch (IOException e) {
            throw new MissingInputException(file.toString(), "Unreadable Spotify streaming history " + file + ": " + e.getMessage(), e);
        }
    }
}
