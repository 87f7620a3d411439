package com.streamhistory.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Tunable constants of a pipeline run.
 * <p>
 * Defaults are read from {@code streaming-history.properties} on the classpath. Each key can be
 * overridden per run through a JVM system property or environment variable named after the key
 * in upper snake case ({@code fuzzy.top.k} becomes {@code FUZZY_TOP_K}); system properties win.
 *
 * @param skipThresholdMs skipped plays shorter than this are dropped as noise
 * @param similarityThreshold fuzzy artist matches must score strictly above this
 * @param fuzzyTopK number of highest-volume unmatched Apple Music artists that get fuzzy matching
 * @param topListSize length of lifetime and annual top lists
 * @param artistTopListSize length of per-artist top track/album lists
 * @param earliestValidTimestamp plays before this instant are treated as corrupt
 * @param failureSampleSize number of parse-failure messages kept for the run summary
 *
 * @author Streaming History Team
 * @since 1.0
 */
public record PipelineSettings(
    long skipThresholdMs,
    double similarityThreshold,
    int fuzzyTopK,
    int topListSize,
    int artistTopListSize,
    Instant earliestValidTimestamp,
    int failureSampleSize
) {
    private static final Logger logger = LoggerFactory.getLogger(PipelineSettings.class);

    public static final String RESOURCE = "streaming-history.properties";

    public static final long DEFAULT_SKIP_THRESHOLD_MS = 30_000L;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;
    public static final int DEFAULT_FUZZY_TOP_K = 50;
    public static final int DEFAULT_TOP_LIST_SIZE = 50;
    public static final int DEFAULT_ARTIST_TOP_LIST_SIZE = 20;
    public static final Instant DEFAULT_EARLIEST_VALID_TIMESTAMP = Instant.parse("2000-01-01T00:00:00Z");
    public static final int DEFAULT_FAILURE_SAMPLE_SIZE = 20;

    public PipelineSettings {
        if (skipThresholdMs < 0) throw new IllegalArgumentException("skipThresholdMs must be >= 0");
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
        }
        if (fuzzyTopK < 0) throw new IllegalArgumentException("fuzzyTopK must be >= 0");
        if (topListSize < 1) throw new IllegalArgumentException("topListSize must be >= 1");
        if (artistTopListSize < 1) throw new IllegalArgumentException("artistTopListSize must be >= 1");
        if (earliestValidTimestamp == null) earliestValidTimestamp = DEFAULT_EARLIEST_VALID_TIMESTAMP;
        if (failureSampleSize < 0) throw new IllegalArgumentException("failureSampleSize must be >= 0");
    }

    /**
     * Returns the built-in defaults, ignoring the classpath file and overrides.
     */
    public static PipelineSettings defaults() {
        return new PipelineSettings(DEFAULT_SKIP_THRESHOLD_MS, DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_FUZZY_TOP_K,
            DEFAULT_TOP_LIST_SIZE, DEFAULT_ARTIST_TOP_LIST_SIZE, DEFAULT_EARLIEST_VALID_TIMESTAMP,
            DEFAULT_FAILURE_SAMPLE_SIZE);
    }

    /**
     * Loads settings from the classpath resource, then applies system property and environment overrides.
     */
    public static PipelineSettings load() {
        Properties props = new Properties();
        try (InputStream in = PipelineSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("{} not found on classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}. Using built-in defaults.", RESOURCE, e.getMessage());
        }
        return fromProperties(props);
    }

    /**
     * Builds settings from a property set, applying system property and environment overrides per key.
     */
    public static PipelineSettings fromProperties(Properties props) {
        return new PipelineSettings(
            setting(props, "skip.threshold.ms", Long.toString(DEFAULT_SKIP_THRESHOLD_MS), Long::parseLong),
            setting(props, "similarity.threshold", Double.toString(DEFAULT_SIMILARITY_THRESHOLD), Double::parseDouble),
            setting(props, "fuzzy.top.k", Integer.toString(DEFAULT_FUZZY_TOP_K), Integer::parseInt),
            setting(props, "top.list.size", Integer.toString(DEFAULT_TOP_LIST_SIZE), Integer::parseInt),
            setting(props, "artist.top.list.size", Integer.toString(DEFAULT_ARTIST_TOP_LIST_SIZE), Integer::parseInt),
            setting(props, "earliest.valid.timestamp", DEFAULT_EARLIEST_VALID_TIMESTAMP.toString(), Instant::parse),
            setting(props, "failure.sample.size", Integer.toString(DEFAULT_FAILURE_SAMPLE_SIZE), Integer::parseInt)
        );
    }

    /**
     * Looks up one key and parses it; a value that does not parse is reported under its key name.
     */
    private static <T> T setting(Properties props, String key, String fallback, Function<String, T> parser) {
        String value = lookup(props, key, fallback);
        try {
            return parser.apply(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + value + "'", e);
        }
    }

    private static String lookup(Properties props, String key, String fallback) {
        String envName = key.replace('.', '_').toUpperCase(Locale.ROOT);
        String fromFile = props.getProperty(key, fallback).trim();
        String value = System.getProperty(envName, System.getenv().getOrDefault(envName, fromFile));
        if (!value.equals(fromFile)) {
            logger.info("Setting {} overridden to {}", key, value);
        }
        return value.trim();
    }
}
