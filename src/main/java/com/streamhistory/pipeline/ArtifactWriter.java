package com.streamhistory.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Serializes the run's documents as indented JSON with Jackson.
 * <p>
 * Documents are first written into a staging directory next to the target. Files are moved into
 * place only after every document serialized, so a failure leaves the output directory untouched.
 * Instants are written as ISO-8601 strings and property names in snake_case.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class ArtifactWriter implements ArtifactWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

    public static final String CONSOLIDATED_LOG = "consolidated_streaming_data.json";
    public static final String ARTIST_MAPPING = "artist_mapping_summary.json";
    public static final String LIFETIME_STATS = "lifetime_streaming_stats.json";
    public static final String ANNUAL_RECAPS = "annual_recaps.json";
    public static final String ARTIST_SUMMARY = "artist_summary.json";
    public static final String PIPELINE_SUMMARY = "pipeline_summary.json";

    private final ObjectMapper mapper;

    public ArtifactWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ArtifactWriter() {
        this(createObjectMapper());
    }

    /**
     * @return the mapper configuration used for every output document
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    @Override
    public List<Path> write(PipelineResult result, Path outputDir) throws IOException {
        if (result == null) {
            throw new IllegalArgumentException("Pipeline result cannot be null");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("Output directory cannot be null");
        }
        Files.createDirectories(outputDir);
        Map<String, Object> documents = documents(result);
        Path staging = Files.createTempDirectory(outputDir, ".staging-");
        try {
            for (Map.Entry<String, Object> doc : documents.entrySet()) {
                mapper.writeValue(staging.resolve(doc.getKey()).toFile(), doc.getValue());
            }
            List<Path> written = new ArrayList<>(documents.size());
            for (String name : documents.keySet()) {
                Path target = outputDir.resolve(name);
                move(staging.resolve(name), target);
                written.add(target);
            }
            logger.info("Wrote {} artifacts to {}", written.size(), outputDir);
            return written;
        } finally {
            deleteRecursively(staging);
        }
    }

    static Map<String, Object> documents(PipelineResult result) {
        Map<String, Object> docs = new LinkedHashMap<>();
        docs.put(CONSOLIDATED_LOG, result.canonicalLog());
        docs.put(ARTIST_MAPPING, result.mappingReport());
        docs.put(LIFETIME_STATS, result.lifetimeStats());
        docs.put(ANNUAL_RECAPS, result.annualRecaps());
        docs.put(ARTIST_SUMMARY, result.artistSummary());
        docs.put(PIPELINE_SUMMARY, result.summary());
        return docs;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.warn("Failed to remove staging file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to clean staging directory {}: {}", dir, e.getMessage());
        }
    }
}
