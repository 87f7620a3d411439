package com.streamhistory.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point for the streaming history consolidator.
 * <p>
 * Usage: {@code Main <spotify.json>[,<spotify2.json>...] [apple.csv] [outDir]}.
 * The output directory defaults to {@code OUTPUT_DIR} (system property or environment), then {@code output}.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: Main <spotify.json>[,<spotify2.json>...] [apple.csv] [outDir]";

    /**
     * Runs the pipeline and writes every artifact.
     * @param args command-line arguments
     * @return process exit status, 0 on success
     */
    static int run(String[] args) {
        if (args == null || args.length == 0 || args.length > 3) {
            logger.error(USAGE);
            return 1;
        }
        List<Path> spotifyFiles = new ArrayList<>();
        for (String part : args[0].split(",")) {
            if (!part.isBlank()) spotifyFiles.add(Paths.get(part.trim()));
        }
        Path appleMusic = null;
        String outDir = System.getProperty("OUTPUT_DIR", System.getenv().getOrDefault("OUTPUT_DIR", "output"));
        for (int i = 1; i < args.length; i++) {
            if (appleMusic == null && looksLikeAppleMusicExport(args[i], i, args.length)) {
                appleMusic = Paths.get(args[i]);
            } else {
                outDir = args[i];
            }
        }
        logger.info("Spotify input: {}", spotifyFiles);
        logger.info("Apple Music input: {}", appleMusic == null ? "none" : appleMusic);
        logger.info("Output directory: {}", outDir);

        try {
            PipelineSettings settings = PipelineSettings.load();
            StreamingHistoryPipeline pipeline = new StreamingHistoryPipeline(settings, Clock.systemUTC());
            ArtifactWriterInterface writer = new ArtifactWriter();
            PipelineResult result = pipeline.run(new PipelineInput(spotifyFiles, appleMusic));
            writer.write(result, Paths.get(outDir));
            logger.info("Done: {} canonical events written to {}", result.canonicalLog().size(), outDir);
            return 0;
        } catch (MissingInputException e) {
            logger.error("Missing input {}: {}", e.getInput(), e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Failed to write artifacts to {}: {}", outDir, e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * A {@code .csv} argument or an existing regular file is the Apple Music export. With three
     * arguments the second is always the export, whatever its name.
     */
    static boolean looksLikeAppleMusicExport(String arg, int index, int argCount) {
        if (argCount == 3 && index == 1) return true;
        return arg.toLowerCase(Locale.ROOT).endsWith(".csv") || Files.isRegularFile(Paths.get(arg));
    }

    /**
     * Main application entry point.
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}
