package com.streamhistory.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for persisting a run's documents.
 */
public interface ArtifactWriterInterface {
    /**
     * Writes every document of the result into the output directory.
     * @param result run output
     * @param outputDir target directory, created if absent
     * @return paths of the written files
     * @throws IOException if any document cannot be written; no file is then replaced
     */
    List<Path> write(PipelineResult result, Path outputDir) throws IOException;
}
