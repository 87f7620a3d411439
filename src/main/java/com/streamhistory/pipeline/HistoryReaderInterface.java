package com.streamhistory.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for loading one provider's export files into raw records.
 *
 * @param <R> raw record shape produced
 */
public interface HistoryReaderInterface<R extends RawPlayRecord> {
    /**
     * Reads every file in order. Elements that cannot be decoded are counted, not fatal.
     * @param files export files
     * @return decoded records and decode failure counts
     * @throws MissingInputException if a file is absent or unreadable as a whole
     */
    RawBatch<R> read(List<Path> files);
}
