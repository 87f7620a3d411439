package com.streamhistory.pipeline;

import java.util.List;

/**
 * Raw records decoded from one provider's input files, plus the elements that could not
 * even be decoded into the raw shape.
 *
 * @param records decoded records in file order
 * @param failedCount elements that failed to decode
 * @param failureSamples bounded sample of decode failure messages
 * @param <R> raw record shape
 */
public record RawBatch<R extends RawPlayRecord>(List<R> records, int failedCount, List<String> failureSamples) {

    public RawBatch {
        records = List.copyOf(records);
        failureSamples = List.copyOf(failureSamples);
    }

    public static <R extends RawPlayRecord> RawBatch<R> of(List<R> records) {
        return new RawBatch<>(records, 0, List.of());
    }
}
