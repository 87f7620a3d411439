package com.streamhistory.pipeline;

import java.util.List;

/**
 * Interface for translating one provider's raw records into canonical {@link StreamEvent}s.
 * <p>
 * Adapters only reject structurally invalid records; content-based filtering is the
 * {@link QualityFilter}'s job.
 *
 * @param <R> the provider's raw record shape
 */
public interface ProviderAdapterInterface<R extends RawPlayRecord> {
    /**
     * @return provider handled by this adapter
     */
    Provider provider();

    /**
     * Adapts a single raw record.
     * @param record raw record
     * @return the canonical event
     * @throws RecordParseException if the record is structurally invalid
     */
    StreamEvent adaptRecord(R record) throws RecordParseException;

    /**
     * Adapts a batch. A failing record is counted and skipped; the batch never aborts.
     * @param records raw records in input order
     * @return events plus success and failure counts
     */
    AdapterResult adapt(List<R> records);
}
