package com.streamhistory.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Batch loop shared by the provider adapters: adapts each record, counts failures,
 * keeps a bounded sample of failure messages and logs a one-line summary.
 *
 * @param <R> raw record shape
 */
public abstract class AbstractProviderAdapter<R extends RawPlayRecord> implements ProviderAdapterInterface<R> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractProviderAdapter.class);

    private final int failureSampleSize;

    protected AbstractProviderAdapter(int failureSampleSize) {
        this.failureSampleSize = Math.max(0, failureSampleSize);
    }

    @Override
    public AdapterResult adapt(List<R> records) {
        if (records == null) {
            throw new IllegalArgumentException("Record list cannot be null");
        }
        List<StreamEvent> events = new ArrayList<>(records.size());
        List<String> samples = new ArrayList<>();
        int failed = 0;
        for (R record : records) {
            try {
                events.add(adaptRecord(record));
            } catch (RecordParseException e) {
                failed++;
                logger.debug("Skipping malformed {} record: {}", provider(), e.toString());
                if (samples.size() < failureSampleSize) samples.add(e.toString());
            }
        }
        logger.info("{} adapter: {} records parsed, {} failed", provider(), events.size(), failed);
        return new AdapterResult(provider(), events, events.size(), failed, samples);
    }

    /**
     * Builds the event, turning invariant violations into a per-record parse failure.
     */
    protected StreamEvent build(R record, Supplier<StreamEvent> factory) throws RecordParseException {
        try {
            return factory.get();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new RecordParseException(record.describe(), e.getMessage(), e);
        }
    }
}
