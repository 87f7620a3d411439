package com.streamhistory.insights;

import com.streamhistory.pipeline.StreamEvent;

import java.util.List;

/**
 * A pure reduction of the canonical event log into one output document.
 * <p>
 * Implementations never mutate the log and hold no state between calls, so several
 * generators may run concurrently over the same list.
 *
 * @param <T> document type
 */
public interface InsightGeneratorInterface<T> {
    /**
     * @param events canonical, time-ascending event log; may be empty
     * @return the document; well formed with zero values for an empty log
     */
    T generate(List<StreamEvent> events);

    /**
     * @return short name used in logs
     */
    String name();
}
