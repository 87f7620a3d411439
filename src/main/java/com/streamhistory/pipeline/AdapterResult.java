package com.streamhistory.pipeline;

import java.util.List;

/**
 * Outcome of adapting one provider's raw records: the events produced plus
 * the data-loss counts the caller reports.
 *
 * @param provider provider the records came from
 * @param events adapted events, in input order
 * @param parsedCount number of records adapted successfully
 * @param failedCount number of records rejected as structurally invalid
 * @param failureSamples a bounded sample of failure messages
 */
public record AdapterResult(
    Provider provider,
    List<StreamEvent> events,
    int parsedCount,
    int failedCount,
    List<String> failureSamples
) {
    public AdapterResult {
        events = List.copyOf(events);
        failureSamples = List.copyOf(failureSamples);
    }

    /**
     * @return an empty result for a provider whose input was not supplied
     */
    public static AdapterResult empty(Provider provider) {
        return new AdapterResult(provider, List.of(), 0, 0, List.of());
    }

    public int totalRecords() {
        return parsedCount + failedCount;
    }
}
