package com.streamhistory.pipeline;

/**
 * One record in a provider's native export shape.
 * Each provider has its own implementation, consumed only by that provider's adapter.
 */
public interface RawPlayRecord {
    /**
     * @return provider the record was exported from
     */
    Provider provider();

    /**
     * @return short human-readable locator for log and failure messages
     */
    String describe();
}
