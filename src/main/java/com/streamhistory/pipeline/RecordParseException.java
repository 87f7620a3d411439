package com.streamhistory.pipeline;

/**
 * Raised when a single raw record cannot be turned into a {@link StreamEvent}.
 * Always recovered inside the adapter: the record is counted as a failure and skipped.
 */
public class RecordParseException extends Exception {
    private final String record;

    public RecordParseException(String record, String message) {
        super(message);
        this.record = record;
    }

    public RecordParseException(String record, String message, Throwable cause) {
        super(message, cause);
        this.record = record;
    }

    /**
     * @return locator of the offending record
     */
    public String getRecord() {
        return record;
    }

    @Override
    public String toString() {
        return record + ": " + getMessage();
    }
}
