package com.streamhistory.pipeline;

/**
 * Fatal: a required input is absent or unreadable. The run stops before any artifact is written.
 */
public class MissingInputException extends RuntimeException {
    private final String input;

    public MissingInputException(String input, String message) {
        super(message);
        this.input = input;
    }

    public MissingInputException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    /**
     * @return the input (path or logical name) that was missing
     */
    public String getInput() {
        return input;
    }
}
