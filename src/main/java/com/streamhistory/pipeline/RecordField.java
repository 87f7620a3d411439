package com.streamhistory.pipeline;

import java.util.List;

/**
 * A raw input field read by an adapter: its canonical name plus the header
 * aliases it has appeared under in provider exports.
 *
 * @param fieldName canonical field name
 * @param aliases header names tried in order
 */
public record RecordField(String fieldName, List<String> aliases) {
    public RecordField {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
