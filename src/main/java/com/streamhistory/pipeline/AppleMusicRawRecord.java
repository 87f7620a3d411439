package com.streamhistory.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of an Apple Music "Play History Daily Tracks" export, keyed by header name.
 *
 * @param rowNumber 1-based data row number (header excluded)
 * @param columns header name to cell value
 */
public record AppleMusicRawRecord(long rowNumber, Map<String, String> columns) implements RawPlayRecord {

    public AppleMusicRawRecord {
        columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    @Override
    public Provider provider() {
        return Provider.APPLE_MUSIC;
    }

    @Override
    public String describe() {
        return "Apple Music row " + rowNumber;
    }

    /**
     * Looks up a field by trying each of its known header aliases in order.
     * @param field registry field
     * @return trimmed cell value, or null if no alias is present or the cell is blank
     */
    public String value(RecordField field) {
        for (String alias : field.aliases()) {
            String v = columns.get(alias);
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    /**
     * @return true if any alias of the field exists as a column, even when blank
     */
    public boolean hasColumn(RecordField field) {
        for (String alias : field.aliases()) {
            if (columns.containsKey(alias)) return true;
        }
        return false;
    }
}
