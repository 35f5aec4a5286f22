package dev.pmsignal.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/** Kind of channel a feedback chunk was extracted from. */
public enum SourceType {
    SLACK("slack"),
    JIRA("jira"),
    TRANSCRIPT("transcript"),
    UNKNOWN("unknown");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lenient, case-insensitive parse of a stored source type. Missing or unrecognised values map
     * to {@link #UNKNOWN} because stored metadata may predate a source type.
     */
    @JsonCreator
    public static SourceType fromValue(@Nullable String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (SourceType type : values()) {
            if (type.value.equalsIgnoreCase(value.strip())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
