package io.governance.core.poll;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a poll. Only IN_PROGRESS is non-terminal for voting; PASSED moves on
 * to exactly one of EXECUTED or EXPIRED.
 */
public enum PollStatus {
    @JsonProperty("in_progress") IN_PROGRESS("in_progress"),
    @JsonProperty("passed") PASSED("passed"),
    @JsonProperty("rejected") REJECTED("rejected"),
    @JsonProperty("executed") EXECUTED("executed"),
    @JsonProperty("expired") EXPIRED("expired");

    private final String wireName;

    PollStatus(String wireName) {
        this.wireName = wireName;
    }

    public static PollStatus fromWire(String value) {
        for (PollStatus s : values()) {
            if (s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown poll status: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
