package io.governance.core.poll;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum VoteOption {
    @JsonProperty("yes") YES,
    @JsonProperty("no") NO;

    public static VoteOption fromWire(String value) {
        if ("yes".equalsIgnoreCase(value)) return YES;
        if ("no".equalsIgnoreCase(value)) return NO;
        throw new IllegalArgumentException("Unknown vote option: " + value);
    }

    @Override
    public String toString() {
        return this == YES ? "yes" : "no";
    }
}
