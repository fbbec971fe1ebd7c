package io.governance.core.gov;

import java.util.Objects;

/**
 * Who is calling and at which block height. Every guard in an invocation is evaluated
 * against this one height.
 */
public record MessageContext(String sender, long height) {
    public MessageContext {
        Objects.requireNonNull(sender, "sender");
        if (height < 0) {
            throw new IllegalArgumentException("height must be >= 0");
        }
    }
}
