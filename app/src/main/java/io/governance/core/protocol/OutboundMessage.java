package io.governance.core.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * A message scheduled by a governance invocation. Messages are returned to the host,
 * which carries them out only after the invocation's state changes are committed.
 */
public interface OutboundMessage {

    /** Target contract the message is addressed to. */
    String contract();

    /** Token transfer from the governance contract's balance. */
    record Transfer(String contract, String recipient, long amount) implements OutboundMessage {
        public Transfer {
            Objects.requireNonNull(contract, "contract");
            Objects.requireNonNull(recipient, "recipient");
            if (amount <= 0) {
                throw new IllegalArgumentException("amount must be > 0");
            }
        }
    }

    /** Opaque call relayed from an executed poll. */
    record Execute(String contract, byte[] payload) implements OutboundMessage {
        public Execute {
            Objects.requireNonNull(contract, "contract");
            payload = payload != null ? payload.clone() : new byte[0];
        }

        @Override
        public byte[] payload() {
            return payload.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Execute other
                    && contract.equals(other.contract)
                    && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * contract.hashCode() + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "Execute(contract=" + contract + ", payload=" + payload.length + " bytes)";
        }
    }
}
