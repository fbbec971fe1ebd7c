package io.governance.core.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * One ordered sub-operation carried by a poll: a target contract plus an opaque payload.
 * The engine only sorts and relays these; the payload is interpreted by whoever receives it.
 */
public record DelegatedCall(long order, String contract, byte[] msg) {

    public DelegatedCall {
        if (contract == null || contract.isBlank()) {
            throw new IllegalArgumentException("Missing contract");
        }
        msg = msg != null ? msg.clone() : new byte[0];
    }

    @Override
    public byte[] msg() {
        return msg.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DelegatedCall)) return false;
        DelegatedCall other = (DelegatedCall) o;
        return order == other.order
                && contract.equals(other.contract)
                && Arrays.equals(msg, other.msg);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(order, contract) + Arrays.hashCode(msg);
    }

    @Override
    public String toString() {
        return "DelegatedCall(order=" + order + ", contract=" + contract + ", msg=" + msg.length + " bytes)";
    }
}
