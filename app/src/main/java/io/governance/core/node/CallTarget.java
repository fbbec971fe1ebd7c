package io.governance.core.node;

/** A contract that accepts delegated calls on the local node. */
@FunctionalInterface
public interface CallTarget {
    void call(String sender, byte[] payload);
}
