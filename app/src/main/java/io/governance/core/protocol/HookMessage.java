package io.governance.core.protocol;

import java.util.Objects;

/** Decoded sub-message of a token deposit notification. */
public interface HookMessage {

    /** Stake the deposited tokens. */
    record StakeVotingTokens() implements HookMessage {}

    /** Escrow the deposited tokens and open a poll. */
    record CreatePoll(CreatePollRequest request) implements HookMessage {
        public CreatePoll {
            Objects.requireNonNull(request, "request");
        }
    }
}
