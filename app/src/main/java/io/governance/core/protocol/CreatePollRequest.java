package io.governance.core.protocol;

import java.util.List;

/** Poll proposal carried by a deposit notification. {@code link} and {@code executeMsgs} are optional. */
public record CreatePollRequest(String title, String description, String link, List<DelegatedCall> executeMsgs) {
    public CreatePollRequest {
        executeMsgs = executeMsgs == null ? null : List.copyOf(executeMsgs);
    }

    public static CreatePollRequest of(String title, String description) {
        return new CreatePollRequest(title, description, null, null);
    }
}
