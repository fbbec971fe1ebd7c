package io.governance.core.gov;

import java.util.Objects;

/** Raised by any governance invocation that must not commit. */
public class GovernanceException extends RuntimeException {
    private final GovernanceError error;

    public GovernanceException(GovernanceError error) {
        this(error, error.defaultMessage());
    }

    public GovernanceException(GovernanceError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public GovernanceException(GovernanceError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public GovernanceError error() {
        return error;
    }

    public GovernanceError.Category category() {
        return error.category();
    }
}
