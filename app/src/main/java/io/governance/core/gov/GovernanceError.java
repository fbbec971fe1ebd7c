package io.governance.core.gov;

/**
 * Every way a governance invocation can fail. The category tells the caller whether
 * to fix the request, wait, or give up; nothing is retried internally.
 */
public enum GovernanceError {
    INVALID_FIELD(Category.VALIDATION, "Invalid field"),
    INVALID_RATIO(Category.VALIDATION, "Ratio must be 0 to 1"),
    INVALID_MESSAGE(Category.VALIDATION, "Invalid message"),

    UNAUTHORIZED(Category.AUTHORIZATION, "Unauthorized"),

    POLL_NOT_FOUND(Category.NOT_FOUND, "Poll does not exist"),

    NOT_INITIALIZED(Category.STATE, "Governance is not initialized"),
    ALREADY_INITIALIZED(Category.STATE, "Governance is already initialized"),
    POLL_NOT_IN_PROGRESS(Category.STATE, "Poll is not in progress"),
    ALREADY_VOTED(Category.STATE, "User has already voted."),
    SNAPSHOT_WINDOW_NOT_OPEN(Category.STATE, "Cannot snapshot at this height"),
    SNAPSHOT_ALREADY_TAKEN(Category.STATE, "Snapshot has already occurred"),
    VOTING_NOT_EXPIRED(Category.STATE, "Voting period has not expired"),
    POLL_NOT_PASSED(Category.STATE, "Poll is not in passed status"),
    TIMELOCK_NOT_EXPIRED(Category.STATE, "Timelock period has not expired"),
    EXPIRATION_NOT_REACHED(Category.STATE, "Expire height has not been reached"),

    INSUFFICIENT_FUNDS(Category.RESOURCE, "Insufficient funds sent"),
    INSUFFICIENT_DEPOSIT(Category.RESOURCE, "Insufficient deposit"),
    INSUFFICIENT_STAKE(Category.RESOURCE, "User does not have enough staked tokens."),
    NOTHING_STAKED(Category.RESOURCE, "Nothing staked"),
    EXCEEDS_BALANCE(Category.RESOURCE, "User is trying to withdraw too many tokens.");

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        NOT_FOUND,
        STATE,
        RESOURCE
    }

    private final Category category;
    private final String defaultMessage;

    GovernanceError(Category category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public Category category() {
        return category;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
