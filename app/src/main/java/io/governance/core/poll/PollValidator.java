package io.governance.core.poll;

import io.governance.core.gov.GovernanceError;
import io.governance.core.gov.GovernanceException;

/** Length policy for the human-readable poll fields. */
public final class PollValidator {
    public static final int MIN_TITLE_LENGTH = 4;
    public static final int MAX_TITLE_LENGTH = 64;
    public static final int MIN_DESC_LENGTH = 4;
    public static final int MAX_DESC_LENGTH = 1024;
    public static final int MIN_LINK_LENGTH = 12;
    public static final int MAX_LINK_LENGTH = 128;

    private PollValidator() {}

    public static void validate(String title, String description, String link) {
        check(title, "Title", MIN_TITLE_LENGTH, MAX_TITLE_LENGTH);
        check(description, "Description", MIN_DESC_LENGTH, MAX_DESC_LENGTH);
        if (link != null) {
            check(link, "Link", MIN_LINK_LENGTH, MAX_LINK_LENGTH);
        }
    }

    private static void check(String value, String field, int min, int max) {
        int len = value == null ? 0 : value.length();
        if (len < min) {
            throw new GovernanceException(GovernanceError.INVALID_FIELD, field + " too short");
        }
        if (len > max) {
            throw new GovernanceException(GovernanceError.INVALID_FIELD, field + " too long");
        }
    }
}
