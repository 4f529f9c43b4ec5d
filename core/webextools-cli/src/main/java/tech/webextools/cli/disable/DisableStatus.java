package tech.webextools.cli.disable;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of disabling one user.
 */
public enum DisableStatus {
    SUCCESS("Success"),
    FAILED("Failed"),
    SKIPPED("Skipped"),
    NOT_FOUND("NotFound"),
    DRY_RUN("DryRun");

    private final String label;

    DisableStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
