package agentic.ir;

import java.util.regex.Pattern;

public enum ReturnStatus {
    SUCCESS("Task completed successfully"),
    BLOCKED("Cannot proceed, needs external input"),
    NOT_FOUND("Requested resource not found"),
    ERROR("Execution error occurred"),
    CHECKPOINT("Milestone reached, pausing for verification");

    private static final Pattern CUSTOM = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final String description;

    ReturnStatus(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public static boolean isStandard(String status) {
        for (ReturnStatus s : values()) {
            if (s.name().equals(status)) return true;
        }
        return false;
    }

    /** Standard statuses and caller-declared upper-snake-case ones. */
    public static boolean isWellFormed(String status) {
        return status != null && CUSTOM.matcher(status).matches();
    }
}
