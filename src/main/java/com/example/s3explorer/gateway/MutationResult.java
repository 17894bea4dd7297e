package com.example.s3explorer.gateway;

/**
 * Outcome of a write. Expected failures are reported here rather than thrown.
 */
public final class MutationResult {

    public enum Outcome {
        SUCCESS,
        DENIED,
        INVALID,
        NOT_FOUND,
        UNSUPPORTED_MEDIA_TYPE,
        TOO_LARGE,
        UPLOAD_FAILED,
        FAILED
    }

    private final Outcome outcome;
    private final String key;
    private final boolean changed;
    private final String message;

    private MutationResult(Outcome outcome, String key, boolean changed, String message) {
        this.outcome = outcome;
        this.key = key;
        this.changed = changed;
        this.message = message;
    }

    public static MutationResult success(String key, String message) {
        return new MutationResult(Outcome.SUCCESS, key, true, message);
    }

    /**
     * Success that left storage untouched, e.g. creating a folder that already exists.
     */
    public static MutationResult unchanged(String key, String message) {
        return new MutationResult(Outcome.SUCCESS, key, false, message);
    }

    public static MutationResult failure(Outcome outcome, String key, String message) {
        if (outcome == Outcome.SUCCESS) {
            throw new IllegalArgumentException("failure outcome required");
        }
        return new MutationResult(outcome, key, false, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getKey() {
        return key;
    }

    /**
     * Whether storage was written.
     */
    public boolean isChanged() {
        return changed;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "MutationResult{" + outcome + ", key=" + key + ", message=" + message + "}";
    }
}
