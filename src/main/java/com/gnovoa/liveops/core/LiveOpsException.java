package com.gnovoa.liveops.core;

import java.util.List;

/**
 * Base of every rejected live-operations command. No subclass is fatal: a thrown command leaves
 * the Assignment and MatchState tables exactly as they were.
 */
public abstract class LiveOpsException extends RuntimeException {

    private final String code;

    protected LiveOpsException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected LiveOpsException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Stable machine-readable error code. */
    public String code() {
        return code;
    }

    public List<String> details() {
        return List.of();
    }
}
