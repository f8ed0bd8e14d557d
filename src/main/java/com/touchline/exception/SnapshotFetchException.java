package com.touchline.exception;

import java.util.Map;

/**
 * Thrown by the match data layer when the upstream sports API cannot be reached
 * or answers with an error after all retries are exhausted.
 */
public class SnapshotFetchException extends BaseException {

    public SnapshotFetchException(String message) {
        super(ErrorCode.UPSTREAM_ERROR, message);
    }

    public SnapshotFetchException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, message, cause);
    }

    public SnapshotFetchException(String endpoint, int attempts, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, "Upstream call failed after " + attempts + " attempts: " + endpoint, cause);
    }

    public static SnapshotFetchException forStatus(String endpoint, int status) {
        return new SnapshotFetchException(endpoint, status);
    }

    private SnapshotFetchException(String endpoint, int status) {
        super(
                ErrorCode.UPSTREAM_ERROR,
                "Upstream returned HTTP " + status + " for " + endpoint,
                Map.of("endpoint", endpoint, "status", status));
    }
}
