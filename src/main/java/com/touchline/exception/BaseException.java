package com.touchline.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's failures. Carries an {@link ErrorCode} and a small map of
 * identifiers (rule id, fixture id, endpoint) for log lines.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> context;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> context) {
        this(errorCode, message, context, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, Object> context, Throwable cause) {
        super("[" + errorCode.getCode() + "] " + message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public boolean isTransientFailure() {
        return errorCode.isTransientFailure();
    }
}
