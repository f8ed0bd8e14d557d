package com.touchline.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    EVALUATION_ERROR("EVALUATION_ERROR", false),
    UPSTREAM_ERROR("UPSTREAM_ERROR", true),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;

    /** Whether a later attempt may succeed without any change to the input. */
    private final boolean transientFailure;
}
