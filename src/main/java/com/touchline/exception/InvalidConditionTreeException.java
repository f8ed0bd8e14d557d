package com.touchline.exception;

import java.util.Map;

public class InvalidConditionTreeException extends BaseException {

    public InvalidConditionTreeException(Long ruleId, String reason) {
        super(ErrorCode.VALIDATION_ERROR, "Invalid condition tree for rule " + ruleId + ": " + reason,
                ruleId != null ? Map.of("ruleId", ruleId, "reason", reason) : Map.of("reason", reason));
    }
}
