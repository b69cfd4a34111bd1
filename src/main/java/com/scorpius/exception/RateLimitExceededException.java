package com.scorpius.exception;

import java.util.Map;

public class RateLimitExceededException extends BaseException {

    public RateLimitExceededException(String key, int limit) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, "Rate limit exceeded for " + key, Map.of("key", key, "limit", limit));
    }
}
