package com.newscorpus.core.config;

/** timeout 이 정수가 아니거나 (0, 60) 개구간 밖 */
public final class IncorrectTimeoutException extends ConfigValidationException {
    public IncorrectTimeoutException(String field, String message) {
        super(field, message);
    }
}
