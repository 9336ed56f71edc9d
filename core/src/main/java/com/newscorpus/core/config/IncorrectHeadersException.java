package com.newscorpus.core.config;

/** headers 가 문자열 맵이 아니거나 값에 개행 문자가 포함됨 (헤더 인젝션 방지) */
public final class IncorrectHeadersException extends ConfigValidationException {
    public IncorrectHeadersException(String field, String message) {
        super(field, message);
    }
}
