package com.newscorpus.core.config;

/** encoding 이 문자열이 아니거나 JVM이 지원하지 않는 charset */
public final class IncorrectEncodingException extends ConfigValidationException {
    public IncorrectEncodingException(String field, String message) {
        super(field, message);
    }
}
