package com.newscorpus.core.config;

/** should_verify_certificate / headless_mode 가 boolean 이 아님 */
public final class IncorrectVerifyException extends ConfigValidationException {
    public IncorrectVerifyException(String field, String message) {
        super(field, message);
    }
}
