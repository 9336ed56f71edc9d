package com.newscorpus.core.config;

/** seed_urls 가 리스트가 아니거나, 비어 있거나, http(s) 절대 URL 형식이 아님 */
public final class IncorrectSeedUrlException extends ConfigValidationException {
    public IncorrectSeedUrlException(String field, String message) {
        super(field, message);
    }
}
