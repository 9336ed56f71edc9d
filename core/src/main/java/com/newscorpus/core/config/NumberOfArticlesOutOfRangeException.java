package com.newscorpus.core.config;

/** total_articles_to_find_and_parse 가 허용 상한(150) 초과 (정책 위반) */
public final class NumberOfArticlesOutOfRangeException extends ConfigValidationException {
    public NumberOfArticlesOutOfRangeException(String field, String message) {
        super(field, message);
    }
}
