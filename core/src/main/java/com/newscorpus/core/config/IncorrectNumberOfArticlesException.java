package com.newscorpus.core.config;

/** total_articles_to_find_and_parse 가 정수가 아니거나 1 미만 (호출자 버그) */
public final class IncorrectNumberOfArticlesException extends ConfigValidationException {
    public IncorrectNumberOfArticlesException(String field, String message) {
        super(field, message);
    }
}
