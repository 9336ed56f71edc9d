package com.newscorpus.core.config;

/**
 * 설정 검증 실패의 공통 상위 타입.
 * 하위 타입 하나가 검증 항목 하나에 대응한다(첫 번째 실패 항목만 던진다).
 */
public abstract class ConfigValidationException extends IllegalArgumentException {

    private final String field;

    protected ConfigValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /** 문제가 된 설정 키 (예: "timeout") */
    public String getField() { return field; }
}
