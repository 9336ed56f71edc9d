package com.newscorpus.core.corpus;

import java.nio.file.Path;

/** 코퍼스 디렉터리가 명명/번호 규칙을 지키지 않을 때의 공통 상위 타입 */
public abstract class CorpusValidationException extends RuntimeException {

    private final transient Path path;

    protected CorpusValidationException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() { return path; }
}
