package com.newscorpus.core.corpus;

import java.nio.file.Path;

/** 규칙에 맞는 원문 파일이 하나도 없음 */
public final class EmptyDirectoryException extends CorpusValidationException {
    public EmptyDirectoryException(Path path, String message) {
        super(path, message);
    }
}
