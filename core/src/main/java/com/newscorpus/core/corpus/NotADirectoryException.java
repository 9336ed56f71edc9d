package com.newscorpus.core.corpus;

import java.nio.file.Path;

/** 경로가 디렉터리가 아님 */
public final class NotADirectoryException extends CorpusValidationException {
    public NotADirectoryException(Path path, String message) {
        super(path, message);
    }
}
