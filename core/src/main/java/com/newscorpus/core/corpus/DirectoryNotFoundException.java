package com.newscorpus.core.corpus;

import java.nio.file.Path;

/** 경로가 존재하지 않음 */
public final class DirectoryNotFoundException extends CorpusValidationException {
    public DirectoryNotFoundException(Path path, String message) {
        super(path, message);
    }
}
