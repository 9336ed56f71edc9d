package com.newscorpus.core.corpus;

import java.nio.file.Path;

/** 빈 파일이 있거나 id 집합이 1..n 연속이 아님 */
public final class InconsistentDatasetException extends CorpusValidationException {
    public InconsistentDatasetException(Path path, String message) {
        super(path, message);
    }
}
