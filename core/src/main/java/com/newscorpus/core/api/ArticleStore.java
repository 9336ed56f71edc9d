package com.newscorpus.core.api;

import com.newscorpus.core.model.ArticleRecord;

import java.io.IOException;

/** 추출된 레코드의 영속화 협력자. 식별자 기준으로 {@code <id>_raw.<ext>} 에 기록한다. */
@FunctionalInterface
public interface ArticleStore {
    void save(ArticleRecord record) throws IOException;
}
