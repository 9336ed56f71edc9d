// IArticleParser.java
package com.newscorpus.core.api;

import com.newscorpus.core.model.ArticleRecord;

import java.net.URI;

/** 기사 하나를 레코드로 변환. 구현체는 예외를 경계 밖으로 던지지 않는다. */
public interface IArticleParser {
    ArticleRecord parse(URI url, int articleId);
}
