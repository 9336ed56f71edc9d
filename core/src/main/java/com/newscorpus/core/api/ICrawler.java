// ICrawler.java
package com.newscorpus.core.api;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** 크롤러 최소 계약: 시드 페이지에서 찾은 기사 URL 목록(중복 없음, 발견 순서)을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    default List<URI> discover() { return discover(null); }

    /** @param cancelFlag true 가 되면 다음 요청 전에 중단 (null 허용) */
    List<URI> discover(AtomicBoolean cancelFlag);

    @Override default void close() throws Exception {}
}
