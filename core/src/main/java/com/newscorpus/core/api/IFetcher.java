// IFetcher.java
package com.newscorpus.core.api;

import com.newscorpus.core.model.FetchResult;

import java.net.URI;

/**
 * 단일 GET 계약. I/O 실패도 예외 대신 {@link FetchResult.Outcome#TRANSPORT_ERROR} 로 돌려준다.
 * 재시도는 하지 않는다(호출자 정책).
 */
public interface IFetcher extends AutoCloseable {
    FetchResult fetch(URI url);
    @Override default void close() throws Exception {}
}
