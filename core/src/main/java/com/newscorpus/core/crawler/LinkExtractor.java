package com.newscorpus.core.crawler;

import com.newscorpus.core.dom.DomNode;

import java.net.URI;
import java.util.List;

/** 파싱된 시드 페이지에서 절대 기사 URL 후보를 문서 순서대로 추출하는 전략 인터페이스. */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * 중복이 섞여 있을 수 있다. 중복 제거는 호출자(크롤러) 몫.
     * @param pageUrl 페이지를 받아 온 URL. 사이트 상대 경로는 이 URL 의 origin 기준으로 해석한다.
     */
    List<URI> extract(DomNode page, URI pageUrl);
}
