package com.newscorpus.core.parser;

import com.newscorpus.core.dom.DomNode;

import java.util.Optional;

/**
 * 본문 컨테이너 탐색 전략. 우선순위 목록으로 늘어놓고 비어 있지 않은 결과가 나올 때까지 차례로 시도한다.
 */
public interface ContentStrategy {

    /** 로그용 이름 (예: "by-class") */
    String name();

    /** 텍스트가 있는 컨테이너를 찾으면 반환, 없으면 empty */
    Optional<DomNode> locate(DomNode document);
}
