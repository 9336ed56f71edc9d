package com.newscorpus.core.dom;

import java.util.List;
import java.util.Optional;

/**
 * 문서 트리 질의 추상화. CSS 선택자로 첫/전체 노드를 찾고, 하위 트리를 제거할 수 있다.
 * 추출 로직은 파서 라이브러리 대신 이 인터페이스에만 의존한다.
 */
public interface DomNode {

    Optional<DomNode> selectFirst(String cssQuery);

    List<DomNode> selectAll(String cssQuery);

    /** 자신과 하위 노드의 텍스트(공백 정규화됨) */
    String text();

    /** 속성 값. 없으면 빈 문자열 */
    String attr(String name);

    String tagName();

    /** 하위 요소 중 선택자에 맞는 것을 모두 트리에서 떼어낸다. 제거 개수 반환 */
    int removeAll(String cssQuery);

    /** 이 노드의 독립 복사본(원본 문서를 건드리지 않고 제거 작업할 때 사용) */
    DomNode copy();

    default boolean isBlank() { return text().isBlank(); }
}
