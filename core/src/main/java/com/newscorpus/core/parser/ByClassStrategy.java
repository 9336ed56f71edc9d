package com.newscorpus.core.parser;

import com.newscorpus.core.dom.DomNode;

import java.util.List;
import java.util.Optional;

/** 알려진 본문 클래스/속성 선택자를 순서대로 시도. 선택자마다 첫 번째 비어 있지 않은 요소 */
public final class ByClassStrategy implements ContentStrategy {

    private final List<String> selectors;

    public ByClassStrategy(List<String> selectors) {
        this.selectors = List.copyOf(selectors);
    }

    @Override public String name() { return "by-class"; }

    @Override
    public Optional<DomNode> locate(DomNode document) {
        for (String css : selectors) {
            for (DomNode n : document.selectAll(css)) {
                if (!n.isBlank()) return Optional.of(n);
            }
        }
        return Optional.empty();
    }
}
