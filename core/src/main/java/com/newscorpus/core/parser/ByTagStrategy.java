package com.newscorpus.core.parser;

import com.newscorpus.core.dom.DomNode;

import java.util.Objects;
import java.util.Optional;

/** 범용 태그(기본 &lt;article&gt;)의 첫 번째 비어 있지 않은 요소 */
public final class ByTagStrategy implements ContentStrategy {

    private final String tag;

    public ByTagStrategy(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    @Override public String name() { return "by-tag"; }

    @Override
    public Optional<DomNode> locate(DomNode document) {
        for (DomNode n : document.selectAll(tag)) {
            if (!n.isBlank()) return Optional.of(n);
        }
        return Optional.empty();
    }
}
