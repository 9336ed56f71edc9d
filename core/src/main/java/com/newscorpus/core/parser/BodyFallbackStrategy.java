package com.newscorpus.core.parser;

import com.newscorpus.core.dom.DomNode;

import java.util.Optional;

/** 마지막 수단: body 복사본에서 내비게이션/푸터/스크립트 등 보일러플레이트를 걷어낸다 */
public final class BodyFallbackStrategy implements ContentStrategy {

    static final String BOILERPLATE =
            "nav, header, footer, script, style, noscript, aside, iframe, frame, form";

    @Override public String name() { return "by-body-fallback"; }

    @Override
    public Optional<DomNode> locate(DomNode document) {
        Optional<DomNode> body = document.selectFirst("body");
        if (body.isEmpty()) return Optional.empty();
        DomNode stripped = body.get().copy();
        stripped.removeAll(BOILERPLATE);
        return stripped.isBlank() ? Optional.empty() : Optional.of(stripped);
    }
}
