package com.newscorpus.core.parser;

import com.newscorpus.core.dom.DomNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** 컨테이너에서 문단 단위 텍스트를 뽑는다 */
final class TextExtractor {

    private static final Pattern WS = Pattern.compile("[\\s\\u00A0]+");

    private TextExtractor() {}

    /**
     * &lt;p&gt; 들의 텍스트를 공백 정규화 후 줄바꿈으로 연결.
     * 문단이 하나도 없으면 컨테이너 전체 텍스트.
     */
    static String paragraphs(DomNode container) {
        List<String> blocks = new ArrayList<>();
        for (DomNode p : container.selectAll("p")) {
            String t = collapse(p.text());
            if (!t.isEmpty()) blocks.add(t);
        }
        if (blocks.isEmpty()) return fullText(container);
        return String.join("\n", blocks);
    }

    /** 거친 추출: 컨테이너 전체 텍스트 한 덩어리 */
    static String fullText(DomNode container) {
        return collapse(container.text());
    }

    static String collapse(String s) {
        if (s == null) return "";
        return WS.matcher(s).replaceAll(" ").trim();
    }
}
