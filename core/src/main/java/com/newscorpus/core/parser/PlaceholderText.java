package com.newscorpus.core.parser;

import java.net.URI;

/** 진짜 본문을 얻지 못했을 때 쓰는 진단용 대체 본문. 항상 최소 길이 이상이며 원본 URL을 포함한다. */
public final class PlaceholderText {

    private static final String FILLER = " Placeholder body text generated by the corpus harvester.";

    private PlaceholderText() {}

    public static String forUrl(URI url, String reason) {
        StringBuilder sb = new StringBuilder(128)
                .append("Article text could not be extracted from ").append(url)
                .append(" (").append(reason == null || reason.isBlank() ? "unknown reason" : reason).append(").");
        while (sb.length() < HtmlArticleParser.MIN_TEXT_LENGTH) {
            sb.append(FILLER);
        }
        return sb.toString();
    }
}
