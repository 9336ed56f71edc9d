package com.newscorpus.core.crawler;

import java.util.List;
import java.util.Objects;

/**
 * 사이트별 선택자 묶음. 링크 발견과 본문/메타 추출이 같은 프로필을 공유한다.
 */
public final class SiteProfile {

    private final String origin;
    private final String linkContainerSelector;
    private final String linkSelector;
    private final List<String> contentSelectors;
    private final List<String> titleSelectors;
    private final String dateSelector;
    private final String topicSelector;
    private final List<String> urlDenylist;

    private SiteProfile(Builder b) {
        this.origin = Objects.requireNonNull(b.origin, "origin");
        this.linkContainerSelector = Objects.requireNonNull(b.linkContainerSelector, "linkContainerSelector");
        this.linkSelector = Objects.requireNonNull(b.linkSelector, "linkSelector");
        this.contentSelectors = List.copyOf(b.contentSelectors);
        this.titleSelectors = List.copyOf(b.titleSelectors);
        this.dateSelector = b.dateSelector;
        this.topicSelector = b.topicSelector;
        this.urlDenylist = List.copyOf(b.urlDenylist);
    }

    /** klops.ru (WordPress 계열 마크업) 기본 프로필 */
    public static SiteProfile klops() {
        return builder()
                .origin("https://klops.ru")
                .linkContainerSelector("h1.entry-title")
                .linkSelector("a.list-item__title")
                .contentSelectors(List.of(
                        "div.entry-content",
                        "div.article__text",
                        "div.article-body",
                        "[itemprop=articleBody]"))
                .titleSelectors(List.of("div.article__title", "h1.entry-title"))
                .dateSelector("div.article__info-date a")
                .topicSelector("a[rel=tag]")
                .build();
    }

    /** scheme://host. 페이지 URL 에서 origin 을 얻을 수 없을 때만 상대 경로 앞에 붙는다 */
    public String getOrigin() { return origin; }
    /** 기사 링크를 감싸는 요소 */
    public String getLinkContainerSelector() { return linkContainerSelector; }
    /** 컨테이너 안의 기사 링크(a) */
    public String getLinkSelector() { return linkSelector; }
    public List<String> getContentSelectors() { return contentSelectors; }
    public List<String> getTitleSelectors() { return titleSelectors; }
    public String getDateSelector() { return dateSelector; }
    public String getTopicSelector() { return topicSelector; }
    /** 거부목록(URL 부분 문자열) 중 하나라도 포함하면 true */
    public boolean isDenied(String url) {
        for (String s : urlDenylist) {
            if (!s.isEmpty() && url.contains(s)) return true;
        }
        return false;
    }

    public Builder toBuilder() {
        return builder()
                .origin(origin)
                .linkContainerSelector(linkContainerSelector)
                .linkSelector(linkSelector)
                .contentSelectors(contentSelectors)
                .titleSelectors(titleSelectors)
                .dateSelector(dateSelector)
                .topicSelector(topicSelector)
                .urlDenylist(urlDenylist);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String origin;
        private String linkContainerSelector;
        private String linkSelector;
        private List<String> contentSelectors = List.of();
        private List<String> titleSelectors = List.of();
        private String dateSelector;
        private String topicSelector;
        private List<String> urlDenylist = List.of();

        public Builder origin(String v) { this.origin = v; return this; }
        public Builder linkContainerSelector(String v) { this.linkContainerSelector = v; return this; }
        public Builder linkSelector(String v) { this.linkSelector = v; return this; }
        public Builder contentSelectors(List<String> v) { this.contentSelectors = (v == null ? List.of() : v); return this; }
        public Builder titleSelectors(List<String> v) { this.titleSelectors = (v == null ? List.of() : v); return this; }
        public Builder dateSelector(String v) { this.dateSelector = v; return this; }
        public Builder topicSelector(String v) { this.topicSelector = v; return this; }
        public Builder urlDenylist(List<String> v) { this.urlDenylist = (v == null ? List.of() : v); return this; }

        public SiteProfile build() { return new SiteProfile(this); }
    }
}
