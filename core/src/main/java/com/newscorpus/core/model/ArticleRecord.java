package com.newscorpus.core.model;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 추출된 기사 한 건 (불변).
 * HtmlArticleParser.parse 가 만들고 ArticleStore 에 넘긴 뒤 코어는 다시 읽지 않는다.
 */
public final class ArticleRecord {

    /** 제목/저자가 없을 때 쓰는 표식 */
    public static final String NOT_FOUND = "NOT FOUND";

    private final int id;
    private final URI url;
    private final String title;
    private final List<String> authors;
    private final LocalDateTime date;
    private final List<String> topics;
    private final String text;
    private final boolean placeholder;

    private ArticleRecord(Builder b) {
        this.id = b.id;
        this.url = b.url;
        this.title = (b.title == null || b.title.isBlank()) ? NOT_FOUND : b.title;
        this.authors = (b.authors == null || b.authors.isEmpty()) ? List.of(NOT_FOUND) : List.copyOf(b.authors);
        this.date = b.date;
        this.topics = (b.topics == null) ? List.of() : List.copyOf(b.topics);
        this.text = b.text;
        this.placeholder = b.placeholder;
    }

    public int getId() { return id; }
    public URI getUrl() { return url; }
    public String getTitle() { return title; }
    public List<String> getAuthors() { return authors; }
    public Optional<LocalDateTime> getDate() { return Optional.ofNullable(date); }
    public List<String> getTopics() { return topics; }
    public String getText() { return text; }

    /** 본문이 실제 추출이 아니라 합성된 자리표시 문구인지 */
    public boolean isPlaceholder() { return placeholder; }

    @Override
    public String toString() {
        return "ArticleRecord{id=" + id + ", url=" + url + ", title='" + title + "', chars=" + text.length()
                + (placeholder ? ", placeholder" : "") + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int id;
        private URI url;
        private String title;
        private List<String> authors;
        private LocalDateTime date;
        private List<String> topics;
        private String text;
        private boolean placeholder;

        public Builder id(int id) { this.id = id; return this; }
        public Builder url(URI url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder authors(List<String> authors) { this.authors = authors; return this; }
        public Builder date(LocalDateTime date) { this.date = date; return this; }
        public Builder topics(List<String> topics) { this.topics = topics; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder placeholder(boolean placeholder) { this.placeholder = placeholder; return this; }

        public ArticleRecord build() {
            if (id < 1) throw new IllegalArgumentException("id must be >= 1: " + id);
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(text, "text");
            if (text.isEmpty()) throw new IllegalArgumentException("text must not be empty");
            return new ArticleRecord(this);
        }
    }
}
