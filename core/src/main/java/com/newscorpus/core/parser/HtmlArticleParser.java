package com.newscorpus.core.parser;

import com.newscorpus.core.api.IArticleParser;
import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.crawler.SiteProfile;
import com.newscorpus.core.dom.DomNode;
import com.newscorpus.core.dom.JsoupDom;
import com.newscorpus.core.model.ArticleRecord;
import com.newscorpus.core.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 기사 URL 하나 → {@link ArticleRecord}.
 *
 * 본문: 전략 목록(by-class → by-tag(article) → by-body-fallback)을 차례로 시도해 컨테이너를 찾고,
 * 문단 텍스트가 짧으면 전체 텍스트로 한 번 더, 그래도 최소 길이 미만이면 자리표시 본문을 합성한다.
 * 메타데이터(제목/날짜/토픽)는 본문과 독립적으로 추출하며 실패해도 기본값으로 대체한다.
 *
 * parse 는 예외를 밖으로 던지지 않는다. 한 기사의 실패가 배치를 멈추면 안 된다.
 */
public class HtmlArticleParser implements IArticleParser {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlArticleParser.class);

    /** 이보다 짧으면 거친 전체 텍스트 추출을 한 번 더 시도 */
    public static final int SHORT_TEXT_THRESHOLD = 200;
    /** 모든 레코드 본문의 최소 길이 */
    public static final int MIN_TEXT_LENGTH = 50;

    private final IFetcher fetcher;
    private final SiteProfile profile;
    private final DateNormalizer dates;
    private final List<ContentStrategy> strategies;

    public HtmlArticleParser(IFetcher fetcher, SiteProfile profile) {
        this(fetcher, profile, new DateNormalizer());
    }

    public HtmlArticleParser(IFetcher fetcher, SiteProfile profile, DateNormalizer dates) {
        this(fetcher, profile, dates, defaultStrategies(profile));
    }

    public HtmlArticleParser(IFetcher fetcher, SiteProfile profile, DateNormalizer dates,
                             List<ContentStrategy> strategies) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.dates = Objects.requireNonNull(dates, "dates");
        this.strategies = List.copyOf(strategies);
    }

    public static List<ContentStrategy> defaultStrategies(SiteProfile profile) {
        return List.of(
                new ByClassStrategy(profile.getContentSelectors()),
                new ByTagStrategy("article"),
                new BodyFallbackStrategy());
    }

    @Override
    public ArticleRecord parse(URI url, int articleId) {
        try {
            FetchResult res = fetcher.fetch(url);
            if (!res.isSuccess()) {
                LOG.warn("Article #{} {} not fetched: {}", articleId, url, res.describe());
                return placeholderRecord(url, articleId, res.describe());
            }

            LOG.debug("Article #{} fetched: {} bytes in {} ms", articleId, res.getBodyLength(), res.getElapsedMs());
            DomNode doc = JsoupDom.parse(res.text(), url.toString());
            ArticleRecord.Builder b = ArticleRecord.builder().id(articleId).url(url);
            fillMeta(doc, b, articleId);
            fillText(doc, b, url, articleId);
            return b.build();
        } catch (RuntimeException e) {
            LOG.warn("Article #{} {} failed, using placeholder text", articleId, url, e);
            return placeholderRecord(url, articleId, e.getClass().getSimpleName());
        }
    }

    // ------------ body ------------

    private void fillText(DomNode doc, ArticleRecord.Builder b, URI url, int articleId) {
        Optional<DomNode> container = Optional.empty();
        for (ContentStrategy s : strategies) {
            container = s.locate(doc);
            if (container.isPresent()) {
                LOG.debug("Article #{} content located by {}", articleId, s.name());
                break;
            }
        }
        if (container.isEmpty()) {
            LOG.warn("Article #{} {}: no content container", articleId, url);
            b.text(PlaceholderText.forUrl(url, "no content container")).placeholder(true);
            return;
        }

        String text = TextExtractor.paragraphs(container.get());
        if (text.length() < SHORT_TEXT_THRESHOLD) {
            String coarse = TextExtractor.fullText(container.get());
            if (coarse.length() > text.length()) text = coarse;
        }
        if (text.length() < MIN_TEXT_LENGTH) {
            LOG.warn("Article #{} {}: text too short ({} chars)", articleId, url, text.length());
            b.text(PlaceholderText.forUrl(url, "text too short: " + text.length() + " chars")).placeholder(true);
            return;
        }
        b.text(text);
    }

    // ------------ meta ------------

    private void fillMeta(DomNode doc, ArticleRecord.Builder b, int articleId) {
        try {
            b.title(findTitle(doc));
        } catch (RuntimeException e) {
            LOG.debug("Article #{} title lookup failed: {}", articleId, e.toString());
        }
        try {
            findDate(doc).ifPresent(b::date);
        } catch (RuntimeException e) {
            LOG.debug("Article #{} date lookup failed: {}", articleId, e.toString());
        }
        try {
            b.topics(findTopics(doc));
        } catch (RuntimeException e) {
            LOG.debug("Article #{} topic lookup failed: {}", articleId, e.toString());
        }
        // 사이트가 저자 정보를 구조적으로 노출하지 않음 → 기본 표식 하나
        b.authors(List.of(ArticleRecord.NOT_FOUND));
    }

    private String findTitle(DomNode doc) {
        for (String css : profile.getTitleSelectors()) {
            Optional<String> t = doc.selectFirst(css).map(n -> TextExtractor.collapse(n.text())).filter(s -> !s.isEmpty());
            if (t.isPresent()) return t.get();
        }
        return ArticleRecord.NOT_FOUND;
    }

    private Optional<LocalDateTime> findDate(DomNode doc) {
        if (profile.getDateSelector() == null) return Optional.empty();
        return doc.selectFirst(profile.getDateSelector())
                .map(DomNode::text)
                .flatMap(dates::normalize);
    }

    private List<String> findTopics(DomNode doc) {
        if (profile.getTopicSelector() == null) return List.of();
        List<String> out = new ArrayList<>();
        for (DomNode a : doc.selectAll(profile.getTopicSelector())) {
            String t = TextExtractor.collapse(a.text());
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static ArticleRecord placeholderRecord(URI url, int articleId, String reason) {
        return ArticleRecord.builder()
                .id(articleId)
                .url(url)
                .text(PlaceholderText.forUrl(url, reason))
                .placeholder(true)
                .build();
    }
}
