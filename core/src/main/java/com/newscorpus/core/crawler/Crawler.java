package com.newscorpus.core.crawler;

import com.newscorpus.core.api.ICrawler;
import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.config.CrawlerConfig;
import com.newscorpus.core.dom.DomNode;
import com.newscorpus.core.dom.JsoupDom;
import com.newscorpus.core.model.FetchResult;
import com.newscorpus.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 시드 순회 기반 기사 URL 발견기
 * - 시드 순서대로 fetch → 링크 추출 → 중복/거부목록 제거 → 목표 개수 도달 시 즉시 종료
 * - 실패한 시드는 건너뛰고 계속(전체 실행을 중단하지 않음)
 * - 링크 추출은 LinkExtractor에 위임
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlerConfig config;
    private final IFetcher fetcher;
    private final SiteProfile profile;
    private final LinkExtractor extractor;

    public Crawler(CrawlerConfig config, IFetcher fetcher, SiteProfile profile) {
        this(config, fetcher, profile, new ArticleLinkExtractor(profile));
    }

    public Crawler(CrawlerConfig config, IFetcher fetcher, SiteProfile profile, LinkExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public List<URI> discover(AtomicBoolean cancelFlag) {
        final int target = config.getTotalArticles();
        DiscoverySession session = new DiscoverySession(target);
        int skippedSeeds = 0;

        LOG.info("Discovery start: seeds={}, target={}", config.getSeedUrls().size(), target);

        for (URI seed : config.getSeedUrls()) {
            if (session.isFull()) break;
            if (cancelFlag != null && cancelFlag.get()) {
                LOG.info("Discovery cancelled after {} urls", session.size());
                break;
            }

            FetchResult res = fetcher.fetch(seed);
            if (!res.isSuccess()) {
                skippedSeeds++;
                LOG.warn("Seed skipped {}: {}", seed, res.describe());
                continue;
            }

            List<URI> candidates;
            try {
                DomNode page = JsoupDom.parse(res.text(), seed.toString());
                candidates = extractor.extract(page, seed);
            } catch (RuntimeException e) {
                skippedSeeds++;
                LOG.warn("Seed skipped {}: link extraction failed", seed, e);
                continue;
            }

            int added = 0;
            for (URI u : candidates) {
                if (session.isFull()) break; // 시드 중간이라도 즉시 종료
                if (profile.isDenied(u.toString())) {
                    LOG.debug("Denylisted url dropped: {}", u);
                    continue;
                }
                if (session.offer(u)) added++;
            }
            LOG.info("Seed {} -> {} new urls (total {}/{})", seed, added, session.size(), target);
        }

        List<URI> urls = session.result();
        if (urls.size() < target) {
            LOG.info("Seeds exhausted before target: found {}/{}", urls.size(), target);
        }
        SLOG.info("discover-done", "urls", urls.size(), "target", target, "skippedSeeds", skippedSeeds);
        return urls;
    }
}
