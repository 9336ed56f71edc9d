package com.newscorpus.core.service;

import com.newscorpus.core.api.ArticleStore;
import com.newscorpus.core.api.IArticleParser;
import com.newscorpus.core.api.ICrawler;
import com.newscorpus.core.config.CrawlerConfig;
import com.newscorpus.core.model.ArticleRecord;
import com.newscorpus.core.model.HarvestReport;
import com.newscorpus.core.model.HarvestStats;
import com.newscorpus.core.util.ProgressListener;
import com.newscorpus.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 수집 오케스트레이터:
 *  - discover → (URL 마다) parse → save
 *  - id 는 발견 순서대로 1..n. 자리표시 레코드도 저장한다.
 *  - 순차 실행. 취소 플래그는 매 기사 처리 전에 확인한다.
 */
public final class HarvestService {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestService.class);
    private static final StructuredLog SLOG = StructuredLog.get(HarvestService.class);

    private final CrawlerConfig config;
    private final ICrawler crawler;
    private final IArticleParser parser;
    private final ArticleStore store;

    public HarvestService(CrawlerConfig config, ICrawler crawler, IArticleParser parser, ArticleStore store) {
        this.config = Objects.requireNonNull(config, "config");
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.store = Objects.requireNonNull(store, "store");
    }

    public HarvestReport run() {
        return run(ProgressListener.NONE, null);
    }

    public HarvestReport run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final long t0 = System.nanoTime();
        final HarvestStats stats = new HarvestStats();

        LOG.info("Harvest start: seeds={}, target={}", config.getSeedUrls().size(), config.getTotalArticles());
        SLOG.info("harvest-start", "seeds", config.getSeedUrls().size(), "target", config.getTotalArticles());

        pl.onProgress(ProgressListener.Phase.DISCOVER, 0, -1);
        List<URI> urls = crawler.discover(cancelFlag);
        stats.setDiscovered(urls.size());

        final int total = urls.size();
        pl.onProgress(ProgressListener.Phase.EXTRACT, 0, total);

        boolean cancelled = false;
        for (int i = 0; i < total; i++) {
            if (cancelFlag != null && cancelFlag.get()) {
                cancelled = true;
                LOG.info("Harvest cancelled after {}/{} articles", i, total);
                break;
            }
            int id = i + 1;
            ArticleRecord rec = parser.parse(urls.get(i), id);
            try {
                store.save(rec);
            } catch (IOException e) {
                // 이후 id 가 1..n 연속을 유지할 수 없으므로 실행 중단
                throw new UncheckedIOException("Failed to save article #" + id + " (" + rec.getUrl() + ")", e);
            }
            stats.recordSaved(rec);
            pl.onProgress(ProgressListener.Phase.EXTRACT, id, total);
        }

        HarvestReport report = stats.snapshot(Duration.ofNanos(System.nanoTime() - t0), cancelled);
        pl.onProgress(ProgressListener.Phase.DONE, report.getSaved(), total);

        LOG.info("Harvest done: {}", report);
        SLOG.info("harvest-done",
                "discovered", report.getDiscovered(),
                "saved", report.getSaved(),
                "placeholders", report.getPlaceholders(),
                "elapsedMs", report.getElapsed().toMillis(),
                "cancelled", report.isCancelled());
        return report;
    }
}
