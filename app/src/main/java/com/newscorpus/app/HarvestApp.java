package com.newscorpus.app;

import com.newscorpus.app.logging.LogSetup;
import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.config.ConfigLoader;
import com.newscorpus.core.config.ConfigValidationException;
import com.newscorpus.core.config.CrawlerConfig;
import com.newscorpus.core.crawler.Crawler;
import com.newscorpus.core.crawler.SiteProfile;
import com.newscorpus.core.http.DefaultRetryPolicy;
import com.newscorpus.core.http.HttpFetcher;
import com.newscorpus.core.http.PacedFetcher;
import com.newscorpus.core.http.RetryingFetcher;
import com.newscorpus.core.model.HarvestReport;
import com.newscorpus.core.parser.HtmlArticleParser;
import com.newscorpus.core.service.HarvestService;
import com.newscorpus.core.storage.FileArticleStore;
import com.newscorpus.core.storage.WorkspacePreparer;
import com.newscorpus.core.util.JitterPolicy;
import com.newscorpus.core.util.ProgressListener;
import com.newscorpus.core.util.RandomJitterPolicy;
import com.newscorpus.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 수집 실행 진입점: 설정 검증 → 작업 디렉터리 준비 → 발견 → 추출 → 저장.
 *
 * System props:
 *  -Dnc.config=config/crawler.json
 *  -Dnc.out.dir=out  (기사: out/corpus, 로그: out/logs)
 *  -Dnc.fetch.maxAttempts=1  (2 이상이면 재시도 데코레이터 사용)
 *
 * 종료 코드: 0 정상, 1 실행 중 저장 실패, 2 설정 오류, 3 작업 디렉터리 오류.
 */
public final class HarvestApp {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_WORKSPACE = 3;

    private HarvestApp() {}

    public static void main(String[] args) {
        Path outRoot = Paths.get(System.getProperty("nc.out.dir", "out"));
        Path config = Paths.get(args.length > 0 ? args[0] : System.getProperty("nc.config", "config/crawler.json"));

        LogSetup.configure(outRoot);
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        System.exit(run(config, outRoot, new RandomJitterPolicy()));
    }

    static int run(Path configPath, Path outRoot, JitterPolicy jitter) {
        // 1) 설정: 네트워크 접근 전에 완전히 검증
        final CrawlerConfig config;
        try {
            config = ConfigLoader.loadAndValidate(configPath);
        } catch (ConfigValidationException e) {
            LOG.error("Invalid configuration {} [{}]: {}", configPath, e.getClass().getSimpleName(), e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            LOG.error("Cannot read configuration {}: {}", configPath, e.getMessage());
            return EXIT_CONFIG;
        }
        LOG.info("Configuration loaded: {}", config);

        // 2) 작업 디렉터리: 매 실행 빈 상태에서 시작
        final Path corpusDir = outRoot.resolve("corpus");
        try {
            WorkspacePreparer.prepare(corpusDir);
        } catch (IOException e) {
            LOG.error("Cannot prepare workspace {}: {}", corpusDir, e.toString());
            return EXIT_WORKSPACE;
        }

        // 3) 수집
        SiteProfile profile = SiteProfile.klops();
        try (IFetcher fetcher = buildFetcher(config, jitter)) {
            HarvestService service = new HarvestService(config,
                    new Crawler(config, fetcher, profile),
                    new HtmlArticleParser(fetcher, profile),
                    new FileArticleStore(corpusDir));
            HarvestReport report = service.run(HarvestApp::logProgress, null);
            LOG.info("Saved {} articles ({} placeholders) to {}",
                    report.getSaved(), report.getPlaceholders(), corpusDir.toAbsolutePath());
            return EXIT_OK;
        } catch (UncheckedIOException e) {
            LOG.error("Harvest aborted: {}", e.getMessage(), e);
            return EXIT_RUN_FAILED;
        } catch (Exception e) {
            // fetcher close 실패 포함
            LOG.error("Harvest failed", e);
            return EXIT_RUN_FAILED;
        }
    }

    static void logProgress(ProgressListener.Phase phase, int done, int total) {
        if (phase == ProgressListener.Phase.EXTRACT && done > 0) {
            LOG.info("Extracted {}/{} ({}%)", done, total,
                    Math.round(ProgressListener.fraction(done, total) * 100));
        } else {
            LOG.debug("Phase {} ({}/{})", phase, done, total);
        }
    }

    /** HttpFetcher → (선택) RetryingFetcher → PacedFetcher. 발견과 추출이 같은 페이싱을 공유한다. */
    static IFetcher buildFetcher(CrawlerConfig config, JitterPolicy jitter) {
        IFetcher f = new HttpFetcher(config);
        int maxAttempts = Integer.getInteger("nc.fetch.maxAttempts", 1);
        if (maxAttempts > 1) {
            f = new RetryingFetcher(f, new DefaultRetryPolicy(maxAttempts), Sleeper.SYSTEM);
        }
        return new PacedFetcher(f, jitter, Sleeper.SYSTEM);
    }
}
