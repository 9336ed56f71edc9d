package com.newscorpus.core.crawler;

import com.newscorpus.core.FakeFetcher;
import com.newscorpus.core.TestConfigs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlerTest {

    private static final SiteProfile PROFILE = SiteProfile.klops();

    /** 시드 페이지 마크업: 경로마다 h1.entry-title > a.list-item__title */
    private static String listing(String... paths) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String p : paths) {
            sb.append("<h1 class='entry-title'><a class='list-item__title' href='").append(p).append("'>t</a></h1>");
        }
        return sb.append("</body></html>").toString();
    }

    private static URI u(String path) { return URI.create("https://example.test" + path); }

    @Test
    @DisplayName("링크 5개(중복 1) + 목표 2 → 먼저 본 서로 다른 절대 URL 2개")
    void five_links_one_duplicate_target_two() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/news/", listing("/n/1", "/n/1", "/n/2", "/n/3", "/n/4"));
        Crawler c = new Crawler(TestConfigs.config(List.of("https://example.test/news/"), 2), f, PROFILE);

        assertThat(c.discover()).containsExactly(u("/n/1"), u("/n/2"));
    }

    @Test
    @DisplayName("사이트 상대 링크는 시드 페이지의 origin 기준으로 해석(프로필 origin 이 아님)")
    void relative_links_resolve_against_seed_origin() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/news/", listing("/n/1"))
                .html("http://127.0.0.1:8081/feed/", listing("/n/2"));
        Crawler c = new Crawler(TestConfigs.config(List.of(
                "https://example.test/news/", "http://127.0.0.1:8081/feed/"), 2), f, SiteProfile.klops());

        List<URI> urls = c.discover();

        assertThat(urls).containsExactly(u("/n/1"), URI.create("http://127.0.0.1:8081/n/2"));
        assertThat(urls).extracting(URI::getHost).doesNotContain("klops.ru");
    }

    @Test
    void non_2xx_and_failed_seeds_are_skipped() {
        FakeFetcher f = new FakeFetcher()
                .status("https://example.test/a/", 503, "busy")
                .fail("https://example.test/b/", "connection refused")
                .html("https://example.test/c/", listing("/n/1", "/n/2"));
        Crawler c = new Crawler(TestConfigs.config(List.of(
                "https://example.test/a/", "https://example.test/b/", "https://example.test/c/"), 5), f, PROFILE);

        assertThat(c.discover()).containsExactly(u("/n/1"), u("/n/2"));
        assertThat(f.requests()).hasSize(3);
    }

    @Test
    @DisplayName("시드 중간에 목표 도달 → 즉시 종료, 다음 시드는 요청하지 않음")
    void cap_reached_mid_seed_stops_immediately() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/a/", listing("/n/1", "/n/2", "/n/3"))
                .html("https://example.test/b/", listing("/n/4"));
        Crawler c = new Crawler(TestConfigs.config(List.of(
                "https://example.test/a/", "https://example.test/b/"), 2), f, PROFILE);

        assertThat(c.discover()).containsExactly(u("/n/1"), u("/n/2"));
        assertThat(f.requests()).containsExactly(URI.create("https://example.test/a/"));
    }

    @Test
    void duplicates_across_seeds_keep_first_seen_order() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/a/", listing("/n/2", "/n/1"))
                .html("https://example.test/b/", listing("/n/1#c", "/n/3"));
        Crawler c = new Crawler(TestConfigs.config(List.of(
                "https://example.test/a/", "https://example.test/b/"), 10), f, PROFILE);

        assertThat(c.discover()).containsExactly(u("/n/2"), u("/n/1"), u("/n/3"));
    }

    @Test
    void denylisted_urls_do_not_count_toward_target() {
        SiteProfile profile = PROFILE.toBuilder().urlDenylist(List.of("/video/")).build();
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/a/", listing("/video/1", "/n/1", "/video/2", "/n/2"));
        Crawler c = new Crawler(TestConfigs.config(List.of("https://example.test/a/"), 2), f, profile);

        assertThat(c.discover()).containsExactly(u("/n/1"), u("/n/2"));
    }

    @Test
    void shortfall_returns_what_was_found() {
        FakeFetcher f = new FakeFetcher().html("https://example.test/a/", listing("/n/1"));
        Crawler c = new Crawler(TestConfigs.config(List.of("https://example.test/a/"), 50), f, PROFILE);

        assertThat(c.discover()).containsExactly(u("/n/1"));
    }

    @Test
    void cancel_flag_is_observed_before_next_seed() {
        AtomicBoolean cancel = new AtomicBoolean(false);
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/a/", listing("/n/1"))
                .html("https://example.test/b/", listing("/n/2"));
        LinkExtractor cancellingAfterFirst = (page, pageUrl) -> {
            List<URI> out = new ArticleLinkExtractor(PROFILE).extract(page, pageUrl);
            cancel.set(true);
            return out;
        };
        Crawler c = new Crawler(TestConfigs.config(List.of(
                "https://example.test/a/", "https://example.test/b/"), 10), f, PROFILE, cancellingAfterFirst);

        assertThat(c.discover(cancel)).containsExactly(u("/n/1"));
        assertThat(f.requests()).hasSize(1);
    }

    @Test
    void extractor_failure_skips_only_that_seed() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/a/", "<bad/>")
                .html("https://example.test/b/", listing("/n/2"));
        LinkExtractor flaky = (page, pageUrl) -> {
            if (page.selectAll("bad").size() > 0) throw new IllegalStateException("boom");
            return new ArticleLinkExtractor(PROFILE).extract(page, pageUrl);
        };
        Crawler c = new Crawler(TestConfigs.config(List.of(
                "https://example.test/a/", "https://example.test/b/"), 10), f, PROFILE, flaky);

        assertThat(c.discover()).containsExactly(u("/n/2"));
    }

    @Test
    @DisplayName("같은 입력으로 두 번 실행해도 같은 결과(세션 상태가 남지 않음)")
    void repeated_discovery_is_idempotent() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.test/a/", listing("/n/1", "/n/2", "/n/3"));
        Crawler c = new Crawler(TestConfigs.config(List.of("https://example.test/a/"), 3), f, PROFILE);

        List<URI> first = c.discover();
        List<URI> second = c.discover();

        assertThat(second).isEqualTo(first).hasSize(3);
    }
}
