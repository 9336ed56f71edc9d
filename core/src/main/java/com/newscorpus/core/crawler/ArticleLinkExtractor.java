package com.newscorpus.core.crawler;

import com.newscorpus.core.dom.DomNode;
import com.newscorpus.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 시드 페이지에서 기사 링크 후보를 문서 순서대로 뽑는다.
 * 컨테이너마다 첫 번째 링크 하나만 본다. 해석 불가 링크는 건너뛴다.
 */
public class ArticleLinkExtractor implements LinkExtractor {

    private final SiteProfile profile;

    public ArticleLinkExtractor(SiteProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    @Override
    public List<URI> extract(DomNode page, URI pageUrl) {
        String origin = originFor(pageUrl);
        List<URI> out = new ArrayList<>();
        for (DomNode container : page.selectAll(profile.getLinkContainerSelector())) {
            Optional<URI> u = extractOne(container, origin);
            u.ifPresent(out::add);
        }
        return out;
    }

    /** 컨테이너 하나에서 링크 하나. 컨테이너 자체가 링크일 수도 있다 */
    Optional<URI> extractOne(DomNode container, String origin) {
        Optional<DomNode> link = container.selectFirst(profile.getLinkSelector());
        if (link.isEmpty()) return Optional.empty();
        String href = link.get().attr("href");
        if (href.isBlank()) return Optional.empty();
        return UrlUtils.resolve(origin, href);
    }

    /** 페이지 URL 의 origin. 호스트를 알 수 없으면 프로필 origin */
    private String originFor(URI pageUrl) {
        if (pageUrl == null || pageUrl.getScheme() == null || pageUrl.getHost() == null) {
            return profile.getOrigin();
        }
        return UrlUtils.originOf(pageUrl);
    }
}
