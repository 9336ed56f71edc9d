package com.newscorpus.core;

import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.model.FetchResult;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** URL → 미리 정한 응답. 등록되지 않은 URL 은 전송 오류. 호출 순서를 기록한다. */
public final class FakeFetcher implements IFetcher {

    private final Map<String, FetchResult> byUrl = new LinkedHashMap<>();
    private final List<URI> requests = new ArrayList<>();

    public FakeFetcher html(String url, String body) {
        return status(url, 200, body);
    }

    public FakeFetcher status(String url, int status, String body) {
        URI u = URI.create(url);
        byUrl.put(url, FetchResult.builder()
                .url(u)
                .statusCode(status)
                .body(body.getBytes(StandardCharsets.UTF_8))
                .charset(StandardCharsets.UTF_8)
                .outcomeFromStatus()
                .build());
        return this;
    }

    public FakeFetcher fail(String url, String error) {
        byUrl.put(url, FetchResult.transportError(URI.create(url), StandardCharsets.UTF_8, 0, error));
        return this;
    }

    @Override
    public FetchResult fetch(URI url) {
        requests.add(url);
        FetchResult r = byUrl.get(url.toString());
        if (r == null) return FetchResult.transportError(url, StandardCharsets.UTF_8, 0, "no stub");
        return r;
    }

    public List<URI> requests() { return requests; }
}
