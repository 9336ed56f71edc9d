package com.newscorpus.core.model;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/** 한 번의 수집 실행 동안의 카운터 누적기 (스레드 세이프). */
public final class HarvestStats {
    private final AtomicInteger discovered   = new AtomicInteger(0); // 발견된 기사 URL 수
    private final AtomicInteger saved        = new AtomicInteger(0); // save 까지 끝난 레코드 수
    private final AtomicInteger placeholders = new AtomicInteger(0); // 그중 자리표시 본문

    public void setDiscovered(int n) { discovered.set(n); }

    public void recordSaved(ArticleRecord r) {
        saved.incrementAndGet();
        if (r.isPlaceholder()) placeholders.incrementAndGet();
    }

    public HarvestReport snapshot(Duration elapsed, boolean cancelled) {
        return new HarvestReport(discovered.get(), saved.get(), placeholders.get(), elapsed, cancelled);
    }
}
