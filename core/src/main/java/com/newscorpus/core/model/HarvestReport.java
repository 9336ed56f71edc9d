package com.newscorpus.core.model;

import java.time.Duration;
import java.util.Objects;

/** 수집 실행 결과 요약 (불변) */
public final class HarvestReport {
    private final int discovered;
    private final int saved;
    private final int placeholders;
    private final Duration elapsed;
    private final boolean cancelled;

    public HarvestReport(int discovered, int saved, int placeholders, Duration elapsed, boolean cancelled) {
        this.discovered = discovered;
        this.saved = saved;
        this.placeholders = placeholders;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.cancelled = cancelled;
    }

    public int getDiscovered() { return discovered; }
    public int getSaved() { return saved; }
    public int getPlaceholders() { return placeholders; }
    public Duration getElapsed() { return elapsed; }
    public boolean isCancelled() { return cancelled; }

    @Override
    public String toString() {
        return "HarvestReport{discovered=" + discovered + ", saved=" + saved + ", placeholders=" + placeholders
                + ", elapsedMs=" + elapsed.toMillis() + (cancelled ? ", cancelled" : "") + '}';
    }
}
