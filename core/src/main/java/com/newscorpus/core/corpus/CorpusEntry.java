package com.newscorpus.core.corpus;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** 레지스트리가 id 별로 들고 있는 자리표시: 원문 파일 경로와 (있으면) 메타 파일 경로 */
public final class CorpusEntry {

    private final int id;
    private final Path rawPath;
    private final Path metaPath;

    public CorpusEntry(int id, Path rawPath, Path metaPath) {
        if (id < 1) throw new IllegalArgumentException("id must be >= 1: " + id);
        this.id = id;
        this.rawPath = Objects.requireNonNull(rawPath, "rawPath");
        this.metaPath = metaPath;
    }

    public int getId() { return id; }
    public Path getRawPath() { return rawPath; }
    public Optional<Path> getMetaPath() { return Optional.ofNullable(metaPath); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorpusEntry)) return false;
        CorpusEntry that = (CorpusEntry) o;
        return id == that.id && rawPath.equals(that.rawPath) && Objects.equals(metaPath, that.metaPath);
    }

    @Override
    public int hashCode() { return Objects.hash(id, rawPath, metaPath); }

    @Override
    public String toString() {
        return "CorpusEntry{id=" + id + ", raw=" + rawPath.getFileName() + '}';
    }
}
