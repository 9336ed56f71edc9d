package com.newscorpus.core.corpus;

import com.newscorpus.core.storage.ArticleNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * 디스크 위 코퍼스 디렉터리를 검증하고 id → {@link CorpusEntry} 색인을 만든다.
 *
 * 검증 순서: 존재 → 디렉터리 여부 → 매칭 파일 존재 → 빈 파일 없음 → id 가 정확히 1..n.
 * 이름이 패턴에 맞으면 id 가 int 범위를 넘어도 검사 대상이다.
 * 본문은 읽지 않는다(크기만 본다).
 */
public final class CorpusRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusRegistry.class);

    private final Path directory;
    private final SortedMap<Integer, CorpusEntry> articles;

    private CorpusRegistry(Path directory, SortedMap<Integer, CorpusEntry> articles) {
        this.directory = directory;
        this.articles = Collections.unmodifiableSortedMap(articles);
    }

    public static CorpusRegistry open(Path directory) {
        return open(directory, ArticleNaming.TEXT_EXT);
    }

    public static CorpusRegistry open(Path directory, String ext) {
        if (directory == null) throw new IllegalArgumentException("directory is null");
        if (ext == null || ext.isBlank()) throw new IllegalArgumentException("ext is blank");

        if (!Files.exists(directory)) {
            throw new DirectoryNotFoundException(directory, "corpus directory does not exist");
        }
        if (!Files.isDirectory(directory)) {
            throw new NotADirectoryException(directory, "corpus path is not a directory");
        }

        SortedMap<Integer, CorpusEntry> found = new TreeMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (!Files.isRegularFile(p)) continue;
                String name = p.getFileName().toString();
                if (!ArticleNaming.isRawName(name, ext)) continue;

                OptionalInt id = ArticleNaming.parseRawId(name, ext);
                if (id.isEmpty()) {
                    throw new InconsistentDatasetException(p, "article id out of range");
                }

                if (id.getAsInt() < 1) {
                    throw new InconsistentDatasetException(p, "article ids start at 1");
                }
                if (found.containsKey(id.getAsInt())) {
                    // 7_raw.txt 와 007_raw.txt
                    throw new InconsistentDatasetException(p, "duplicate article id " + id.getAsInt());
                }
                if (Files.size(p) == 0) {
                    throw new InconsistentDatasetException(p, "empty article file");
                }
                Path meta = ArticleNaming.metaPath(directory, id.getAsInt());
                found.put(id.getAsInt(), new CorpusEntry(id.getAsInt(), p, Files.isRegularFile(meta) ? meta : null));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list corpus directory " + directory, e);
        }

        if (found.isEmpty()) {
            throw new EmptyDirectoryException(directory, "no *_raw." + ext + " files");
        }
        // 중복이 없으므로 첫 값 1, 마지막 값 n 이면 1..n
        if (found.firstKey() != 1 || found.lastKey() != found.size()) {
            throw new InconsistentDatasetException(directory,
                    "ids are not the dense range 1.." + found.size() + " (found " + found.keySet() + ")");
        }

        LOG.info("Corpus opened: {} articles in {}", found.size(), directory);
        return new CorpusRegistry(directory, found);
    }

    public Path getDirectory() { return directory; }

    /** id 오름차순, 수정 불가 */
    public SortedMap<Integer, CorpusEntry> getArticles() { return articles; }

    public int size() { return articles.size(); }
}
