package com.newscorpus.core.pipeline;

import com.newscorpus.core.corpus.CorpusEntry;
import com.newscorpus.core.corpus.CorpusRegistry;
import com.newscorpus.core.storage.FileArticleStore;
import com.newscorpus.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 코퍼스 원문을 정제해 {@code <id>_cleaned.txt} 로 쓴다.
 * 단어 문자/공백 외 제거 → 소문자 → 공백 압축 → trim. 형태소 분석 같은 언어 처리는 하지 않는다.
 */
public final class TextCleaningPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TextCleaningPipeline.class);
    private static final StructuredLog SLOG = StructuredLog.get(TextCleaningPipeline.class);

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPACES = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final CorpusRegistry registry;
    private final FileArticleStore store;

    public TextCleaningPipeline(CorpusRegistry registry, FileArticleStore store) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
    }

    /** @return 기록한 파일 수 */
    public int run() throws IOException {
        int written = 0;
        for (CorpusEntry e : registry.getArticles().values()) {
            String raw = store.readText(e.getId());
            store.writeCleaned(e.getId(), clean(raw));
            written++;
        }
        LOG.info("Cleaned {} articles in {}", written, registry.getDirectory());
        SLOG.info("clean-done", "files", written);
        return written;
    }

    public static String clean(String raw) {
        if (raw == null) return "";
        String s = NON_WORD.matcher(raw).replaceAll("");
        s = s.toLowerCase(Locale.ROOT);
        return SPACES.matcher(s).replaceAll(" ").trim();
    }
}
