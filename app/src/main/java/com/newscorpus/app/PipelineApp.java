package com.newscorpus.app;

import com.newscorpus.app.logging.LogSetup;
import com.newscorpus.core.corpus.CorpusRegistry;
import com.newscorpus.core.corpus.CorpusValidationException;
import com.newscorpus.core.pipeline.TextCleaningPipeline;
import com.newscorpus.core.storage.FileArticleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 후처리 진입점: 코퍼스 검증 → 정제 파일 기록.
 * 종료 코드: 0 정상, 1 입출력 실패, 4 코퍼스 규칙 위반.
 */
public final class PipelineApp {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_CORPUS = 4;

    private PipelineApp() {}

    public static void main(String[] args) {
        Path outRoot = Paths.get(System.getProperty("nc.out.dir", "out"));
        Path corpusDir = args.length > 0 ? Paths.get(args[0]) : outRoot.resolve("corpus");
        LogSetup.configure(outRoot);
        System.exit(run(corpusDir));
    }

    static int run(Path corpusDir) {
        try {
            CorpusRegistry registry = CorpusRegistry.open(corpusDir);
            int n = new TextCleaningPipeline(registry, new FileArticleStore(corpusDir)).run();
            LOG.info("Pipeline finished: {} cleaned files in {}", n, corpusDir.toAbsolutePath());
            return EXIT_OK;
        } catch (CorpusValidationException e) {
            LOG.error("Corpus rejected [{}]: {}", e.getClass().getSimpleName(), e.getMessage());
            return EXIT_CORPUS;
        } catch (IOException | UncheckedIOException e) {
            LOG.error("Pipeline I/O failure in {}", corpusDir, e);
            return EXIT_IO;
        }
    }
}
