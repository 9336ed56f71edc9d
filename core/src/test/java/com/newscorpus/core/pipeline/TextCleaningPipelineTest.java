package com.newscorpus.core.pipeline;

import com.newscorpus.core.corpus.CorpusRegistry;
import com.newscorpus.core.storage.FileArticleStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleaningPipelineTest {

    @TempDir
    Path tmp;

    @Test
    void clean_removes_punctuation_lowercases_and_collapses_whitespace() {
        assertThat(TextCleaningPipeline.clean("  Привет,   МИР!\n\nЭто — «тест» №1.  "))
                .isEqualTo("привет мир это тест 1");
        assertThat(TextCleaningPipeline.clean("Hello, World... snake_case stays")).isEqualTo("hello world snake_case stays");
        assertThat(TextCleaningPipeline.clean(null)).isEmpty();
    }

    @Test
    void writes_cleaned_file_for_every_article() throws IOException {
        Files.writeString(tmp.resolve("1_raw.txt"), "Первая СТАТЬЯ!", StandardCharsets.UTF_8);
        Files.writeString(tmp.resolve("2_raw.txt"), "Вторая:  статья?", StandardCharsets.UTF_8);

        int n = new TextCleaningPipeline(CorpusRegistry.open(tmp), new FileArticleStore(tmp)).run();

        assertThat(n).isEqualTo(2);
        assertThat(Files.readString(tmp.resolve("1_cleaned.txt"), StandardCharsets.UTF_8)).isEqualTo("первая статья");
        assertThat(Files.readString(tmp.resolve("2_cleaned.txt"), StandardCharsets.UTF_8)).isEqualTo("вторая статья");
    }
}
