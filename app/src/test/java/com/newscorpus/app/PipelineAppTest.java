package com.newscorpus.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineAppTest {

    @TempDir
    Path tmp;

    @Test
    void cleans_valid_corpus() throws IOException {
        Files.writeString(tmp.resolve("1_raw.txt"), "Один, два; ТРИ!", StandardCharsets.UTF_8);

        assertThat(PipelineApp.run(tmp)).isEqualTo(PipelineApp.EXIT_OK);
        assertThat(Files.readString(tmp.resolve("1_cleaned.txt"), StandardCharsets.UTF_8)).isEqualTo("один два три");
    }

    @Test
    void invalid_corpus_exits_4() throws IOException {
        Files.writeString(tmp.resolve("2_raw.txt"), "gap before me", StandardCharsets.UTF_8);

        assertThat(PipelineApp.run(tmp)).isEqualTo(PipelineApp.EXIT_CORPUS);
        assertThat(PipelineApp.run(tmp.resolve("missing"))).isEqualTo(PipelineApp.EXIT_CORPUS);
    }
}
