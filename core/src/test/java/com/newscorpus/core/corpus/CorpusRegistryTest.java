package com.newscorpus.core.corpus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusRegistryTest {

    @TempDir
    Path tmp;

    private void raw(int id, String text) throws IOException {
        Files.writeString(tmp.resolve(id + "_raw.txt"), text);
    }

    @Test
    void dense_corpus_is_indexed_in_id_order() throws IOException {
        raw(2, "b");
        raw(1, "a");
        raw(3, "c");
        Files.writeString(tmp.resolve("1_meta.json"), "{}");
        Files.writeString(tmp.resolve("notes.md"), "ignored");
        Files.writeString(tmp.resolve("2_cleaned.txt"), "ignored");

        CorpusRegistry r = CorpusRegistry.open(tmp);

        assertThat(r.size()).isEqualTo(3);
        assertThat(r.getArticles().keySet()).containsExactly(1, 2, 3);
        assertThat(r.getArticles().get(1).getMetaPath()).contains(tmp.resolve("1_meta.json"));
        assertThat(r.getArticles().get(2).getMetaPath()).isEmpty();
        assertThat(r.getArticles().get(3).getRawPath()).isEqualTo(tmp.resolve("3_raw.txt"));
    }

    @Test
    void index_is_unmodifiable() throws IOException {
        raw(1, "a");
        CorpusRegistry r = CorpusRegistry.open(tmp);

        assertThatThrownBy(() -> r.getArticles().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void missing_path_is_directory_not_found() {
        assertThatThrownBy(() -> CorpusRegistry.open(tmp.resolve("nope")))
                .isInstanceOf(DirectoryNotFoundException.class)
                .isInstanceOf(CorpusValidationException.class);
    }

    @Test
    void file_path_is_not_a_directory() throws IOException {
        Path f = tmp.resolve("file.txt");
        Files.writeString(f, "x");

        assertThatThrownBy(() -> CorpusRegistry.open(f)).isInstanceOf(NotADirectoryException.class);
    }

    @Test
    void no_matching_files_is_empty_directory() throws IOException {
        Files.writeString(tmp.resolve("1_cleaned.txt"), "x");

        assertThatThrownBy(() -> CorpusRegistry.open(tmp)).isInstanceOf(EmptyDirectoryException.class);
    }

    @Test
    void zero_length_article_is_inconsistent() throws IOException {
        raw(1, "a");
        raw(2, "");

        assertThatThrownBy(() -> CorpusRegistry.open(tmp))
                .isInstanceOf(InconsistentDatasetException.class)
                .hasMessageContaining("2_raw.txt");
    }

    @Test
    void gap_in_ids_is_inconsistent() throws IOException {
        raw(1, "a");
        raw(3, "c");

        assertThatThrownBy(() -> CorpusRegistry.open(tmp)).isInstanceOf(InconsistentDatasetException.class);
    }

    @Test
    void ids_not_starting_at_one_are_inconsistent() throws IOException {
        raw(2, "b");
        raw(3, "c");

        assertThatThrownBy(() -> CorpusRegistry.open(tmp)).isInstanceOf(InconsistentDatasetException.class);
    }

    @Test
    void zero_id_and_duplicate_ids_are_inconsistent() throws IOException {
        raw(0, "z");
        assertThatThrownBy(() -> CorpusRegistry.open(tmp)).isInstanceOf(InconsistentDatasetException.class);

        Files.delete(tmp.resolve("0_raw.txt"));
        raw(1, "a");
        Files.writeString(tmp.resolve("01_raw.txt"), "a again");
        assertThatThrownBy(() -> CorpusRegistry.open(tmp)).isInstanceOf(InconsistentDatasetException.class);
    }

    @Test
    void id_beyond_int_range_is_not_skipped() throws IOException {
        raw(1, "a");
        Files.writeString(tmp.resolve("99999999999_raw.txt"), "huge id");

        assertThatThrownBy(() -> CorpusRegistry.open(tmp))
                .isInstanceOf(InconsistentDatasetException.class)
                .hasMessageContaining("out of range")
                .hasMessageContaining("99999999999_raw.txt");
    }

    @Test
    void custom_extension() throws IOException {
        Files.writeString(tmp.resolve("1_raw.html"), "<p>a</p>");
        raw(1, "text files do not count");
        raw(2, "text files do not count");

        assertThat(CorpusRegistry.open(tmp, "html").getArticles().keySet()).containsExactly(1);
    }
}
