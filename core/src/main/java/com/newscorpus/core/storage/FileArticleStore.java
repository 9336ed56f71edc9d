package com.newscorpus.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newscorpus.core.api.ArticleStore;
import com.newscorpus.core.model.ArticleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * 파일 기반 영속화.
 * - 본문: {@code <id>_raw.txt} (UTF-8)
 * - 메타: {@code <id>_meta.json} (Jackson, 날짜는 ISO-8601 문자열)
 * 같은 id 로 다시 저장하면 덮어쓴다.
 */
public class FileArticleStore implements ArticleStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileArticleStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path dir;

    public FileArticleStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    @Override
    public void save(ArticleRecord record) throws IOException {
        Objects.requireNonNull(record, "record");
        Files.createDirectories(dir);

        Path raw = ArticleNaming.rawPath(dir, record.getId());
        write(raw, record.getText());
        Path meta = ArticleNaming.metaPath(dir, record.getId());
        write(meta, MAPPER.writeValueAsString(toMeta(record)));

        LOG.debug("Saved article #{} -> {}", record.getId(), raw.getFileName());
    }

    /** 저장된 원문 본문 */
    public String readText(int id) throws IOException {
        return Files.readString(ArticleNaming.rawPath(dir, id), StandardCharsets.UTF_8);
    }

    /** 정제된 본문을 {@code <id>_cleaned.txt} 로 기록 */
    public Path writeCleaned(int id, String text) throws IOException {
        Path out = ArticleNaming.cleanedPath(dir, id);
        write(out, text);
        return out;
    }

    ObjectNode toMeta(ArticleRecord r) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("id", r.getId());
        n.put("url", r.getUrl().toString());
        n.put("title", r.getTitle());
        ArrayNode authors = n.putArray("authors");
        r.getAuthors().forEach(authors::add);
        if (r.getDate().isPresent()) {
            n.set("date", MAPPER.valueToTree(r.getDate().get()));
        } else {
            n.putNull("date");
        }
        ArrayNode topics = n.putArray("topics");
        r.getTopics().forEach(topics::add);
        n.put("placeholder", r.isPlaceholder());
        n.put("chars", r.getText().length());
        return n;
    }

    private static void write(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }
}
