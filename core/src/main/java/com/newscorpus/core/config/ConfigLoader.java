package com.newscorpus.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 설정 파일을 읽어 원시 Map 으로 돌려준다. 값의 타입은 건드리지 않는다(검증은 {@link ConfigValidator}).
 *
 * 예상 JSON 키:
 * <pre>
 * {
 *   "seed_urls": ["https://klops.ru/news/"],
 *   "total_articles_to_find_and_parse": 10,
 *   "headers": {"User-Agent": "..."},
 *   "encoding": "utf-8",
 *   "timeout": 30,
 *   "should_verify_certificate": true,
 *   "headless_mode": true
 * }
 * </pre>
 * 확장자가 .yml/.yaml 이면 같은 키를 YAML 로 읽는다.
 */
public final class ConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {}

    /** 파일을 읽고 곧바로 검증까지 수행 */
    public static CrawlerConfig loadAndValidate(Path path) throws IOException {
        return ConfigValidator.validate(load(path));
    }

    public static Map<String, Object> load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new IOException("config not found at: " + path.toAbsolutePath());
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try (InputStream in = Files.newInputStream(path)) {
            return (name.endsWith(".yml") || name.endsWith(".yaml")) ? readYaml(in, path) : readJson(in, path);
        }
    }

    private static Map<String, Object> readJson(InputStream in, Path path) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IOException("malformed JSON config " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("config root must be an object: " + path);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = MAPPER.convertValue(root, LinkedHashMap.class);
        return map;
    }

    private static Map<String, Object> readYaml(InputStream in, Path path) throws IOException {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("malformed YAML config " + path + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> m)) {
            throw new IOException("config root must be a mapping: " + path);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }
}
