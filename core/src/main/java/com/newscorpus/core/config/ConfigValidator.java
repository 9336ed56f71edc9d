package com.newscorpus.core.config;

import java.math.BigInteger;
import java.net.URI;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 원시 설정 문서(JSON/YAML 을 읽은 Map)를 검사해 {@link CrawlerConfig} 로 변환.
 *
 * 검사 순서(첫 실패 항목의 예외만 던짐, 집계하지 않음):
 * seed_urls → headers → total_articles(타입 → 범위) → encoding → timeout
 * → should_verify_certificate → headless_mode
 *
 * 네트워크 접근 없음.
 */
public final class ConfigValidator {

    public static final String SEED_URLS = "seed_urls";
    public static final String TOTAL_ARTICLES = "total_articles_to_find_and_parse";
    public static final String HEADERS = "headers";
    public static final String ENCODING = "encoding";
    public static final String TIMEOUT = "timeout";
    public static final String VERIFY_CERTIFICATE = "should_verify_certificate";
    public static final String HEADLESS_MODE = "headless_mode";

    // 누락 키 기본값
    static final int DEFAULT_TOTAL_ARTICLES = 0; // 양의 정수 검사(IncorrectNumberOfArticles)에서 실패하는 값
    static final String DEFAULT_ENCODING = "utf-8";
    static final int DEFAULT_TIMEOUT = 30;
    static final boolean DEFAULT_VERIFY = true;
    static final boolean DEFAULT_HEADLESS = true;

    private static final Pattern SEED_PATTERN = Pattern.compile("https?://.*/");

    private ConfigValidator() {}

    public static CrawlerConfig validate(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw");

        List<URI> seeds = checkSeedUrls(raw.containsKey(SEED_URLS) ? raw.get(SEED_URLS) : List.of());
        Map<String, String> headers = checkHeaders(raw.containsKey(HEADERS) ? raw.get(HEADERS) : Map.of());
        int total = checkTotalArticles(raw.containsKey(TOTAL_ARTICLES) ? raw.get(TOTAL_ARTICLES) : DEFAULT_TOTAL_ARTICLES);
        String encoding = checkEncoding(raw.containsKey(ENCODING) ? raw.get(ENCODING) : DEFAULT_ENCODING);
        int timeout = checkTimeout(raw.containsKey(TIMEOUT) ? raw.get(TIMEOUT) : DEFAULT_TIMEOUT);
        boolean verify = checkFlag(VERIFY_CERTIFICATE,
                raw.containsKey(VERIFY_CERTIFICATE) ? raw.get(VERIFY_CERTIFICATE) : DEFAULT_VERIFY);
        boolean headless = checkFlag(HEADLESS_MODE,
                raw.containsKey(HEADLESS_MODE) ? raw.get(HEADLESS_MODE) : DEFAULT_HEADLESS);

        return new CrawlerConfig(seeds, total, headers, encoding, timeout, verify, headless);
    }

    // ------------ checks ------------

    private static List<URI> checkSeedUrls(Object v) {
        if (!(v instanceof List<?> list)) {
            throw new IncorrectSeedUrlException(SEED_URLS, "must be a list of URLs");
        }
        if (list.isEmpty()) {
            throw new IncorrectSeedUrlException(SEED_URLS, "must not be empty");
        }
        List<URI> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof String s) || !SEED_PATTERN.matcher(s).lookingAt()) {
                throw new IncorrectSeedUrlException(SEED_URLS, "not an absolute http(s) URL with a path: " + o);
            }
            try {
                out.add(URI.create(s.trim()));
            } catch (IllegalArgumentException e) {
                throw new IncorrectSeedUrlException(SEED_URLS, "malformed URL: " + s);
            }
        }
        return out;
    }

    private static Map<String, String> checkHeaders(Object v) {
        if (!(v instanceof Map<?, ?> map)) {
            throw new IncorrectHeadersException(HEADERS, "must be a mapping of strings");
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String k) || !(e.getValue() instanceof String val)) {
                throw new IncorrectHeadersException(HEADERS, "keys and values must be strings: " + e.getKey());
            }
            if (hasLineBreak(k) || hasLineBreak(val)) {
                throw new IncorrectHeadersException(HEADERS, "line break in header " + k);
            }
            out.put(k, val);
        }
        return out;
    }

    private static int checkTotalArticles(Object v) {
        if (!isInteger(v)) {
            throw new IncorrectNumberOfArticlesException(TOTAL_ARTICLES, "must be an integer: " + v);
        }
        BigInteger n = toBigInteger(v);
        if (n.signum() < 1) {
            throw new IncorrectNumberOfArticlesException(TOTAL_ARTICLES, "must be >= 1: " + n);
        }
        if (n.compareTo(BigInteger.valueOf(CrawlerConfig.MAX_ARTICLES)) > 0) {
            throw new NumberOfArticlesOutOfRangeException(TOTAL_ARTICLES,
                    "must be <= " + CrawlerConfig.MAX_ARTICLES + ": " + n);
        }
        return n.intValue();
    }

    private static String checkEncoding(Object v) {
        if (!(v instanceof String s) || s.isBlank()) {
            throw new IncorrectEncodingException(ENCODING, "must be a non-empty string");
        }
        String name = s.trim();
        try {
            if (!Charset.isSupported(name)) {
                throw new IncorrectEncodingException(ENCODING, "unsupported charset: " + name);
            }
        } catch (IllegalArgumentException e) {
            // IllegalCharsetNameException 포함
            throw new IncorrectEncodingException(ENCODING, "illegal charset name: " + name);
        }
        return name;
    }

    private static int checkTimeout(Object v) {
        if (!isInteger(v)) {
            throw new IncorrectTimeoutException(TIMEOUT, "must be an integer: " + v);
        }
        BigInteger n = toBigInteger(v);
        if (n.compareTo(BigInteger.valueOf(CrawlerConfig.TIMEOUT_LOWER_LIMIT)) <= 0
                || n.compareTo(BigInteger.valueOf(CrawlerConfig.TIMEOUT_UPPER_LIMIT)) >= 0) {
            throw new IncorrectTimeoutException(TIMEOUT,
                    "must be in (" + CrawlerConfig.TIMEOUT_LOWER_LIMIT + ", " + CrawlerConfig.TIMEOUT_UPPER_LIMIT + "): " + n);
        }
        return n.intValue();
    }

    private static boolean checkFlag(String key, Object v) {
        if (!(v instanceof Boolean b)) {
            throw new IncorrectVerifyException(key, "must be a boolean: " + v);
        }
        return b;
    }

    // ------------ helpers ------------

    /** 정수형만 허용. Boolean 은 Number 가 아니므로 자연히 탈락, 실수/문자열도 탈락 */
    private static boolean isInteger(Object v) {
        return v instanceof Integer || v instanceof Long || v instanceof Short
                || v instanceof Byte || v instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Object v) {
        if (v instanceof BigInteger bi) return bi;
        return BigInteger.valueOf(((Number) v).longValue());
    }

    private static boolean hasLineBreak(String s) {
        return s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0;
    }
}
