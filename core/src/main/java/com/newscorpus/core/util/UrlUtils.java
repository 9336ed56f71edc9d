package com.newscorpus.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/** URL 정규화 + 사이트 상대 링크 해석 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 빈 경로를 "/"로
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost();
        if (host == null) return u; // 호스트 없는 URI는 건드리지 않음
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        String query = u.getRawQuery();

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /**
     * 페이지에서 얻은 href 를 절대 URL 로 해석한다.
     * <ul>
     *   <li>{@code /path} → origin + path</li>
     *   <li>{@code //host/path} → origin 의 scheme 을 붙임</li>
     *   <li>{@code http(s)://...} → 그대로</li>
     *   <li>그 외(상대 경로, mailto:, javascript: 등) → empty</li>
     * </ul>
     */
    public static Optional<URI> resolve(String origin, String href) {
        if (href == null) return Optional.empty();
        String h = href.trim();
        if (h.isEmpty()) return Optional.empty();

        String abs;
        String lower = h.toLowerCase(Locale.ROOT);
        if (h.startsWith("//")) {
            abs = schemeOf(origin) + ":" + h;
        } else if (h.startsWith("/")) {
            abs = stripTrailingSlash(origin) + h;
        } else if (lower.startsWith("http://") || lower.startsWith("https://")) {
            abs = h;
        } else {
            return Optional.empty();
        }
        try {
            URI u = URI.create(abs);
            if (u.getHost() == null) return Optional.empty();
            return Optional.of(normalize(u));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** scheme://host[:port] */
    public static String originOf(URI u) {
        String base = u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getHost().toLowerCase(Locale.ROOT);
        return (u.getPort() == -1) ? base : base + ":" + u.getPort();
    }

    private static String schemeOf(String origin) {
        int i = origin.indexOf("://");
        return (i > 0) ? origin.substring(0, i).toLowerCase(Locale.ROOT) : "https";
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
