package com.pagefrontier.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화(비교 키 생성) + host / 첫 path 세그먼트 추출 유틸 */
public final class UrlUtils {
    private static final Logger LOG = LoggerFactory.getLogger(UrlUtils.class);

    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자, 기본 포트 제거(http:80, https:443)
     * - 끝 슬래시 제거 ("https://a.com/x/" → "https://a.com/x", "https://a.com/" → "https://a.com")
     * - scheme://host/path[?query] 로 재조립
     *
     * 절대 예외를 던지지 않는다. 파싱 실패 시 '#' 이후 절단 + 끝 슬래시 제거로 대체한다.
     * normalize(normalize(u)) == normalize(u)
     */
    public static String normalize(String url) {
        if (url == null) return "";
        String raw = url.trim();
        if (raw.isEmpty()) return "";
        try {
            URI u = new URI(raw);
            String scheme = u.getScheme();
            String host = u.getHost();
            if (scheme == null || host == null) return fallback(raw);

            scheme = scheme.toLowerCase(Locale.ROOT);
            StringBuilder sb = new StringBuilder(raw.length());
            sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));

            int port = u.getPort();
            boolean defaultPort = (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
            if (port != -1 && !defaultPort) sb.append(':').append(port);

            String path = u.getRawPath();
            if (path != null) sb.append(path);
            String query = u.getRawQuery();
            if (query != null) sb.append('?').append(query);

            return stripTrailingSlash(sb.toString());
        } catch (URISyntaxException e) {
            LOG.debug("Invalid URL {}: {}", raw, e.getMessage());
            return fallback(raw);
        }
    }

    /** 소문자 host. 파싱 실패/상대 URL이면 null */
    public static String host(String url) {
        if (url == null) return null;
        try {
            String h = new URI(url.trim()).getHost();
            return h == null ? null : h.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** "/guide/intro" → "guide". 세그먼트가 없으면 "" */
    public static String firstPathSegment(String url) throws URISyntaxException {
        String path = new URI(url.trim()).getPath();
        if (path == null || path.isEmpty()) return "";
        String[] parts = path.split("/");
        return parts.length > 1 ? parts[1] : "";
    }

    /** http/https 절대 URL 여부 */
    public static boolean isAbsoluteHttp(String url) {
        if (url == null) return false;
        try {
            URI u = new URI(url.trim());
            String s = u.getScheme();
            return u.getHost() != null && s != null
                    && (s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https"));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String fallback(String raw) {
        int i = raw.indexOf('#');
        return stripTrailingSlash(i >= 0 ? raw.substring(0, i) : raw);
    }

    private static String stripTrailingSlash(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }
}
