package com.pagefrontier.core.util;

import java.net.URI;
import java.util.Locale;

/** 페이지 제목/URL → 파일 이름 */
public final class FileNames {
    public static final int DEFAULT_MAX_LENGTH = 100;
    public static final String EXTENSION = ".md";

    private FileNames() {}

    /**
     * 제목을 파일 이름으로 정리한다.
     * - 파일명 금지 문자/구두점 제거(글자·숫자·공백·'-'·'_' 만 남김)
     * - 공백 → '_', 앞뒤 '_' 제거
     * - maxLength(코드 포인트 기준)로 자름, ".md" 부착
     * 남는 게 없으면 "index.md"
     */
    public static String sanitize(String title, int maxLength) {
        String s = (title == null ? "" : title);
        s = s.replaceAll("[^\\p{L}\\p{N}\\s_-]", "");
        s = s.strip().replaceAll("\\s+", "_");
        int limit = Math.max(1, maxLength);
        if (s.codePointCount(0, s.length()) > limit) {
            s = s.substring(0, s.offsetByCodePoints(0, limit));   // 서로게이트 쌍을 자르지 않음
        }
        s = s.replaceAll("^_+|_+$", "");
        if (s.isEmpty()) s = "index";
        return s + EXTENSION;
    }

    public static String sanitize(String title) {
        return sanitize(title, DEFAULT_MAX_LENGTH);
    }

    /** URL path 기반 이름 재료: "/guide/setup" → "guide setup", 빈 path → "index" */
    public static String titleFromUrl(String url) {
        try {
            String path = URI.create(url.split("#", 2)[0]).getPath();
            if (path == null) return "index";
            String t = path.replaceAll("^/+|/+$", "").replace('/', ' ');
            return t.isBlank() ? "index" : t;
        } catch (IllegalArgumentException e) {
            return "index";
        }
    }

    /** 충돌 회피용 접미사: URL 해시 8자리 */
    public static String withSuffix(String fileName, String url) {
        String suffix = String.format(Locale.ROOT, "%08x", url.hashCode());
        String base = fileName.endsWith(EXTENSION) ? fileName.substring(0, fileName.length() - EXTENSION.length()) : fileName;
        return base + "-" + suffix + EXTENSION;
    }
}
