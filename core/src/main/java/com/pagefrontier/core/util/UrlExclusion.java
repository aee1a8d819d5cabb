package com.pagefrontier.core.util;

import java.util.List;
import java.util.regex.Pattern;

public final class UrlExclusion {
    private UrlExclusion(){}

    /**
     * 제외 패턴 판정(하나라도 매치되면 true).
     * <ul>
     *   <li>기본: 부분 문자열 포함 (예: {@code "/changelog"}, {@code "?print=1"})</li>
     *   <li>glob: {@code "glob:"} 접두, {@code '*'}/{@code '?'} 지원 (예: {@code "glob:*&#47;v1/*"})</li>
     *   <li>정규식: {@code "re:"} 접두, 대소문자 무시 find (예: {@code re:\.(pdf|zip)$})</li>
     * </ul>
     * 잘못된 정규식은 IllegalArgumentException(PatternSyntaxException)으로 올라간다.
     */
    public static boolean isExcluded(String url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        for (String p : patterns) {
            if (p == null || p.isEmpty()) continue;

            if (p.startsWith("re:")) {
                if (Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE).matcher(url).find()) return true;

            } else if (p.startsWith("glob:")) {
                String rx = globToRegex(p.substring(5));
                if (Pattern.compile(rx, Pattern.CASE_INSENSITIVE).matcher(url).find()) return true;

            } else if (url.contains(p)) {
                return true;
            }
        }
        return false;
    }

    /** 설정 로딩 시점 검증용: 잘못된 re:/glob: 패턴이면 예외 */
    public static void checkPattern(String p) {
        if (p == null) return;
        if (p.startsWith("re:")) Pattern.compile(p.substring(3));
        else if (p.startsWith("glob:")) Pattern.compile(globToRegex(p.substring(5)));
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder(glob.length() + 8);
        for (char c : glob.toCharArray()){
            switch (c) {
                case '*' -> r.append(".*");
                case '?' -> r.append('.');
                case '.', '\\', '+', '(', ')', '^', '$', '|', '{', '}', '[', ']' -> r.append('\\').append(c);
                default -> r.append(c);
            }
        }
        return r.toString();
    }
}
