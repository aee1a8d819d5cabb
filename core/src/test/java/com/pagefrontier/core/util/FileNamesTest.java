package com.pagefrontier.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileNamesTest {

    @Test
    void strips_punctuation_and_joins_words() {
        assertThat(FileNames.sanitize("Getting Started: Install / Setup?"))
                .isEqualTo("Getting_Started_Install_Setup.md");
    }

    @Test
    void keeps_hyphen_underscore_and_unicode_letters() {
        assertThat(FileNames.sanitize("설치 가이드 - step_1")).isEqualTo("설치_가이드_-_step_1.md");
    }

    @Test
    void truncates_to_max_length_before_extension() {
        String name = FileNames.sanitize("a".repeat(250));
        assertThat(name).hasSize(FileNames.DEFAULT_MAX_LENGTH + FileNames.EXTENSION.length());
        assertThat(name).endsWith(".md");
    }

    @Test
    void truncation_does_not_split_supplementary_characters() {
        // U+20000: 서로게이트 쌍. 앞에 'a' 를 둬서 char 경계와 코드 포인트 경계를 어긋나게 한다
        String name = FileNames.sanitize("a" + "\uD840\uDC00".repeat(150));
        String base = name.substring(0, name.length() - FileNames.EXTENSION.length());
        assertThat(Character.isHighSurrogate(base.charAt(base.length() - 1))).isFalse();
        assertThat(base.codePointCount(0, base.length())).isEqualTo(FileNames.DEFAULT_MAX_LENGTH);
        assertThat(name).endsWith(".md");
    }

    @Test
    void blank_or_symbol_only_titles_fall_back_to_index() {
        assertThat(FileNames.sanitize(null)).isEqualTo("index.md");
        assertThat(FileNames.sanitize("  ")).isEqualTo("index.md");
        assertThat(FileNames.sanitize("???!!!")).isEqualTo("index.md");
    }

    @Test
    void title_from_url_path() {
        assertThat(FileNames.titleFromUrl("https://a.com/guide/setup/")).isEqualTo("guide setup");
        assertThat(FileNames.titleFromUrl("https://a.com")).isEqualTo("index");
    }

    @Test
    void suffix_is_stable_per_url_and_differs_between_urls() {
        String a = FileNames.withSuffix("intro.md", "https://a.com/x");
        assertThat(a).startsWith("intro-").endsWith(".md").hasSize("intro-".length() + 8 + 3);
        assertThat(FileNames.withSuffix("intro.md", "https://a.com/x")).isEqualTo(a);
        assertThat(FileNames.withSuffix("intro.md", "https://a.com/y")).isNotEqualTo(a);
    }
}
