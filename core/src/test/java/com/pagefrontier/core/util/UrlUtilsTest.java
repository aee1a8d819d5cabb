package com.pagefrontier.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {
        @Test
        void drops_fragment_and_trailing_slash() {
            assertThat(UrlUtils.normalize("https://docs.example.com/guide/intro/#install"))
                    .isEqualTo("https://docs.example.com/guide/intro");
        }

        @Test
        void lowercases_scheme_and_host_but_keeps_path_case() {
            assertThat(UrlUtils.normalize("HTTPS://Docs.Example.COM/Guide"))
                    .isEqualTo("https://docs.example.com/Guide");
        }

        @Test
        void drops_default_port_keeps_explicit_port() {
            assertThat(UrlUtils.normalize("https://a.com:443/x")).isEqualTo("https://a.com/x");
            assertThat(UrlUtils.normalize("http://a.com:80/x")).isEqualTo("http://a.com/x");
            assertThat(UrlUtils.normalize("http://a.com:8080/x")).isEqualTo("http://a.com:8080/x");
        }

        @Test
        void keeps_query() {
            assertThat(UrlUtils.normalize("https://a.com/search/?q=1#top"))
                    .isEqualTo("https://a.com/search/?q=1");
        }

        @Test
        void root_becomes_bare_host() {
            assertThat(UrlUtils.normalize("https://a.com/")).isEqualTo("https://a.com");
            assertThat(UrlUtils.normalize("https://a.com")).isEqualTo("https://a.com");
        }

        @Test
        @DisplayName("normalize(normalize(u)) == normalize(u)")
        void is_idempotent() {
            for (String u : List.of(
                    "https://a.com/x//", "https://A.com:443/b/?q=1#f", "not a url/#x",
                    "/relative/path/", "mailto:someone@example.com", "https://a.com/%7Euser/")) {
                String once = UrlUtils.normalize(u);
                assertThat(UrlUtils.normalize(once)).as(u).isEqualTo(once);
            }
        }

        @Test
        void never_throws_on_garbage() {
            assertThat(UrlUtils.normalize(null)).isEmpty();
            assertThat(UrlUtils.normalize("   ")).isEmpty();
            assertThat(UrlUtils.normalize("ht tp://bad url/#frag")).isEqualTo("ht tp://bad url");
        }
    }

    @Test
    void host_and_first_segment() throws URISyntaxException {
        assertThat(UrlUtils.host("https://Docs.Example.com/guide")).isEqualTo("docs.example.com");
        assertThat(UrlUtils.host("/relative")).isNull();
        assertThat(UrlUtils.firstPathSegment("https://a.com/guide/intro")).isEqualTo("guide");
        assertThat(UrlUtils.firstPathSegment("https://a.com")).isEmpty();
        assertThat(UrlUtils.firstPathSegment("https://a.com/")).isEmpty();
    }

    @Test
    void absolute_http_check() {
        assertThat(UrlUtils.isAbsoluteHttp("https://a.com/x")).isTrue();
        assertThat(UrlUtils.isAbsoluteHttp("http://a.com")).isTrue();
        assertThat(UrlUtils.isAbsoluteHttp("ftp://a.com/x")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttp("mailto:x@a.com")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttp("/x")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttp(null)).isFalse();
    }
}
