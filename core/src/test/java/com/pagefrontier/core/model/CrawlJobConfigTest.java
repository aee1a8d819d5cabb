package com.pagefrontier.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlJobConfigTest {

    private static CrawlJobConfig base() {
        return CrawlJobConfig.defaults().setSeedUrls(List.of("https://docs.example.com/guide"));
    }

    @Test
    void defaults_with_seed_are_valid() {
        assertThatCode(() -> base().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("크롤 시작 전에 잘못된 설정을 거절")
    void rejects_invalid_settings() {
        assertThatThrownBy(() -> CrawlJobConfig.defaults().validate())
                .isInstanceOf(JobConfigException.class).hasMessageContaining("seedUrls");
        assertThatThrownBy(() -> base().setSeedUrls(List.of("docs.example.com/guide")).validate())
                .isInstanceOf(JobConfigException.class);
        assertThatThrownBy(() -> base().setMaxPages(0).validate())
                .isInstanceOf(JobConfigException.class).hasMessageContaining("maxPages");
        assertThatThrownBy(() -> base().setMaxDepth(-1).validate())
                .isInstanceOf(JobConfigException.class).hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> base().setMaxWorkers(0).validate())
                .isInstanceOf(JobConfigException.class);
        assertThatThrownBy(() -> base().setMaxFetchAttempts(0).validate())
                .isInstanceOf(JobConfigException.class);
        assertThatThrownBy(() -> base().setRps(0).validate())
                .isInstanceOf(JobConfigException.class);
        assertThatThrownBy(() -> base().setOutputDir(null).validate())
                .isInstanceOf(JobConfigException.class);
        assertThatThrownBy(() -> base().setExclusionPatterns(List.of("re:[")).validate())
                .isInstanceOf(JobConfigException.class).hasMessageContaining("exclusion");
        assertThatThrownBy(() -> { var c = base(); c.getReader().setTimeoutMs(0); c.validate(); })
                .isInstanceOf(JobConfigException.class);
        assertThatThrownBy(() -> { var c = base(); c.getReader().setEndpoint("r.jina.ai"); c.validate(); })
                .isInstanceOf(JobConfigException.class);
    }

    @Test
    void max_depth_zero_is_allowed() {
        assertThatCode(() -> base().setMaxDepth(0).setMaxPages(1).validate()).doesNotThrowAnyException();
    }

    @Test
    void config_error_is_an_illegal_argument() {
        assertThatThrownBy(() -> base().setRps(-1).validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
