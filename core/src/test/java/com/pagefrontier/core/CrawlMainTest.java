package com.pagefrontier.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlMainTest {

    @Test
    void log_dir_defaults_to_logs_and_follows_system_property() {
        String prev = System.getProperty("pf.log.dir");
        try {
            System.clearProperty("pf.log.dir");
            assertThat(CrawlMain.defaultLogDir()).isEqualTo(Path.of("logs"));

            System.setProperty("pf.log.dir", "/tmp/pf-logs");
            assertThat(CrawlMain.defaultLogDir()).isEqualTo(Path.of("/tmp/pf-logs"));
        } finally {
            if (prev == null) System.clearProperty("pf.log.dir");
            else System.setProperty("pf.log.dir", prev);
        }
    }
}
