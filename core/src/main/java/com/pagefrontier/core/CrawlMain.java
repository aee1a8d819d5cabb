package com.pagefrontier.core;

import com.pagefrontier.core.http.ReaderPageFetcher;
import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.model.CrawlReport;
import com.pagefrontier.core.service.CrawlService;
import com.pagefrontier.core.service.FilePageWriter;
import com.pagefrontier.core.service.export.CrawlReportExporter;
import com.pagefrontier.core.util.LoggingConfigurator;
import com.pagefrontier.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/** 실행: java ... com.pagefrontier.core.CrawlMain job.yml */
public final class CrawlMain {
    private static final Logger LOG = LoggerFactory.getLogger(CrawlMain.class);

    private CrawlMain() {}

    /** 로그 디렉터리: -Dpf.log.dir, 없으면 ./logs */
    static Path defaultLogDir() {
        return Path.of(System.getProperty("pf.log.dir", "logs"));
    }

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            System.err.println("usage: CrawlMain <job.yml>");
            System.exit(2);
            return;
        }
        // YAML 로딩 오류도 파일 로그에 남도록 먼저 초기화
        LoggingConfigurator.init(defaultLogDir());
        CrawlJobConfig cfg = YamlConfigLoader.load(Path.of(args[0]));

        try (ReaderPageFetcher fetcher = new ReaderPageFetcher(cfg)) {
            CrawlService service = new CrawlService(cfg, fetcher, new FilePageWriter(cfg.getOutputDir()));
            CrawlReport report = service.run((phase, stats) ->
                    LOG.debug("[{}] {}", phase, stats.progressLabel()));
            Path out = new CrawlReportExporter().export(report, cfg.getOutputDir());
            LOG.info("Report written to {} ({} pages, {} failed)", out,
                    report.frontier().uniquePagesScraped(), report.failedUrls().size());
        }
    }
}
