package com.pagefrontier.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pagefrontier.core.model.CrawlReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * CrawlReport → outputDir/crawl-report.json (pretty JSON).
 * Instant 는 ISO-8601 문자열, Duration 은 초(소수) 단위로 기록.
 */
public final class CrawlReportExporter {
    public static final String FILE_NAME = "crawl-report.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public Path export(CrawlReport report, Path outputDir) throws IOException {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(outputDir, "outputDir");
        Files.createDirectories(outputDir);
        Path out = outputDir.resolve(FILE_NAME);
        Files.writeString(out, toJson(report), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    public String toJson(CrawlReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }
}
