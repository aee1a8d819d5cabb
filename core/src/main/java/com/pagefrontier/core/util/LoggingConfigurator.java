package com.pagefrontier.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J 는 slf4j-jdk14 로 JUL 에 붙는다).
 * 콘솔 + 사이즈 롤링 파일(logDir/crawl-%g.log). System props:
 *  -Dpf.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dpf.log.sizeMb=2
 *  -Dpf.log.files=5
 *  -Dpf.log.dir=logs (CrawlMain)
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    static final Formatter LINE_FORMATTER = new Formatter() {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(160);
            String msg = formatMessage(r);
            if (msg.startsWith("{")) {
                sb.append(msg);                                   // StructuredLog: JSON 그대로
            } else {
                sb.append(String.format(Locale.ROOT, "%1$tF %1$tT.%1$tL %2$-7s %3$s - %4$s",
                        r.getMillis(), r.getLevel().getName(), shortName(r.getLoggerName()), msg));
            }
            if (r.getThrown() != null) sb.append(" | ").append(r.getThrown());
            return sb.append(System.lineSeparator()).toString();
        }
    };

    public static void init(Path logDir) {
        init(logDir, resolveLevel(), parseInt(System.getProperty("pf.log.sizeMb"), 2) * 1024 * 1024,
                parseInt(System.getProperty("pf.log.files"), 5));
    }

    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("crawl-%g.log").toString();
            FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
            file.setLevel(rootLevel);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 진행
            root.log(Level.WARNING, "Failed to init file handler: " + e.getMessage());
        }

        root.setLevel(rootLevel);
    }

    static Level resolveLevel() {
        String v = System.getProperty("pf.log.level", "INFO");
        try {
            return Level.parse(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    private static int parseInt(String s, int def) {
        if (s == null) return def;
        try { return Math.max(1, Integer.parseInt(s.trim())); } catch (NumberFormatException e) { return def; }
    }

    private static String shortName(String loggerName) {
        if (loggerName == null) return "";
        int i = loggerName.lastIndexOf('.');
        return i >= 0 ? loggerName.substring(i + 1) : loggerName;
    }
}
