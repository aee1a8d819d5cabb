package com.pagefrontier.core.service;

import com.pagefrontier.core.model.PageContent;
import com.pagefrontier.core.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * outputDir 아래 Markdown 파일로 저장.
 * 한 실행 안에서 같은 이름이 다시 나오면 URL 해시 접미사를 붙여 동시 워커가 서로 덮어쓰지 않게 한다.
 */
public final class FilePageWriter implements PageWriter {
    private static final Logger LOG = LoggerFactory.getLogger(FilePageWriter.class);

    private final Path outputDir;
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public FilePageWriter(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    @Override
    public Path write(String fileName, String content) throws IOException {
        Objects.requireNonNull(fileName, "fileName");
        Path base = outputDir.toAbsolutePath().normalize();
        Path file = base.resolve(fileName).normalize();
        if (!file.startsWith(base) || file.equals(base)) {
            throw new IOException("file name escapes output dir: " + fileName);
        }
        Files.createDirectories(file.getParent());
        Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return file;
    }

    @Override
    public Path write(PageContent page) throws IOException {
        return write(claim(PageWriter.fileNameFor(page), page.getUrl()), page.getContent());
    }

    /** 이번 실행에서 아직 쓰이지 않은 이름을 확보 */
    String claim(String fileName, String url) {
        if (claimed.add(fileName)) return fileName;
        String alt = FileNames.withSuffix(fileName, url);
        for (int i = 2; !claimed.add(alt); i++) {
            alt = FileNames.withSuffix(fileName, url + "#" + i);
        }
        LOG.debug("File name {} already used - writing {} as {}", fileName, url, alt);
        return alt;
    }
}
