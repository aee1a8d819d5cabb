package com.pagefrontier.core.service;

import com.pagefrontier.core.model.PageContent;
import com.pagefrontier.core.util.FileNames;

import java.io.IOException;
import java.nio.file.Path;

/** 추출된 페이지 본문 저장소 */
@FunctionalInterface
public interface PageWriter {

    /** fileName 으로 content 를 저장하고 실제 경로를 돌려준다 */
    Path write(String fileName, String content) throws IOException;

    /** 제목(없으면 URL path) 기반 파일명으로 저장 */
    default Path write(PageContent page) throws IOException {
        return write(fileNameFor(page), page.getContent());
    }

    static String fileNameFor(PageContent page) {
        String title = page.resolveTitle();
        return FileNames.sanitize(title != null ? title : FileNames.titleFromUrl(page.getUrl()));
    }
}
