package com.pagefrontier.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** reader 서비스가 돌려준 추출 결과(본문 텍스트 + 링크 + 이미지) */
public final class PageContent {
    private final String url;
    private final String title;
    private final String content;
    private final List<String> links;
    private final List<String> images;

    private PageContent(Builder b) {
        this.url = b.url;
        this.title = b.title;
        this.content = (b.content == null) ? "" : b.content;
        this.links = List.copyOf(b.links);
        this.images = List.copyOf(b.images);
    }

    public String getUrl() { return url; }
    /** reader가 제목을 주지 않았으면 null */
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public List<String> getLinks() { return links; }
    public List<String> getImages() { return images; }

    public boolean isBlank() { return content.isBlank(); }

    /**
     * 파일명에 쓸 제목: reader 제목 → 본문 첫 비어있지 않은 줄('#' 제거) → null
     */
    public String resolveTitle() {
        if (title != null && !title.isBlank()) return title.strip();
        for (String line : content.split("\\R", 20)) {
            String t = line.strip();
            while (t.startsWith("#")) t = t.substring(1);
            t = t.strip();
            if (!t.isEmpty()) return t;
        }
        return null;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String title;
        private String content;
        private final List<String> links = new ArrayList<>();
        private final List<String> images = new ArrayList<>();

        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder link(String link) { if (link != null && !link.isBlank()) this.links.add(link.strip()); return this; }
        public Builder links(List<String> links) { if (links != null) links.forEach(this::link); return this; }
        public Builder image(String image) { if (image != null && !image.isBlank()) this.images.add(image.strip()); return this; }
        public Builder images(List<String> images) { if (images != null) images.forEach(this::image); return this; }

        public PageContent build() {
            Objects.requireNonNull(url, "url");
            return new PageContent(this);
        }
    }
}
