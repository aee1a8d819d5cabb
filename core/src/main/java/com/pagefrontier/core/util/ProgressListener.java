package com.pagefrontier.core.util;

import com.pagefrontier.core.model.FrontierStats;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase "seed" | "crawl" | "done"
     * @param stats 호출 시점의 프론티어 스냅샷
     */
    void onProgress(String phase, FrontierStats stats);

    ProgressListener NONE = (phase, stats) -> {};
}
