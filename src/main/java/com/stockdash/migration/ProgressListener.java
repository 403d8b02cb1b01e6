package com.stockdash.migration;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total, current) -> {
    };

    void onProgress(int completed, int total, String current);
}
