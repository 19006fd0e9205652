package com.folderrag.ingest;

@FunctionalInterface
public interface ProgressSink {
    void report(String message);

    static ProgressSink none() {
        return message -> {
        };
    }
}
