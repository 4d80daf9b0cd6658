package com.logpipeline.reader.progress;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cursors held for the lifetime of the process. A restarted reader streams every file again.
 */
@Component
@ConditionalOnProperty(name = "pipeline.reader.progress-store", havingValue = "memory")
public class InMemoryFileProgress implements FileProgress {

    private final Map<String, FileCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public FileCursor cursor(String fileName) {
        return cursors.getOrDefault(fileName, FileCursor.START);
    }

    @Override
    public void save(String fileName, FileCursor cursor) {
        cursors.put(fileName, cursor);
    }

    @Override
    public void retainOnly(Set<String> fileNames) {
        cursors.keySet().retainAll(fileNames);
    }
}
