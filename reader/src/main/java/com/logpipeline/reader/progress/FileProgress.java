package com.logpipeline.reader.progress;

import java.util.Set;

/**
 * Registry of per-file reading positions, keyed by file name.
 */
public interface FileProgress {

    /**
     * @return the stored cursor, or {@link FileCursor#START} for an unseen file
     */
    FileCursor cursor(String fileName);

    void save(String fileName, FileCursor cursor);

    /**
     * Forgets the cursors of every file not named in {@code fileNames}.
     */
    void retainOnly(Set<String> fileNames);

    default boolean isComplete(String fileName) {
        return cursor(fileName).complete();
    }
}
