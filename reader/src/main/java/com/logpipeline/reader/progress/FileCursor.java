package com.logpipeline.reader.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How far the reader got in one file: the number of physical lines already
 * consumed (blank ones included) and whether the whole file has been streamed.
 * The file's size and file-system key when the cursor was taken identify the file,
 * so a replaced or truncated file under the same name is streamed from the start.
 */
public record FileCursor(
    @JsonProperty("lines_consumed") long linesConsumed,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("size") long size,
    @JsonProperty("file_key") String fileKey) {

    public static final FileCursor START = new FileCursor(0, false, 0, null);

    public static FileCursor start(String fileKey, long size) {
        return new FileCursor(0, false, size, fileKey);
    }

    public FileCursor advance(long linesConsumed) {
        return new FileCursor(linesConsumed, false, size, fileKey);
    }

    public FileCursor complete(long linesConsumed) {
        return new FileCursor(linesConsumed, true, size, fileKey);
    }

    /**
     * Same file, seen again with the given size.
     */
    public FileCursor resize(long currentSize) {
        return new FileCursor(linesConsumed, complete, currentSize, fileKey);
    }

    /**
     * @return {@code false} if the file on disk cannot be the one this cursor was taken
     *     from: its key differs, or it is now smaller than it was
     */
    public boolean sameFile(String currentKey, long currentSize) {
        if (fileKey != null && currentKey != null && !fileKey.equals(currentKey)) {
            return false;
        }
        return currentSize >= size;
    }
}
