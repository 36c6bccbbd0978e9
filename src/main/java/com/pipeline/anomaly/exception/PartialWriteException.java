package com.pipeline.anomaly.exception;

import java.time.Instant;

/**
 * 批量写入在某个点失败。失败点之前已写入的点保留，不做回滚。
 */
public class PartialWriteException extends StoreException {

    private final int failedIndex;
    private final Instant failedTimestamp;
    private final int writtenCount;

    public PartialWriteException(int failedIndex, Instant failedTimestamp, int writtenCount, Throwable cause) {
        super(WRITE, "point #" + failedIndex + " at " + failedTimestamp
                + " rejected after " + writtenCount + " point(s) written: "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.failedIndex = failedIndex;
        this.failedTimestamp = failedTimestamp;
        this.writtenCount = writtenCount;
    }

    public int getFailedIndex() { return failedIndex; }
    public Instant getFailedTimestamp() { return failedTimestamp; }
    public int getWrittenCount() { return writtenCount; }
}
