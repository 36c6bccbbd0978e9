package com.pipeline.anomaly.exception;

/**
 * 窗口内读数少于建模所需的最小数量，检测被跳过。
 */
public class InsufficientDataException extends DetectionException {

    private final int windowSize;
    private final int requiredSize;

    public InsufficientDataException(int windowSize, int requiredSize) {
        super("Window holds " + windowSize + " reading(s), at least " + requiredSize + " required for detection");
        this.windowSize = windowSize;
        this.requiredSize = requiredSize;
    }

    public int getWindowSize() { return windowSize; }
    public int getRequiredSize() { return requiredSize; }
}
