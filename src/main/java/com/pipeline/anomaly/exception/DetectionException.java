package com.pipeline.anomaly.exception;

/**
 * 窗口无法支持异常检测时抛出
 */
public class DetectionException extends RuntimeException {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
