package com.pipeline.anomaly.exception;

/**
 * 时序存储读写失败（连接、认证、响应格式错误或超时）。
 * 不做内部重试，由调用方根据 {@link #getOperation()} 决定重试或放弃。
 */
public class StoreException extends RuntimeException {

    public static final String WRITE = "write";
    public static final String QUERY = "query";
    public static final String OPEN = "open";

    private final String operation;

    public StoreException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public StoreException(String operation, String message) {
        this(operation, message, null);
    }

    /** 失败的操作名：write、query 或 open */
    public String getOperation() {
        return operation;
    }
}
