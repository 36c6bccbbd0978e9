package com.pipeline.anomaly.exception;

import java.util.List;

/**
 * 存储连接配置不完整时抛出。
 * 属于前置条件失败，任何存储操作都不会被尝试。
 */
public class ConfigIncompleteException extends IllegalStateException {

    private final List<String> missingFields;

    public ConfigIncompleteException(List<String> missingFields) {
        super("Store configuration incomplete, missing: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
