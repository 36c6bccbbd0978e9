package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 时序存储连接配置。
 * 构造后不可变；重新配置应创建新的配置及新的存储客户端。
 */
public final class StoreConfig implements Serializable {
    /** 服务地址，如 https://host:8086 或 sqlite:data/storage */
    private final String endpoint;
    /** 访问令牌 */
    private final String credential;
    private final String organization;
    private final String bucket;

    public StoreConfig(String endpoint, String credential, String organization, String bucket) {
        this.endpoint = endpoint;
        this.credential = credential;
        this.organization = organization;
        this.bucket = bucket;
    }

    public String getEndpoint() { return endpoint; }
    public String getCredential() { return credential; }
    public String getOrganization() { return organization; }
    public String getBucket() { return bucket; }

    /**
     * 返回缺失（null或空白）的配置项名称列表；全部齐备时返回空列表。
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(endpoint)) missing.add("endpoint");
        if (isBlank(credential)) missing.add("credential");
        if (isBlank(organization)) missing.add("organization");
        if (isBlank(bucket)) missing.add("bucket");
        return missing;
    }

    public boolean isComplete() {
        return missingFields().isEmpty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        // 不输出令牌
        return "StoreConfig{endpoint='" + endpoint + "'"
                + ", organization='" + organization + "'"
                + ", bucket='" + bucket + "'}";
    }
}
