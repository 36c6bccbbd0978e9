package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.List;

/**
 * 检测器元数据，描述检测器的身份、版本、所用特征和参数定义
 */
public class FunctionMetadata implements Serializable {
    private String functionId;
    private String name;
    private String version;
    private String description;
    /** 参与建模的特征字段（如 temperatura, umidade） */
    private List<String> featureNames;
    /** 参数定义列表 */
    private List<ParameterDefinition> parameterDefinitions;

    public FunctionMetadata() {}

    public String getFunctionId() { return functionId; }
    public void setFunctionId(String functionId) { this.functionId = functionId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public List<String> getFeatureNames() { return featureNames; }
    public void setFeatureNames(List<String> featureNames) { this.featureNames = featureNames; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
    public void setParameterDefinitions(List<ParameterDefinition> parameterDefinitions) { this.parameterDefinitions = parameterDefinitions; }
}
