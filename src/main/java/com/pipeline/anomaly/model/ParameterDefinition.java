package com.pipeline.anomaly.model;

import java.io.Serializable;

/**
 * 检测器参数定义
 */
public class ParameterDefinition implements Serializable {
    private String name;
    private String description;
    /** 参数类型：NUMBER, INTEGER, BOOLEAN */
    private String type;
    private boolean required;
    private Object defaultValue;
    /** 数值型参数的取值下限 */
    private Double minValue;
    /** 为true时下限为开区间 */
    private boolean minExclusive;
    /** 数值型参数的取值上限 */
    private Double maxValue;

    public ParameterDefinition() {}

    public static ParameterDefinition number(String name, Object defaultValue, Double min, Double max,
                                             String description) {
        ParameterDefinition def = new ParameterDefinition();
        def.setName(name);
        def.setType("NUMBER");
        def.setDefaultValue(defaultValue);
        def.setMinValue(min);
        def.setMaxValue(max);
        def.setDescription(description);
        return def;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }
    public Object getDefaultValue() { return defaultValue; }
    public void setDefaultValue(Object defaultValue) { this.defaultValue = defaultValue; }
    public Double getMinValue() { return minValue; }
    public void setMinValue(Double minValue) { this.minValue = minValue; }
    public boolean isMinExclusive() { return minExclusive; }
    public void setMinExclusive(boolean minExclusive) { this.minExclusive = minExclusive; }
    public Double getMaxValue() { return maxValue; }
    public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }
}
