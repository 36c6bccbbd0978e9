package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.model.FunctionMetadata;
import com.pipeline.anomaly.model.ParameterDefinition;
import com.pipeline.anomaly.model.ValidationResult;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 依据检测器元数据中的参数定义校验参数表。
 */
public final class ParameterValidator {

    private ParameterValidator() {}

    public static ValidationResult validate(FunctionMetadata metadata, Map<String, Object> parameters) {
        ValidationResult result = new ValidationResult();
        if (metadata == null || metadata.getParameterDefinitions() == null) {
            return result;
        }

        Map<String, Object> params = (parameters != null) ? parameters : Collections.emptyMap();
        List<ParameterDefinition> definitions = metadata.getParameterDefinitions();

        for (ParameterDefinition def : definitions) {
            String paramName = def.getName();
            Object value = params.get(paramName);

            if (def.isRequired() && value == null) {
                result.addError("Required parameter '" + paramName + "' is missing.");
                continue;
            }
            if (value == null) {
                continue;
            }

            switch (def.getType().toUpperCase()) {
                case "NUMBER":
                    checkNumber(def, value, result);
                    break;

                case "INTEGER":
                    if (value instanceof Double || value instanceof Float) {
                        result.addError("Parameter '" + paramName
                                + "' expects INTEGER type, got: " + value);
                    } else {
                        checkNumber(def, value, result);
                    }
                    break;

                case "BOOLEAN":
                    if (!(value instanceof Boolean)) {
                        result.addError("Parameter '" + paramName
                                + "' expects BOOLEAN type, got: " + value.getClass().getSimpleName());
                    }
                    break;

                default:
                    result.addWarning("Unknown parameter type '" + def.getType()
                            + "' for parameter '" + paramName + "', skipping validation.");
            }
        }

        Set<String> definedNames = definitions.stream()
                .map(ParameterDefinition::getName)
                .collect(Collectors.toSet());
        for (String key : params.keySet()) {
            if (!definedNames.contains(key)) {
                result.addWarning("Parameter '" + key + "' is not defined in '"
                        + metadata.getFunctionId() + "' metadata, it will be ignored.");
            }
        }

        return result;
    }

    private static void checkNumber(ParameterDefinition def, Object value, ValidationResult result) {
        String paramName = def.getName();
        if (!(value instanceof Number)) {
            result.addError("Parameter '" + paramName
                    + "' expects " + def.getType() + " type, got: " + value.getClass().getSimpleName());
            return;
        }
        double numVal = ((Number) value).doubleValue();
        if (def.getMinValue() != null) {
            boolean below = def.isMinExclusive() ? numVal <= def.getMinValue() : numVal < def.getMinValue();
            if (below) {
                result.addError("Parameter '" + paramName + "' value " + numVal
                        + (def.isMinExclusive() ? " must be greater than " : " is below minimum ")
                        + def.getMinValue());
            }
        }
        if (def.getMaxValue() != null && numVal > def.getMaxValue()) {
            result.addError("Parameter '" + paramName + "' value "
                    + numVal + " exceeds maximum " + def.getMaxValue());
        }
    }
}
