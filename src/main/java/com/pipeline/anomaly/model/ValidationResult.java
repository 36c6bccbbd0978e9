package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 参数校验结果
 */
public class ValidationResult implements Serializable {
    private boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult() {
        this.valid = true;
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        this.errors.add(error);
        this.valid = false;
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public boolean isValid() { return valid; }
    public List<String> getErrors() { return errors; }
    public List<String> getWarnings() { return warnings; }

    @Override
    public String toString() {
        return valid ? "valid" : "invalid: " + String.join("; ", errors);
    }
}
