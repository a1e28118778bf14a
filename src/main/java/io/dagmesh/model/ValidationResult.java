package io.dagmesh.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured pass/fail answer used by graph validation, configuration checks and the
 * agent {@code validateSpecification} hook. Expected failures are reported here, not thrown.
 */
public record ValidationResult(
        boolean result,
        boolean consensus,
        String reason,
        Map<String, Object> details
) {
    public ValidationResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ValidationResult ok(String reason) {
        return new ValidationResult(true, true, reason, Map.of());
    }

    public static ValidationResult ok(String reason, Map<String, Object> details) {
        return new ValidationResult(true, true, reason, details);
    }

    public static ValidationResult fail(String reason) {
        return new ValidationResult(false, false, reason, Map.of());
    }

    public static ValidationResult fail(String reason, String type, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", type);
        if (extra != null) {
            details.putAll(extra);
        }
        return new ValidationResult(false, false, reason, details);
    }
}
