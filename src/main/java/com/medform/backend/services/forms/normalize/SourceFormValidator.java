package com.medform.backend.services.forms.normalize;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.medform.backend.services.forms.schema.FieldType;
import com.medform.backend.services.forms.schema.MnrSchema;
import com.medform.backend.services.util.TreeValues;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks an extracted MNR tree and produces a best-effort {@link NormalizedForm}.
 * Problems are collected, never thrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceFormValidator {

    static final String PROCESSOR = "mnr-validator";
    static final String VALIDATION_METHOD = "schema-table";

    private final Clock clock;

    public ValidationReport validate(Object tree) {
        List<String> errors = new ArrayList<>();
        Map<String, Object> data = TreeValues.asMap(tree);
        if (data == null) {
            errors.add("Data must be a JSON object");
            return new ValidationReport(errors, false);
        }

        boolean required = validateRequiredFields(data, errors);
        validateFieldTypes(data, errors);
        validatePainLevels(data, errors);
        validateHeightWeight(data, errors);
        validateActivities(data, errors);
        return new ValidationReport(errors, required);
    }

    /**
     * Validates, then coerces a copy of {@code tree}. The input is never modified.
     *
     * @throws IllegalArgumentException when {@code tree} is not an object
     */
    public NormalizedForm process(Map<String, ?> tree) {
        if (tree == null) {
            throw new IllegalArgumentException("Source tree is required");
        }

        ValidationReport report = validate(tree);
        Map<String, Object> cleaned = TreeValues.deepCopyMap(tree);
        cleaned.remove("_extraction_metadata");
        cleaned.remove(NormalizedForm.PROVENANCE_KEY);

        coercePainLevels(cleaned);
        trimStrings(cleaned);
        coerceBooleanGroups(cleaned);

        Provenance provenance = new Provenance(PROCESSOR, VALIDATION_METHOD, Instant.now(clock),
                report.errors(), report.requiredFieldsPresent());

        if (report.isClean()) {
            log.info("[Normalize] MNR tree valid (fields={})", cleaned.size());
        } else {
            log.warn("[Normalize] MNR tree has {} validation issue(s) (requiredPresent={})",
                    report.errors().size(), report.requiredFieldsPresent());
        }
        return new NormalizedForm(cleaned, provenance);
    }

    private static boolean validateRequiredFields(Map<String, Object> data, List<String> errors) {
        boolean ok = true;
        for (String field : MnrSchema.REQUIRED_FIELDS) {
            if (!TreeValues.isTruthy(data.get(field))) {
                errors.add("Missing required field: " + field);
                ok = false;
            }
        }
        return ok;
    }

    private static void validateFieldTypes(Map<String, Object> data, List<String> errors) {
        for (Map.Entry<String, FieldType> e : MnrSchema.fieldTypes().entrySet()) {
            Object value = data.get(e.getKey());
            if (value != null && !e.getValue().accepts(value)) {
                errors.add("Invalid type for " + e.getKey() + ": expected " + e.getValue()
                        + ", got " + value.getClass().getSimpleName());
            }
        }
    }

    private static void validatePainLevels(Map<String, Object> data, List<String> errors) {
        Map<String, Object> pain = TreeValues.asMap(data.get(MnrSchema.PAIN_LEVEL));
        if (pain == null) return;
        for (Map.Entry<String, Object> e : pain.entrySet()) {
            Object value = e.getValue();
            if (TreeValues.isTruthy(value) && !TreeValues.display(value).endsWith("/10")) {
                errors.add("Pain level " + e.getKey() + " should be in 'N/10' format, got: " + TreeValues.display(value));
            }
        }
    }

    private static void validateHeightWeight(Map<String, Object> data, List<String> errors) {
        Map<String, Object> height = TreeValues.asMap(data.get(MnrSchema.HEIGHT));
        if (height != null) {
            Object feet = height.get("feet");
            if (feet != null && !isIntegralInRange(feet, 0, 10)) {
                errors.add("Invalid height feet: " + TreeValues.display(feet) + " (should be 0-10)");
            }
            Object inches = height.get("inches");
            if (inches != null && !isIntegralInRange(inches, 0, 11)) {
                errors.add("Invalid height inches: " + TreeValues.display(inches) + " (should be 0-11)");
            }
        }

        Object weight = data.get(MnrSchema.WEIGHT_LBS);
        if (weight != null) {
            if (!isIntegralInRange(weight, 0, 1000)) {
                errors.add("Invalid weight: " + TreeValues.display(weight) + " (should be 0-1000 lbs)");
            }
        }
    }

    private static void validateActivities(Map<String, Object> data, List<String> errors) {
        Object raw = data.get(MnrSchema.ACTIVITIES_MONITORED);
        if (!(raw instanceof List<?> activities)) return;
        for (int i = 0; i < activities.size(); i++) {
            Map<String, Object> activity = TreeValues.asMap(activities.get(i));
            if (activity == null) {
                errors.add("Activity " + i + " should be an object");
                continue;
            }
            for (String key : MnrSchema.ACTIVITY_KEYS) {
                if (!activity.containsKey(key)) {
                    errors.add("Activity " + i + " missing field: " + key);
                }
            }
        }
    }

    private static boolean isIntegralInRange(Object value, long min, long max) {
        if (value instanceof BigInteger big && big.bitLength() >= Long.SIZE) {
            return false;
        }
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger)) {
            return false;
        }
        long v = ((Number) value).longValue();
        return v >= min && v <= max;
    }

    private static void coercePainLevels(Map<String, Object> data) {
        Map<String, Object> pain = TreeValues.asMap(data.get(MnrSchema.PAIN_LEVEL));
        if (pain == null) return;
        for (Map.Entry<String, Object> e : pain.entrySet()) {
            Object value = e.getValue();
            if (!TreeValues.isTruthy(value)) continue;
            String text = TreeValues.display(value).trim();
            if (text.endsWith("/10")) continue;
            Integer number = leadingInteger(text);
            if (number != null) {
                e.setValue(number + "/10");
            }
        }
    }

    /**
     * "7" and "7/ten" give 7; "seven" gives null.
     */
    private static Integer leadingInteger(String text) {
        String head = text.split("/", 2)[0].trim();
        try {
            return Integer.parseInt(head);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void trimStrings(Map<String, Object> data) {
        for (String field : MnrSchema.STRING_FIELDS) {
            Object value = data.get(field);
            if (TreeValues.isTruthy(value) && !(value instanceof Map) && !(value instanceof List)) {
                data.put(field, TreeValues.display(value).trim());
            }
        }
    }

    private static void coerceBooleanGroups(Map<String, Object> data) {
        for (String group : MnrSchema.BOOLEAN_GROUPS) {
            Map<String, Object> flags = TreeValues.asMap(data.get(group));
            if (flags == null) continue;
            for (Map.Entry<String, Object> e : flags.entrySet()) {
                Object value = e.getValue();
                if (value instanceof Boolean || MnrSchema.GROUP_VALUE_KEYS.contains(e.getKey())) continue;
                if (isTrueToken(value)) {
                    e.setValue(Boolean.TRUE);
                } else if (isFalseToken(value)) {
                    e.setValue(Boolean.FALSE);
                }
            }
        }
    }

    private static boolean isTrueToken(Object value) {
        if (value instanceof Number n) return n.doubleValue() == 1d;
        return "true".equals(value) || "True".equals(value) || "1".equals(value);
    }

    private static boolean isFalseToken(Object value) {
        if (value instanceof Number n) return n.doubleValue() == 0d;
        return "false".equals(value) || "False".equals(value) || "0".equals(value);
    }
}
