package com.medform.backend.services.forms.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.medform.backend.services.forms.schema.MnrSchema;
import com.medform.backend.services.util.TreeValues;

/**
 * Deterministic join rules shared by both form projections.
 */
final class FlattenRules {

    private FlattenRules() {
    }

    static String scalar(Object value) {
        if (!TreeValues.isTruthy(value) || value instanceof Map || value instanceof List) return null;
        return TreeValues.display(value);
    }

    /**
     * {@code feet'inches"}; null when both parts are empty.
     */
    static String height(Object raw) {
        Map<String, Object> h = TreeValues.asMap(raw);
        if (h == null) return null;
        Object feet = h.get("feet");
        Object inches = h.get("inches");
        if (!TreeValues.isTruthy(feet) && !TreeValues.isTruthy(inches)) return null;
        return TreeValues.display(feet) + "'" + TreeValues.display(inches) + "\"";
    }

    static String weight(Object raw) {
        String w = scalar(raw);
        return w == null ? null : w + " lbs";
    }

    static String bloodPressure(Object raw) {
        Map<String, Object> bp = TreeValues.asMap(raw);
        if (bp == null) return null;
        Object systolic = bp.get("systolic");
        Object diastolic = bp.get("diastolic");
        if (!TreeValues.isTruthy(systolic) && !TreeValues.isTruthy(diastolic)) return null;
        return TreeValues.display(systolic) + "/" + TreeValues.display(diastolic);
    }

    /**
     * Keys whose value is exactly {@code true}, underscores shown as spaces, in tree order.
     */
    static List<String> trueKeys(Object raw, boolean humanize) {
        Map<String, Object> group = TreeValues.asMap(raw);
        List<String> keys = new ArrayList<>();
        if (group == null) return keys;
        for (Map.Entry<String, Object> e : group.entrySet()) {
            if (Boolean.TRUE.equals(e.getValue())) {
                keys.add(humanize ? e.getKey().replace('_', ' ') : e.getKey());
            }
        }
        return keys;
    }

    /**
     * Comma-joined true flags plus an optional trailing "{label}: text" clause from {@code textKey}.
     */
    static String flags(Object raw, String textKey, String label) {
        List<String> parts = trueKeys(raw, true);
        Map<String, Object> group = TreeValues.asMap(raw);
        if (group != null && textKey != null) {
            String text = scalar(group.get(textKey));
            if (text != null) {
                parts.add(label + ": " + text);
            }
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    /**
     * "Yes: explanation", "Yes" or "No"; null when neither box is ticked.
     */
    static String yesNo(Object raw, String explainKey) {
        Map<String, Object> group = TreeValues.asMap(raw);
        if (group == null) return null;
        if (TreeValues.isTruthy(group.get("Yes"))) {
            String explain = scalar(group.get(explainKey));
            return explain == null ? "Yes" : "Yes: " + explain;
        }
        if (TreeValues.isTruthy(group.get("No"))) return "No";
        return null;
    }

    static String pregnant(Object raw) {
        Map<String, Object> group = TreeValues.asMap(raw);
        if (group == null) return null;
        if (TreeValues.isTruthy(group.get("Yes"))) {
            StringBuilder sb = new StringBuilder("Yes");
            String weeks = scalar(group.get("Weeks"));
            if (weeks != null) sb.append(", ").append(weeks).append(" weeks");
            String physician = scalar(group.get("Physician"));
            if (physician != null) sb.append(", Physician: ").append(physician);
            return sb.toString();
        }
        if (TreeValues.isTruthy(group.get("No"))) return "No";
        return null;
    }

    static String reliefDuration(Object raw) {
        Map<String, Object> relief = TreeValues.asMap(raw);
        if (relief == null) return null;
        List<String> parts = new ArrayList<>();
        if (TreeValues.isTruthy(relief.get("Hours"))) {
            String n = scalar(relief.get("Hours_Number"));
            parts.add(n != null ? n + " hours" : "Hours");
        }
        if (TreeValues.isTruthy(relief.get("Days"))) {
            String n = scalar(relief.get("Days_Number"));
            parts.add(n != null ? n + " days" : "Days");
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    /**
     * The ticked percentage bucket(s), keys verbatim.
     */
    static String bucket(Object raw) {
        List<String> keys = trueKeys(raw, false);
        return keys.isEmpty() ? null : String.join(", ", keys);
    }

    /**
     * "Activity: X | Measurement: Y | Change: Z" per entry, entries joined by "; ".
     */
    static String activities(Object raw) {
        List<String> segments = activitySegments(raw);
        return segments.isEmpty() ? null : String.join("; ", segments);
    }

    static List<String> activitySegments(Object raw) {
        List<String> segments = new ArrayList<>();
        if (!(raw instanceof List<?> list)) return segments;
        for (Object item : list) {
            Map<String, Object> activity = TreeValues.asMap(item);
            if (activity == null) continue;
            List<String> parts = new ArrayList<>();
            String name = scalar(activity.get(MnrSchema.ACTIVITY));
            if (name != null) parts.add("Activity: " + name);
            String measurement = scalar(activity.get(MnrSchema.MEASUREMENT));
            if (measurement != null) parts.add("Measurement: " + measurement);
            String change = scalar(activity.get(MnrSchema.HOW_HAS_CHANGED));
            if (change != null) parts.add("Change: " + change);
            if (!parts.isEmpty()) segments.add(String.join(" | ", parts));
        }
        return segments;
    }

    static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isEmpty()) {
            target.put(key, value);
        }
    }
}
