package com.medform.backend.services.extraction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.medform.backend.services.forms.schema.MnrSchema;

/**
 * Regex rules that turn raw OCR text into the MNR tree. A rule that does not match
 * leaves its field null; parsing never fails.
 */
final class MnrTextParser {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Rule> TEXT_RULES = List.of(
            new Rule(MnrSchema.PRIMARY_CARE_PHYSICIAN, Pattern.compile("Primary Care Physician[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.PHYSICIAN_PHONE, Pattern.compile("(?:Phone|Tel)[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.EMPLOYER, Pattern.compile("Employer[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.CURRENT_HEALTH_PROBLEMS, Pattern.compile("current health problem[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.WHEN_BEGAN, Pattern.compile("When.*began[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.HOW_HAPPENED, Pattern.compile("How.*happened[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.PAIN_MEDICATION, Pattern.compile("Pain Medication[:\\s]*([^\\n]+)", FLAGS)),
            new Rule(MnrSchema.DATE, Pattern.compile("Date[:\\s]*([^\\n]+)", FLAGS))
    );

    private static final List<Rule> PAIN_RULES = List.of(
            new Rule(MnrSchema.PAIN_AVERAGE, Pattern.compile("Average.*?(\\d+)(?:/10)?", FLAGS)),
            new Rule(MnrSchema.PAIN_WORST, Pattern.compile("Worst.*?(\\d+)(?:/10)?", FLAGS)),
            new Rule(MnrSchema.PAIN_CURRENT, Pattern.compile("Current.*?(\\d+)(?:/10)?", FLAGS))
    );

    private static final Pattern HEIGHT = Pattern.compile("Height[:\\s]*(\\d+)['\"]*\\s*(\\d+)", FLAGS);
    private static final Pattern WEIGHT = Pattern.compile("Weight[:\\s]*(\\d+)", FLAGS);

    private MnrTextParser() {
    }

    static Map<String, Object> parse(String text) {
        String source = text == null ? "" : text;
        Map<String, Object> data = new LinkedHashMap<>();

        for (Rule rule : TEXT_RULES) {
            Matcher m = rule.pattern().matcher(source);
            String value = m.find() ? m.group(1).trim() : null;
            data.put(rule.field(), value == null || value.isEmpty() ? null : value);
        }

        Map<String, Object> pain = new LinkedHashMap<>();
        for (Rule rule : PAIN_RULES) {
            Matcher m = rule.pattern().matcher(source);
            if (m.find()) {
                pain.put(rule.field(), m.group(1) + "/10");
            }
        }
        data.put(MnrSchema.PAIN_LEVEL, pain.isEmpty() ? null : pain);

        Matcher height = HEIGHT.matcher(source);
        Integer feet = null;
        Integer inches = null;
        if (height.find()) {
            feet = parseCount(height.group(1));
            inches = parseCount(height.group(2));
        }
        if (feet != null && inches != null) {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("feet", feet);
            h.put("inches", inches);
            data.put(MnrSchema.HEIGHT, h);
        } else {
            data.put(MnrSchema.HEIGHT, null);
        }

        Matcher weight = WEIGHT.matcher(source);
        data.put(MnrSchema.WEIGHT_LBS, weight.find() ? parseCount(weight.group(1)) : null);

        Map<String, Object> treatments = new LinkedHashMap<>();
        for (String flag : MnrSchema.TREATMENT_FLAGS) {
            Pattern checked = Pattern.compile(Pattern.quote(flag) + "[\\s\\[\\]]*[Xx✓✗]", FLAGS);
            treatments.put(flag, checked.matcher(source).find());
        }
        data.put(MnrSchema.TREATMENT_RECEIVED, treatments);

        return data;
    }

    // digit runs past int range count as unreadable
    private static Integer parseCount(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record Rule(String field, Pattern pattern) {
    }
}
