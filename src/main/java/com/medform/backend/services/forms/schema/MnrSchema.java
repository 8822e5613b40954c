package com.medform.backend.services.forms.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Source-form ("MNR") field set: names, declared types and the blank skeleton the
 * vision extractor is asked to fill.
 */
public final class MnrSchema {

    public static final String PRIMARY_CARE_PHYSICIAN = "Primary_Care_Physician";
    public static final String PHYSICIAN_PHONE = "Physician_Phone";
    public static final String EMPLOYER = "Employer";
    public static final String JOB_DESCRIPTION = "Job_Description";
    public static final String UNDER_PHYSICIAN_CARE = "Under_Physician_Care";
    public static final String CURRENT_HEALTH_PROBLEMS = "Current_Health_Problems";
    public static final String WHEN_BEGAN = "When_Began";
    public static final String HOW_HAPPENED = "How_Happened";
    public static final String TREATMENT_RECEIVED = "Treatment_Received";
    public static final String SYMPTOMS_PERCENTAGE = "Symptoms_Past_Week_Percentage";
    public static final String PAIN_LEVEL = "Pain_Level";
    public static final String DAILY_ACTIVITY_INTERFERENCE = "Daily_Activity_Interference";
    public static final String NEW_COMPLAINTS = "New_Complaints";
    public static final String RE_INJURIES = "Re_Injuries";
    public static final String HELPFUL_TREATMENTS = "Helpful_Treatments";
    public static final String ACTIVITIES_MONITORED = "Activities_Monitored";
    public static final String PAIN_MEDICATION = "Pain_Medication";
    public static final String HEALTH_HISTORY = "Health_History";
    public static final String PAIN_QUALITY = "Pain_Quality";
    public static final String PROGRESS_SINCE_ACUPUNCTURE = "Progress_Since_Acupuncture";
    public static final String RELIEF_DURATION = "Relief_Duration";
    public static final String UPCOMING_TREATMENT_COURSE = "Upcoming_Treatment_Course";
    public static final String HEIGHT = "Height";
    public static final String WEIGHT_LBS = "Weight_lbs";
    public static final String BLOOD_PRESSURE = "Blood_Pressure";
    public static final String PREGNANT = "Pregnant";
    public static final String DATE = "Date";
    public static final String SIGNATURE = "Signature";

    public static final String PAIN_AVERAGE = "Average_Past_Week";
    public static final String PAIN_WORST = "Worst_Past_Week";
    public static final String PAIN_CURRENT = "Current";

    public static final String ACTIVITY = "Activity";
    public static final String MEASUREMENT = "Measurement";
    public static final String HOW_HAS_CHANGED = "How_has_changed";

    public static final List<String> REQUIRED_FIELDS = List.of(
            PRIMARY_CARE_PHYSICIAN, CURRENT_HEALTH_PROBLEMS, PAIN_LEVEL);

    public static final List<String> ACTIVITY_KEYS = List.of(ACTIVITY, MEASUREMENT, HOW_HAS_CHANGED);

    public static final List<String> PAIN_KEYS = List.of(PAIN_AVERAGE, PAIN_WORST, PAIN_CURRENT);

    /**
     * Trimmed during normalization.
     */
    public static final List<String> STRING_FIELDS = List.of(
            PRIMARY_CARE_PHYSICIAN, PHYSICIAN_PHONE, EMPLOYER, CURRENT_HEALTH_PROBLEMS,
            WHEN_BEGAN, HOW_HAPPENED, PAIN_MEDICATION, HEALTH_HISTORY);

    /**
     * Objects whose flag values are coerced to real booleans.
     */
    public static final List<String> BOOLEAN_GROUPS = List.of(
            UNDER_PHYSICIAN_CARE, TREATMENT_RECEIVED, NEW_COMPLAINTS, RE_INJURIES,
            HELPFUL_TREATMENTS, PAIN_QUALITY, PROGRESS_SINCE_ACUPUNCTURE, RELIEF_DURATION,
            UPCOMING_TREATMENT_COURSE, PREGNANT);

    /**
     * Members of boolean groups that carry text or numbers rather than a flag.
     */
    public static final Set<String> GROUP_VALUE_KEYS = Set.of(
            "Conditions", "Explain", "Other", "Hours_Number", "Days_Number",
            "Out_of_Town_Dates", "Weeks", "Physician");

    public static final List<String> TREATMENT_FLAGS = List.of(
            "Surgery", "Medications", "Physical_Therapy", "Chiropractic", "Massage", "Injections");

    public static final List<String> SYMPTOM_BUCKETS = List.of(
            "0-10%", "11-20%", "21-30%", "31-40%", "41-50%",
            "51-60%", "61-70%", "71-80%", "81-90%", "91-100%");

    public static final List<String> HELPFUL_TREATMENT_FLAGS = List.of(
            "Acupuncture", "Chinese_Herbs", "Massage_Therapy", "Nutritional_Supplements",
            "Prescription_Medications", "Physical_Therapy", "Rehab_Home_Care",
            "Spinal_Adjustment_Manipulation");

    public static final List<String> PAIN_QUALITY_FLAGS = List.of(
            "Sharp", "Throbbing", "Ache", "Burning", "Numb", "Tingling");

    public static final List<String> PROGRESS_FLAGS = List.of("Excellent", "Good", "Fair", "Poor", "Worse");

    private static final Map<String, FieldType> FIELD_TYPES;

    static {
        Map<String, FieldType> types = new LinkedHashMap<>();
        types.put(PRIMARY_CARE_PHYSICIAN, FieldType.TEXT);
        types.put(PHYSICIAN_PHONE, FieldType.TEXT);
        types.put(EMPLOYER, FieldType.TEXT);
        types.put(JOB_DESCRIPTION, FieldType.TEXT);
        types.put(UNDER_PHYSICIAN_CARE, FieldType.OBJECT);
        types.put(CURRENT_HEALTH_PROBLEMS, FieldType.TEXT);
        types.put(WHEN_BEGAN, FieldType.TEXT);
        types.put(HOW_HAPPENED, FieldType.TEXT);
        types.put(HEALTH_HISTORY, FieldType.TEXT);
        types.put(TREATMENT_RECEIVED, FieldType.OBJECT);
        types.put(HELPFUL_TREATMENTS, FieldType.OBJECT);
        types.put(PROGRESS_SINCE_ACUPUNCTURE, FieldType.OBJECT);
        types.put(RELIEF_DURATION, FieldType.OBJECT);
        types.put(UPCOMING_TREATMENT_COURSE, FieldType.OBJECT);
        types.put(PAIN_LEVEL, FieldType.OBJECT);
        types.put(PAIN_MEDICATION, FieldType.TEXT);
        types.put(PAIN_QUALITY, FieldType.OBJECT);
        types.put(DAILY_ACTIVITY_INTERFERENCE, FieldType.TEXT_OR_NUMBER);
        types.put(HEIGHT, FieldType.OBJECT);
        types.put(WEIGHT_LBS, FieldType.NUMBER);
        types.put(BLOOD_PRESSURE, FieldType.OBJECT);
        types.put(ACTIVITIES_MONITORED, FieldType.LIST);
        types.put(SYMPTOMS_PERCENTAGE, FieldType.OBJECT);
        types.put(PREGNANT, FieldType.OBJECT);
        types.put(NEW_COMPLAINTS, FieldType.OBJECT);
        types.put(RE_INJURIES, FieldType.OBJECT);
        types.put(DATE, FieldType.TEXT);
        types.put(SIGNATURE, FieldType.TEXT);
        FIELD_TYPES = Collections.unmodifiableMap(types);
    }

    private MnrSchema() {
    }

    public static Map<String, FieldType> fieldTypes() {
        return FIELD_TYPES;
    }

    /**
     * Blank tree with every key the extractors may produce, in form order.
     */
    public static Map<String, Object> skeleton() {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put(PRIMARY_CARE_PHYSICIAN, null);
        s.put(PHYSICIAN_PHONE, null);
        s.put(EMPLOYER, null);
        s.put(JOB_DESCRIPTION, null);
        s.put(UNDER_PHYSICIAN_CARE, yesNo("Conditions"));
        s.put(CURRENT_HEALTH_PROBLEMS, null);
        s.put(WHEN_BEGAN, null);
        s.put(HOW_HAPPENED, null);
        s.put(TREATMENT_RECEIVED, flags(TREATMENT_FLAGS, "Other"));
        s.put(SYMPTOMS_PERCENTAGE, flags(SYMPTOM_BUCKETS, null));
        Map<String, Object> pain = new LinkedHashMap<>();
        for (String key : PAIN_KEYS) pain.put(key, null);
        s.put(PAIN_LEVEL, pain);
        s.put(DAILY_ACTIVITY_INTERFERENCE, null);
        s.put(NEW_COMPLAINTS, yesNo("Explain"));
        s.put(RE_INJURIES, yesNo("Explain"));
        s.put(HELPFUL_TREATMENTS, flags(HELPFUL_TREATMENT_FLAGS, "Other"));
        Map<String, Object> activity = new LinkedHashMap<>();
        for (String key : ACTIVITY_KEYS) activity.put(key, null);
        List<Object> activities = new ArrayList<>();
        activities.add(activity);
        s.put(ACTIVITIES_MONITORED, activities);
        s.put(PAIN_MEDICATION, null);
        s.put(HEALTH_HISTORY, null);
        s.put(PAIN_QUALITY, flags(PAIN_QUALITY_FLAGS, null));
        s.put(PROGRESS_SINCE_ACUPUNCTURE, flags(PROGRESS_FLAGS, null));
        Map<String, Object> relief = new LinkedHashMap<>();
        relief.put("Hours", false);
        relief.put("Hours_Number", null);
        relief.put("Days", false);
        relief.put("Days_Number", null);
        s.put(RELIEF_DURATION, relief);
        Map<String, Object> course = flags(List.of("1_per_week", "2_per_week"), null);
        course.put("Out_of_Town_Dates", null);
        s.put(UPCOMING_TREATMENT_COURSE, course);
        Map<String, Object> height = new LinkedHashMap<>();
        height.put("feet", null);
        height.put("inches", null);
        s.put(HEIGHT, height);
        s.put(WEIGHT_LBS, null);
        Map<String, Object> bp = new LinkedHashMap<>();
        bp.put("systolic", null);
        bp.put("diastolic", null);
        s.put(BLOOD_PRESSURE, bp);
        Map<String, Object> pregnant = yesNo(null);
        pregnant.put("Weeks", null);
        pregnant.put("Physician", null);
        s.put(PREGNANT, pregnant);
        s.put(DATE, null);
        s.put(SIGNATURE, null);
        return s;
    }

    private static Map<String, Object> yesNo(String textKey) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("No", false);
        m.put("Yes", false);
        if (textKey != null) m.put(textKey, null);
        return m;
    }

    private static Map<String, Object> flags(List<String> keys, String otherKey) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (String key : keys) m.put(key, false);
        if (otherKey != null) m.put(otherKey, null);
        return m;
    }
}
