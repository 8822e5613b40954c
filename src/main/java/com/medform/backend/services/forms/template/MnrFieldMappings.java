package com.medform.backend.services.forms.template;

import java.util.List;
import java.util.Map;

import com.medform.backend.services.forms.schema.MnrSchema;

/**
 * Overlay anchors on the MNR template. The form carries no AcroForm fields, so every entry is
 * anchor-only. Checkbox members are keyed {@code Group.Flag}, pain scales {@code Pain_Level.Key}.
 */
public final class MnrFieldMappings {

    public static final String CHECK_MARK = "X";

    private static final Map<String, List<String>> TREATMENT_TERMS = Map.of(
            "Surgery", List.of("Surgery"),
            "Medications", List.of("Medications", "Medication"),
            "Physical_Therapy", List.of("Physical Therapy", "PT"),
            "Chiropractic", List.of("Chiropractic"),
            "Massage", List.of("Massage"),
            "Injections", List.of("Injections", "Injection"));

    private static final Map<String, List<String>> HELPFUL_TERMS = Map.of(
            "Acupuncture", List.of("Acupuncture"),
            "Chinese_Herbs", List.of("Chinese Herbs"),
            "Massage_Therapy", List.of("Massage Therapy"),
            "Nutritional_Supplements", List.of("Nutritional Supplements"),
            "Prescription_Medications", List.of("Prescription Medication"),
            "Physical_Therapy", List.of("Physical Therapy"),
            "Rehab_Home_Care", List.of("Rehab/Home Care", "Rehab"),
            "Spinal_Adjustment_Manipulation", List.of("Spinal Adjustment"));

    private static final FieldMappingTable TABLE = build();

    private MnrFieldMappings() {
    }

    public static FieldMappingTable table() {
        return TABLE;
    }

    public static String painKey(String key) {
        return memberKey(MnrSchema.PAIN_LEVEL, key);
    }

    public static String memberKey(String group, String member) {
        return group + "." + member;
    }

    private static FieldMappingTable build() {
        FieldMappingTable.Builder b = FieldMappingTable.builder("MNR")
                .anchored(MnrSchema.PRIMARY_CARE_PHYSICIAN, AnchorSpec.text("Primary Care Physician", "Primary care physician"))
                .anchored(MnrSchema.PHYSICIAN_PHONE, AnchorSpec.text("Physician Phone", "Phone"))
                .anchored(MnrSchema.EMPLOYER, AnchorSpec.text("Employer"))
                .anchored(MnrSchema.JOB_DESCRIPTION, AnchorSpec.text("Job Description", "Job Title"))
                .anchored(MnrSchema.CURRENT_HEALTH_PROBLEMS,
                        AnchorSpec.multiline("current health problem", "Current health problems"))
                .anchored(MnrSchema.WHEN_BEGAN, AnchorSpec.text("When it began?", "When began"))
                .anchored(MnrSchema.HOW_HAPPENED, AnchorSpec.multiline("How it happened?", "How happened"))
                .anchored(MnrSchema.PAIN_MEDICATION,
                        new AnchorSpec(List.of("Pain Medication (Name, Dosage, Frequency)", "Pain Medication"),
                                5f, AnchorSpec.MULTILINE_FONT_SIZE, true, AnchorSide.RIGHT))
                .anchored(MnrSchema.HEALTH_HISTORY, AnchorSpec.multiline("Pertinent Health history", "Health History"))
                .anchored(MnrSchema.DATE, AnchorSpec.text("DATE", "Today's Date"))
                .anchored(MnrSchema.SIGNATURE, AnchorSpec.text("SIGNATURE:", "Signature"))
                .anchored(MnrSchema.DAILY_ACTIVITY_INTERFERENCE,
                        AnchorSpec.multiline("How has it interfered with your daily activity"))
                .anchored(MnrSchema.HEIGHT, AnchorSpec.text(5f, "Height"))
                .anchored(MnrSchema.WEIGHT_LBS, AnchorSpec.text(5f, "Weight"))
                .anchored(MnrSchema.BLOOD_PRESSURE, AnchorSpec.text(5f, "Blood Pressure"))
                .anchored(painKey(MnrSchema.PAIN_AVERAGE),
                        AnchorSpec.text("Average Pain Level in the past week", "Average pain"))
                .anchored(painKey(MnrSchema.PAIN_WORST),
                        AnchorSpec.text("Worse Pain Level in the past week", "Worst pain"))
                .anchored(painKey(MnrSchema.PAIN_CURRENT), AnchorSpec.text("Current Pain Level", "Current pain"))
                .anchored(MnrSchema.UNDER_PHYSICIAN_CARE, AnchorSpec.text("Under physician care", "physician's care"))
                .anchored(MnrSchema.NEW_COMPLAINTS, AnchorSpec.text("new complaints", "New Complaints"))
                .anchored(MnrSchema.RE_INJURIES, AnchorSpec.text("re-injuries", "Re-injuries", "Re-Injuries"))
                .anchored(MnrSchema.RELIEF_DURATION, AnchorSpec.text("How long does relief last", "relief last"))
                .anchored(MnrSchema.UPCOMING_TREATMENT_COURSE,
                        AnchorSpec.text("upcoming course of treatment", "Upcoming Treatment"))
                .anchored(MnrSchema.PREGNANT, AnchorSpec.text("pregnant", "Pregnant"))
                .anchored(MnrSchema.ACTIVITIES_MONITORED, AnchorSpec.multiline("Activities", "Activity"))
                .anchored(memberKey(MnrSchema.TREATMENT_RECEIVED, "Other"), AnchorSpec.text(5f, "Other"));

        for (String flag : MnrSchema.TREATMENT_FLAGS) {
            b.anchored(memberKey(MnrSchema.TREATMENT_RECEIVED, flag),
                    new AnchorSpec(TREATMENT_TERMS.get(flag), AnchorSpec.DEFAULT_OFFSET,
                            AnchorSpec.DEFAULT_FONT_SIZE, false, AnchorSide.LEFT_MARK));
        }
        for (String bucket : MnrSchema.SYMPTOM_BUCKETS) {
            b.anchored(memberKey(MnrSchema.SYMPTOMS_PERCENTAGE, bucket), AnchorSpec.mark(AnchorSide.RIGHT, bucket));
        }
        for (String flag : MnrSchema.HELPFUL_TREATMENT_FLAGS) {
            b.anchored(memberKey(MnrSchema.HELPFUL_TREATMENTS, flag),
                    new AnchorSpec(HELPFUL_TERMS.get(flag), AnchorSpec.DEFAULT_OFFSET,
                            AnchorSpec.DEFAULT_FONT_SIZE, false, AnchorSide.RIGHT));
        }
        for (String flag : MnrSchema.PAIN_QUALITY_FLAGS) {
            b.anchored(memberKey(MnrSchema.PAIN_QUALITY, flag), AnchorSpec.mark(AnchorSide.RIGHT, flag));
        }
        for (String flag : MnrSchema.PROGRESS_FLAGS) {
            b.anchored(memberKey(MnrSchema.PROGRESS_SINCE_ACUPUNCTURE, flag), AnchorSpec.mark(AnchorSide.RIGHT, flag));
        }
        return b.build();
    }
}
