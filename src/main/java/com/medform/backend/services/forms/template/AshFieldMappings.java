package com.medform.backend.services.forms.template;

import java.util.List;

import com.medform.backend.services.forms.schema.AshSchema;

/**
 * Native AcroForm field names and overlay anchors for the ASH clinical form.
 */
public final class AshFieldMappings {

    public static final List<String> ACTIVITY_FIELDS = List.of("Activity#0", "Activity#1");
    public static final List<String> MEASUREMENT_FIELDS = List.of("Measurements", "Measurements#1");
    public static final List<String> CHANGE_FIELDS = List.of("How has it changed?", "How has it changed?#1");

    private static final FieldMappingTable TABLE = FieldMappingTable.builder("ASH")
            .field(AshSchema.PATIENT_NAME, List.of("Patient Name"), AnchorSpec.text("Patient Name"))
            .field(AshSchema.PATIENT_DOB, List.of("Birthdate"), AnchorSpec.text("Birthdate", "Date of Birth"))
            .field(AshSchema.PATIENT_PHONE, List.of("Patient Phone number"), AnchorSpec.text("Patient Phone"))
            .field(AshSchema.PATIENT_ADDRESS, List.of("Address"), AnchorSpec.text("Address"))
            .field(AshSchema.EMPLOYER, List.of("Employer"), AnchorSpec.text("Employer"))
            .field(AshSchema.JOB_DESCRIPTION, List.of("Group"), AnchorSpec.text("Job Description", "Group"))
            .field(AshSchema.PRIMARY_CARE_PHYSICIAN, List.of("PCP Name"),
                    AnchorSpec.text("Primary Care Physician", "PCP Name"))
            .field(AshSchema.PHYSICIAN_PHONE, List.of("PCP Phone number", "Area code for PCP phone number"),
                    AnchorSpec.text("PCP Phone", "Physician Phone"))
            .field(AshSchema.HEALTH_PROBLEMS,
                    List.of("Chief Complaint(s)", "Condition 1", "Chief Complaint(s) 2", "Chief Complaint(s) 3"),
                    AnchorSpec.multiline("Chief Complaint", "Health Problems"))
            .field(AshSchema.CURRENT_PAIN, List.of("Pain Level"), AnchorSpec.text("Current Pain", "Pain Level"))
            .field(AshSchema.AVERAGE_PAIN, List.of("Pain Level 2"), AnchorSpec.text("Average Pain"))
            .field(AshSchema.WORST_PAIN, List.of("Pain Level 3"), AnchorSpec.text("Worst Pain"))
            .field(AshSchema.WHEN_BEGAN, List.of("Date", "Date 2", "Date 3"), AnchorSpec.text("When began", "Onset"))
            .field(AshSchema.HOW_HAPPENED,
                    List.of("Cause of Condition/Injury", "Cause of Condition/Injury 2", "Cause of Condition/Injury 3"),
                    AnchorSpec.multiline("Cause of Condition", "How happened"))
            .field(AshSchema.HEIGHT, List.of("Height"), AnchorSpec.text(5f, "Height"))
            .field(AshSchema.WEIGHT, List.of("Weight"), AnchorSpec.text(5f, "Weight"))
            .field(AshSchema.BLOOD_PRESSURE, List.of("Blood Pressure", "Blood Pressure 2"),
                    AnchorSpec.text(5f, "Blood Pressure"))
            .field(AshSchema.PAIN_MEDICATION,
                    List.of("Changes in Pain Medication Use eg name frequency amount dosage"),
                    AnchorSpec.multiline("Pain Medication", "Medication Use"))
            .field(AshSchema.TREATMENTS_RECEIVED,
                    List.of("Other Comments eg Responses to Care Barriers to Progress Patient Health History 1"),
                    AnchorSpec.multiline("Treatments Received", "Previous Treatment"))
            .field(AshSchema.HELPFUL_TREATMENTS,
                    List.of("Other Comments eg Responses to Care Barriers to Progress Patient Health History 2"),
                    AnchorSpec.multiline("Helpful Treatments", "Responses to Care"))
            .field(AshSchema.HEALTH_HISTORY, List.of(), AnchorSpec.multiline("Health History", "Medical History"))
            .field(AshSchema.ACTIVITIES_MONITORED,
                    List.of("Activity#0", "Activity#1", "Measurements", "Measurements#1",
                            "How has it changed?", "How has it changed?#1"),
                    AnchorSpec.multiline("Activities", "Activity"))
            .field(AshSchema.DAILY_ACTIVITY_INTERFERENCE, List.of("Frequency"),
                    AnchorSpec.multiline("Daily Activity", "Frequency"))
            .field(AshSchema.PAIN_QUALITY, List.of("Observation", "Observation 2", "Observation 3"),
                    AnchorSpec.text("Observation", "Pain Quality"))
            .field(AshSchema.PROGRESS_SINCE_ACUPUNCTURE, List.of("Response to most recent Treatment Plan"),
                    AnchorSpec.text("Response to most recent Treatment Plan", "Progress"))
            .field(AshSchema.RELIEF_DURATION,
                    List.of("How long does relief last?", "How long does relief last? 2", "How long does relief last? 3"),
                    AnchorSpec.text("How long does relief last"))
            .field(AshSchema.SYMPTOMS_PERCENTAGE, List.of("Frequency 2", "Frequency 3"),
                    AnchorSpec.text("Symptoms", "Percentage"))
            .field(AshSchema.PREGNANT, List.of("# of weeks pregnant"), AnchorSpec.text("weeks pregnant", "Pregnant"))
            .field(AshSchema.NEW_COMPLAINTS, List.of("Treatment Goals"), AnchorSpec.multiline("Treatment Goals"))
            .field(AshSchema.RE_INJURIES, List.of("How will you measure progress toward these goals"),
                    AnchorSpec.multiline("measure progress", "Re-injuries"))
            .field(AshSchema.UPCOMING_TREATMENT_COURSE, List.of("Total  of Therapies for Requested Dates"),
                    AnchorSpec.text("Requested Dates", "Upcoming Treatment"))
            .field(AshSchema.UNDER_PHYSICIAN_CARE, List.of(),
                    AnchorSpec.text("Under Physician Care", "Under physician care"))
            .field(AshSchema.DATE, List.of("Date of Signature"), AnchorSpec.text("Date of Signature", "DATE"))
            .field(AshSchema.SIGNATURE, List.of(), AnchorSpec.text("Signature", "SIGNATURE:"))
            .field(AshSchema.CLINIC_NAME, List.of("Clinic Name"), AnchorSpec.text("Clinic Name"))
            .field(AshSchema.TREATING_PRACTITIONER, List.of("Treating Practitioner"),
                    AnchorSpec.text("Treating Practitioner"))
            .build();

    private AshFieldMappings() {
    }

    public static FieldMappingTable table() {
        return TABLE;
    }

    /**
     * Activity slot index for one of the per-entry activity fields, or -1.
     */
    public static int activitySlot(String pdfFieldName) {
        int i = ACTIVITY_FIELDS.indexOf(pdfFieldName);
        if (i >= 0) return i;
        i = MEASUREMENT_FIELDS.indexOf(pdfFieldName);
        if (i >= 0) return i;
        return CHANGE_FIELDS.indexOf(pdfFieldName);
    }
}
