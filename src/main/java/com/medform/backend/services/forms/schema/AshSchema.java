package com.medform.backend.services.forms.schema;

/**
 * Target-form ("ASH") semantic keys produced by the mapper.
 */
public final class AshSchema {

    public static final String PATIENT_NAME = "patient_name";
    public static final String PATIENT_DOB = "patient_dob";
    public static final String PATIENT_PHONE = "patient_phone";
    public static final String PATIENT_ADDRESS = "patient_address";
    public static final String PRIMARY_CARE_PHYSICIAN = "primary_care_physician";
    public static final String PHYSICIAN_PHONE = "physician_phone";
    public static final String HEALTH_PROBLEMS = "health_problems";
    public static final String WHEN_BEGAN = "when_began";
    public static final String HOW_HAPPENED = "how_happened";
    public static final String PAIN_MEDICATION = "pain_medication";
    public static final String HEALTH_HISTORY = "health_history";
    public static final String EMPLOYER = "employer";
    public static final String JOB_DESCRIPTION = "job_description";
    public static final String DATE = "date";
    public static final String SIGNATURE = "signature";
    public static final String HEIGHT = "height";
    public static final String WEIGHT = "weight";
    public static final String BLOOD_PRESSURE = "blood_pressure";
    public static final String AVERAGE_PAIN = "average_pain";
    public static final String WORST_PAIN = "worst_pain";
    public static final String CURRENT_PAIN = "current_pain";
    public static final String TREATMENTS_RECEIVED = "treatments_received";
    public static final String ACTIVITIES_MONITORED = "activities_monitored";
    public static final String DAILY_ACTIVITY_INTERFERENCE = "daily_activity_interference";
    public static final String PAIN_QUALITY = "pain_quality";
    public static final String HELPFUL_TREATMENTS = "helpful_treatments";
    public static final String PROGRESS_SINCE_ACUPUNCTURE = "progress_since_acupuncture";
    public static final String RELIEF_DURATION = "relief_duration";
    public static final String SYMPTOMS_PERCENTAGE = "symptoms_percentage";
    public static final String PREGNANT = "pregnant";
    public static final String NEW_COMPLAINTS = "new_complaints";
    public static final String RE_INJURIES = "re_injuries";
    public static final String UPCOMING_TREATMENT_COURSE = "upcoming_treatment_course";
    public static final String UNDER_PHYSICIAN_CARE = "under_physician_care";
    public static final String CLINIC_NAME = "clinic_name";
    public static final String TREATING_PRACTITIONER = "treating_practitioner";

    private AshSchema() {
    }
}
