package com.medform.backend.services.forms.mapping;

import static com.medform.backend.services.forms.mapping.FlattenRules.putIfPresent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.medform.backend.services.forms.normalize.NormalizedForm;
import com.medform.backend.services.forms.schema.MnrSchema;
import com.medform.backend.services.forms.template.MnrFieldMappings;
import com.medform.backend.services.util.TreeValues;

/**
 * Flattens the normalized tree onto the MNR template's own anchors so the source form can be
 * re-rendered. Ticked boxes become {@link MnrFieldMappings#CHECK_MARK} entries.
 */
@Component
public class SourceFormProjector {

    private static final List<String> TEXT_FIELDS = List.of(
            MnrSchema.PRIMARY_CARE_PHYSICIAN, MnrSchema.PHYSICIAN_PHONE, MnrSchema.EMPLOYER,
            MnrSchema.JOB_DESCRIPTION, MnrSchema.CURRENT_HEALTH_PROBLEMS, MnrSchema.WHEN_BEGAN,
            MnrSchema.HOW_HAPPENED, MnrSchema.PAIN_MEDICATION, MnrSchema.HEALTH_HISTORY,
            MnrSchema.DAILY_ACTIVITY_INTERFERENCE, MnrSchema.DATE, MnrSchema.SIGNATURE);

    public MappedForm project(NormalizedForm form) {
        if (form == null) {
            throw new MappingException("Nothing to project: normalized form is null");
        }
        Map<String, Object> data = form.data();
        Map<String, String> out = new LinkedHashMap<>();

        for (String field : TEXT_FIELDS) {
            putIfPresent(out, field, FlattenRules.scalar(data.get(field)));
        }

        Map<String, Object> pain = TreeValues.asMap(data.get(MnrSchema.PAIN_LEVEL));
        if (pain != null) {
            for (String key : MnrSchema.PAIN_KEYS) {
                putIfPresent(out, MnrFieldMappings.painKey(key), FlattenRules.scalar(pain.get(key)));
            }
        }

        putIfPresent(out, MnrSchema.HEIGHT, FlattenRules.height(data.get(MnrSchema.HEIGHT)));
        putIfPresent(out, MnrSchema.WEIGHT_LBS, FlattenRules.weight(data.get(MnrSchema.WEIGHT_LBS)));
        putIfPresent(out, MnrSchema.BLOOD_PRESSURE, FlattenRules.bloodPressure(data.get(MnrSchema.BLOOD_PRESSURE)));

        marks(out, MnrSchema.TREATMENT_RECEIVED, data.get(MnrSchema.TREATMENT_RECEIVED));
        Map<String, Object> treatment = TreeValues.asMap(data.get(MnrSchema.TREATMENT_RECEIVED));
        if (treatment != null) {
            putIfPresent(out, MnrFieldMappings.memberKey(MnrSchema.TREATMENT_RECEIVED, "Other"),
                    FlattenRules.scalar(treatment.get("Other")));
        }

        // Only one percentage bucket may be ticked on the paper form.
        List<String> buckets = FlattenRules.trueKeys(data.get(MnrSchema.SYMPTOMS_PERCENTAGE), false);
        if (!buckets.isEmpty()) {
            out.put(MnrFieldMappings.memberKey(MnrSchema.SYMPTOMS_PERCENTAGE, buckets.get(0)), MnrFieldMappings.CHECK_MARK);
        }

        marks(out, MnrSchema.HELPFUL_TREATMENTS, data.get(MnrSchema.HELPFUL_TREATMENTS));
        marks(out, MnrSchema.PAIN_QUALITY, data.get(MnrSchema.PAIN_QUALITY));
        marks(out, MnrSchema.PROGRESS_SINCE_ACUPUNCTURE, data.get(MnrSchema.PROGRESS_SINCE_ACUPUNCTURE));

        putIfPresent(out, MnrSchema.UNDER_PHYSICIAN_CARE,
                FlattenRules.yesNo(data.get(MnrSchema.UNDER_PHYSICIAN_CARE), "Conditions"));
        putIfPresent(out, MnrSchema.NEW_COMPLAINTS, FlattenRules.yesNo(data.get(MnrSchema.NEW_COMPLAINTS), "Explain"));
        putIfPresent(out, MnrSchema.RE_INJURIES, FlattenRules.yesNo(data.get(MnrSchema.RE_INJURIES), "Explain"));
        putIfPresent(out, MnrSchema.RELIEF_DURATION, FlattenRules.reliefDuration(data.get(MnrSchema.RELIEF_DURATION)));
        putIfPresent(out, MnrSchema.UPCOMING_TREATMENT_COURSE,
                FlattenRules.flags(data.get(MnrSchema.UPCOMING_TREATMENT_COURSE), "Out_of_Town_Dates", "Out of town"));
        putIfPresent(out, MnrSchema.PREGNANT, FlattenRules.pregnant(data.get(MnrSchema.PREGNANT)));
        putIfPresent(out, MnrSchema.ACTIVITIES_MONITORED, FlattenRules.activities(data.get(MnrSchema.ACTIVITIES_MONITORED)));

        return new MappedForm(out, new MappedForm.Metadata("MNR", "MNR", data.size(), out.size()));
    }

    private static void marks(Map<String, String> out, String group, Object raw) {
        for (String flag : FlattenRules.trueKeys(raw, false)) {
            String key = MnrFieldMappings.memberKey(group, flag);
            if (MnrFieldMappings.table().contains(key)) {
                out.put(key, MnrFieldMappings.CHECK_MARK);
            }
        }
    }
}
