package com.medform.backend.services.forms.mapping;

import static com.medform.backend.services.forms.mapping.FlattenRules.putIfPresent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.medform.backend.services.forms.normalize.NormalizedForm;
import com.medform.backend.services.forms.schema.AshSchema;
import com.medform.backend.services.forms.schema.MnrSchema;
import com.medform.backend.services.util.TreeValues;

import lombok.extern.slf4j.Slf4j;

/**
 * Projects the nested MNR tree onto the flat ASH key set. Pure: the same input always
 * yields an equal {@link MappedForm}. Source fields without an ASH counterpart are dropped.
 */
@Component
@Slf4j
public class TargetFormMapper {

    private static final List<String[]> RENAMES = List.of(
            new String[]{MnrSchema.PRIMARY_CARE_PHYSICIAN, AshSchema.PRIMARY_CARE_PHYSICIAN},
            new String[]{MnrSchema.PHYSICIAN_PHONE, AshSchema.PHYSICIAN_PHONE},
            new String[]{MnrSchema.CURRENT_HEALTH_PROBLEMS, AshSchema.HEALTH_PROBLEMS},
            new String[]{MnrSchema.WHEN_BEGAN, AshSchema.WHEN_BEGAN},
            new String[]{MnrSchema.HOW_HAPPENED, AshSchema.HOW_HAPPENED},
            new String[]{MnrSchema.PAIN_MEDICATION, AshSchema.PAIN_MEDICATION},
            new String[]{MnrSchema.HEALTH_HISTORY, AshSchema.HEALTH_HISTORY},
            new String[]{MnrSchema.EMPLOYER, AshSchema.EMPLOYER},
            new String[]{MnrSchema.JOB_DESCRIPTION, AshSchema.JOB_DESCRIPTION},
            new String[]{MnrSchema.DATE, AshSchema.DATE},
            new String[]{MnrSchema.SIGNATURE, AshSchema.SIGNATURE}
    );

    private static final List<String[]> PAIN = List.of(
            new String[]{MnrSchema.PAIN_AVERAGE, AshSchema.AVERAGE_PAIN},
            new String[]{MnrSchema.PAIN_WORST, AshSchema.WORST_PAIN},
            new String[]{MnrSchema.PAIN_CURRENT, AshSchema.CURRENT_PAIN}
    );

    public MappedForm map(NormalizedForm form) {
        if (form == null) {
            throw new MappingException("Nothing to map: normalized form is null");
        }
        return mapTree(form.data());
    }

    /**
     * @throws MappingException when {@code tree} is not a key/value object
     */
    public MappedForm mapTree(Object tree) {
        Map<String, Object> data = TreeValues.asMap(tree);
        if (data == null) {
            throw new MappingException("Cannot map " + (tree == null ? "null" : tree.getClass().getSimpleName())
                    + ": expected a key/value object");
        }

        Map<String, String> out = new LinkedHashMap<>();

        for (String[] rename : RENAMES) {
            putIfPresent(out, rename[1], FlattenRules.scalar(data.get(rename[0])));
        }

        putIfPresent(out, AshSchema.HEIGHT, FlattenRules.height(data.get(MnrSchema.HEIGHT)));
        putIfPresent(out, AshSchema.WEIGHT, FlattenRules.weight(data.get(MnrSchema.WEIGHT_LBS)));
        putIfPresent(out, AshSchema.BLOOD_PRESSURE, FlattenRules.bloodPressure(data.get(MnrSchema.BLOOD_PRESSURE)));

        Map<String, Object> pain = TreeValues.asMap(data.get(MnrSchema.PAIN_LEVEL));
        if (pain != null) {
            for (String[] p : PAIN) {
                putIfPresent(out, p[1], FlattenRules.scalar(pain.get(p[0])));
            }
        }

        putIfPresent(out, AshSchema.TREATMENTS_RECEIVED,
                FlattenRules.flags(data.get(MnrSchema.TREATMENT_RECEIVED), "Other", "Other"));
        putIfPresent(out, AshSchema.ACTIVITIES_MONITORED,
                FlattenRules.activities(data.get(MnrSchema.ACTIVITIES_MONITORED)));
        putIfPresent(out, AshSchema.DAILY_ACTIVITY_INTERFERENCE,
                FlattenRules.scalar(data.get(MnrSchema.DAILY_ACTIVITY_INTERFERENCE)));
        putIfPresent(out, AshSchema.PAIN_QUALITY,
                FlattenRules.flags(data.get(MnrSchema.PAIN_QUALITY), null, null));
        putIfPresent(out, AshSchema.HELPFUL_TREATMENTS,
                FlattenRules.flags(data.get(MnrSchema.HELPFUL_TREATMENTS), "Other", "Other"));
        putIfPresent(out, AshSchema.PROGRESS_SINCE_ACUPUNCTURE,
                FlattenRules.flags(data.get(MnrSchema.PROGRESS_SINCE_ACUPUNCTURE), null, null));
        putIfPresent(out, AshSchema.RELIEF_DURATION,
                FlattenRules.reliefDuration(data.get(MnrSchema.RELIEF_DURATION)));
        putIfPresent(out, AshSchema.SYMPTOMS_PERCENTAGE,
                FlattenRules.bucket(data.get(MnrSchema.SYMPTOMS_PERCENTAGE)));
        putIfPresent(out, AshSchema.PREGNANT, FlattenRules.pregnant(data.get(MnrSchema.PREGNANT)));
        putIfPresent(out, AshSchema.NEW_COMPLAINTS, FlattenRules.yesNo(data.get(MnrSchema.NEW_COMPLAINTS), "Explain"));
        putIfPresent(out, AshSchema.RE_INJURIES, FlattenRules.yesNo(data.get(MnrSchema.RE_INJURIES), "Explain"));
        putIfPresent(out, AshSchema.UPCOMING_TREATMENT_COURSE,
                FlattenRules.flags(data.get(MnrSchema.UPCOMING_TREATMENT_COURSE), "Out_of_Town_Dates", "Out of town"));
        putIfPresent(out, AshSchema.UNDER_PHYSICIAN_CARE,
                FlattenRules.yesNo(data.get(MnrSchema.UNDER_PHYSICIAN_CARE), "Conditions"));

        log.debug("[Mapping] MNR -> ASH: sourceFields={} mappedFields={}", data.size(), out.size());
        return new MappedForm(out, new MappedForm.Metadata("MNR", "ASH", data.size(), out.size()));
    }
}
