package com.medform.backend.services.forms.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.medform.backend.services.forms.normalize.NormalizedForm;
import com.medform.backend.services.forms.normalize.SourceFormValidator;
import com.medform.backend.services.forms.schema.AshSchema;
import com.medform.backend.services.forms.schema.MnrSchema;

class TargetFormMapperTest {

    private final TargetFormMapper mapper = new TargetFormMapper();
    private final SourceFormValidator validator = new SourceFormValidator(Clock.systemUTC());

    private static Map<String, Object> flags(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    private static Map<String, Object> fullTree() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put(MnrSchema.PRIMARY_CARE_PHYSICIAN, "Dr. Roe");
        tree.put(MnrSchema.CURRENT_HEALTH_PROBLEMS, "Neck pain");
        tree.put(MnrSchema.EMPLOYER, "");
        tree.put(MnrSchema.PAIN_LEVEL, flags(MnrSchema.PAIN_AVERAGE, "5/10", MnrSchema.PAIN_CURRENT, "9/10"));
        tree.put(MnrSchema.HEIGHT, flags("feet", 5, "inches", 10));
        tree.put(MnrSchema.WEIGHT_LBS, 170.0);
        tree.put(MnrSchema.BLOOD_PRESSURE, flags("systolic", 120, "diastolic", 80));
        tree.put(MnrSchema.TREATMENT_RECEIVED,
                flags("Surgery", false, "Physical_Therapy", true, "Massage", true, "Other", "Yoga"));
        tree.put(MnrSchema.SYMPTOMS_PERCENTAGE, flags("0-10%", false, "51-60%", true));
        tree.put(MnrSchema.NEW_COMPLAINTS, flags("Yes", true, "No", false, "Explain", "Shoulder"));
        tree.put(MnrSchema.RE_INJURIES, flags("Yes", false, "No", true));
        tree.put(MnrSchema.UNDER_PHYSICIAN_CARE, flags("Yes", true, "No", false, "Conditions", "Diabetes"));
        tree.put(MnrSchema.RELIEF_DURATION, flags("Hours", true, "Hours_Number", 6, "Days", false));
        tree.put(MnrSchema.UPCOMING_TREATMENT_COURSE,
                flags("1_per_week", true, "2_per_week", false, "Out_of_Town_Dates", "May 3-10"));
        tree.put(MnrSchema.PREGNANT, flags("Yes", true, "No", false, "Weeks", 12, "Physician", "Dr. Lee"));
        tree.put(MnrSchema.ACTIVITIES_MONITORED, List.of(
                flags(MnrSchema.ACTIVITY, "Walking", MnrSchema.MEASUREMENT, "10 min", MnrSchema.HOW_HAS_CHANGED, "20 min"),
                flags(MnrSchema.ACTIVITY, "Sitting", MnrSchema.MEASUREMENT, null, MnrSchema.HOW_HAS_CHANGED, "Better")));
        tree.put("Favorite_Color", "blue");
        return tree;
    }

    @Test
    void scenarioA_weightAndCurrentPain() {
        MappedForm mapped = mapper.mapTree(Map.of(
                MnrSchema.WEIGHT_LBS, 170,
                MnrSchema.PAIN_LEVEL, Map.of(MnrSchema.PAIN_CURRENT, "9/10")));

        assertEquals("170 lbs", mapped.get(AshSchema.WEIGHT));
        assertEquals("9/10", mapped.get(AshSchema.CURRENT_PAIN));
        assertEquals(2, mapped.size());
    }

    @Test
    void map_flattensEveryCompositeRule() {
        MappedForm mapped = mapper.map(validator.process(fullTree()));

        assertEquals("Dr. Roe", mapped.get(AshSchema.PRIMARY_CARE_PHYSICIAN));
        assertEquals("Neck pain", mapped.get(AshSchema.HEALTH_PROBLEMS));
        assertEquals("5'10\"", mapped.get(AshSchema.HEIGHT));
        assertEquals("170 lbs", mapped.get(AshSchema.WEIGHT));
        assertEquals("120/80", mapped.get(AshSchema.BLOOD_PRESSURE));
        assertEquals("5/10", mapped.get(AshSchema.AVERAGE_PAIN));
        assertEquals("Physical Therapy, Massage, Other: Yoga", mapped.get(AshSchema.TREATMENTS_RECEIVED));
        assertEquals("51-60%", mapped.get(AshSchema.SYMPTOMS_PERCENTAGE));
        assertEquals("Yes: Shoulder", mapped.get(AshSchema.NEW_COMPLAINTS));
        assertEquals("No", mapped.get(AshSchema.RE_INJURIES));
        assertEquals("Yes: Diabetes", mapped.get(AshSchema.UNDER_PHYSICIAN_CARE));
        assertEquals("6 hours", mapped.get(AshSchema.RELIEF_DURATION));
        assertEquals("1 per week, Out of town: May 3-10", mapped.get(AshSchema.UPCOMING_TREATMENT_COURSE));
        assertEquals("Yes, 12 weeks, Physician: Dr. Lee", mapped.get(AshSchema.PREGNANT));
        assertEquals("Activity: Walking | Measurement: 10 min | Change: 20 min; Activity: Sitting | Change: Better",
                mapped.get(AshSchema.ACTIVITIES_MONITORED));
    }

    @Test
    void map_dropsEmptyAndUnknownFields() {
        MappedForm mapped = mapper.map(validator.process(fullTree()));

        assertFalse(mapped.fields().containsKey(AshSchema.EMPLOYER));
        assertFalse(mapped.fields().containsValue("blue"));
        assertEquals(mapped.size(), mapped.metadata().mappedFieldCount());
        assertEquals("MNR", mapped.metadata().mappedFrom());
        assertEquals("ASH", mapped.metadata().mappedTo());
    }

    @Test
    void map_isIdempotent() {
        NormalizedForm form = validator.process(fullTree());

        MappedForm first = mapper.map(form);
        MappedForm second = mapper.map(form);

        assertEquals(first, second);
        assertEquals(List.copyOf(first.fields().keySet()), List.copyOf(second.fields().keySet()));
    }

    @Test
    void outOfRangeHeight_stillMappedBestEffort() {
        Map<String, Object> tree = fullTree();
        tree.put(MnrSchema.HEIGHT, flags("feet", 5, "inches", 15));

        NormalizedForm form = validator.process(tree);
        MappedForm mapped = mapper.map(form);

        assertTrue(form.provenance().validationErrors().stream().anyMatch(e -> e.contains("inches")));
        assertEquals("5'15\"", mapped.get(AshSchema.HEIGHT));
    }

    @Test
    void nonObjectInput_isMappingFailure() {
        assertThrows(MappingException.class, () -> mapper.mapTree(List.of("not", "a", "tree")));
        assertThrows(MappingException.class, () -> mapper.mapTree(null));
    }
}
