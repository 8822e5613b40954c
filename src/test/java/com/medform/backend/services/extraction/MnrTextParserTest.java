package com.medform.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.medform.backend.services.forms.schema.MnrSchema;

class MnrTextParserTest {

    @Test
    void parse_readsScalarsPainMeasurementsAndTicks() {
        String text = String.join("\n",
                "Primary Care Physician: Dr. Jane Roe",
                "Employer: ACME Corp",
                "Average pain in the past week 6",
                "Worst pain in the past week 8/10",
                "Current pain level 4",
                "Height: 5' 10\"",
                "Weight: 170",
                "Surgery [X]   Massage [ ]  Injections ✓");

        Map<String, Object> data = MnrTextParser.parse(text);

        assertEquals("Dr. Jane Roe", data.get(MnrSchema.PRIMARY_CARE_PHYSICIAN));
        assertEquals("ACME Corp", data.get(MnrSchema.EMPLOYER));

        @SuppressWarnings("unchecked")
        Map<String, Object> pain = (Map<String, Object>) data.get(MnrSchema.PAIN_LEVEL);
        assertEquals("6/10", pain.get(MnrSchema.PAIN_AVERAGE));
        assertEquals("8/10", pain.get(MnrSchema.PAIN_WORST));
        assertEquals("4/10", pain.get(MnrSchema.PAIN_CURRENT));

        assertEquals(Map.of("feet", 5, "inches", 10), data.get(MnrSchema.HEIGHT));
        assertEquals(170, data.get(MnrSchema.WEIGHT_LBS));

        @SuppressWarnings("unchecked")
        Map<String, Object> treatment = (Map<String, Object>) data.get(MnrSchema.TREATMENT_RECEIVED);
        assertEquals(true, treatment.get("Surgery"));
        assertEquals(false, treatment.get("Massage"));
        assertEquals(true, treatment.get("Injections"));
    }

    @Test
    void parse_unmatchedFieldsStayNullWithoutFailing() {
        Map<String, Object> data = MnrTextParser.parse("nothing recognizable here");

        assertTrue(data.containsKey(MnrSchema.EMPLOYER));
        assertNull(data.get(MnrSchema.EMPLOYER));
        assertNull(data.get(MnrSchema.PAIN_LEVEL));
        assertNull(data.get(MnrSchema.HEIGHT));
        assertNull(data.get(MnrSchema.WEIGHT_LBS));
    }

    @Test
    void parse_oversizedDigitRunsLeaveMeasurementsNull() {
        Map<String, Object> data = assertDoesNotThrow(
                () -> MnrTextParser.parse("Weight: 17012345678\nHeight: 5' 10\nEmployer: ACME Corp"));

        assertNull(data.get(MnrSchema.WEIGHT_LBS));
        assertEquals(Map.of("feet", 5, "inches", 10), data.get(MnrSchema.HEIGHT));
        assertEquals("ACME Corp", data.get(MnrSchema.EMPLOYER));

        Map<String, Object> tall = assertDoesNotThrow(() -> MnrTextParser.parse("Height 5 99999999999\nWeight 180"));

        assertNull(tall.get(MnrSchema.HEIGHT));
        assertEquals(180, tall.get(MnrSchema.WEIGHT_LBS));
    }
}
