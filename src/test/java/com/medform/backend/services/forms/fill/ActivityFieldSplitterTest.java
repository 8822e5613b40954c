package com.medform.backend.services.forms.fill;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class ActivityFieldSplitterTest {

    private static final String JOINED =
            "Activity: Walking | Measurement: 10 min | Change: 20 min; Activity: Sitting | Change: Better";

    @Test
    void cellValue_picksSlotAndPart() {
        assertEquals("Walking", ActivityFieldSplitter.cellValue(JOINED, "Activity#0"));
        assertEquals("10 min", ActivityFieldSplitter.cellValue(JOINED, "Measurements"));
        assertEquals("Better", ActivityFieldSplitter.cellValue(JOINED, "How has it changed?#1"));
    }

    @Test
    void cellValue_missingPartOrSlot() {
        assertNull(ActivityFieldSplitter.cellValue(JOINED, "Measurements#1"));
        assertNull(ActivityFieldSplitter.cellValue("Activity: Walking", "Activity#1"));
        assertNull(ActivityFieldSplitter.cellValue(JOINED, "Weight"));
        assertNull(ActivityFieldSplitter.cellValue(null, "Activity#0"));
    }
}
