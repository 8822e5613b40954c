package com.medform.backend.services.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.medform.backend.services.forms.schema.MnrSchema;

/**
 * Fixed instruction for the vision extractor. The JSON skeleton comes from {@link MnrSchema}
 * so the reply always has the same shape.
 */
final class MnrExtractionPrompt {

    private static final String TEXT = build();

    private MnrExtractionPrompt() {
    }

    static String text() {
        return TEXT;
    }

    private static String build() {
        String skeleton;
        try {
            skeleton = new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(MnrSchema.skeleton());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render MNR skeleton", e);
        }

        return "You are reading a scanned patient intake form (MNR progress report).\n"
                + "Transcribe what is written or marked on the form into one JSON object.\n\n"
                + "Rules:\n"
                + "1. Use exactly the keys of the structure below; do not add or rename keys.\n"
                + "2. Checkbox flags are true only when the box is visibly marked.\n"
                + "3. Pain scales: report the circled or marked number as \"N/10\".\n"
                + "4. Phone numbers, names and medical terms are copied exactly as written.\n"
                + "5. Height feet/inches, weight in pounds and blood pressure values are numbers.\n"
                + "6. Activities_Monitored holds one object per filled table row.\n"
                + "7. Use null for anything left blank. Never invent values.\n"
                + "8. Signature is \"Present\" or \"Absent\".\n\n"
                + "Structure:\n"
                + skeleton
                + "\n\nReturn only the JSON object.";
    }
}
