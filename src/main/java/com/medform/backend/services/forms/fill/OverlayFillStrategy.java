package com.medform.backend.services.forms.fill;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;

import com.medform.backend.services.forms.template.AnchorSide;
import com.medform.backend.services.forms.template.AnchorSpec;
import com.medform.backend.services.forms.template.FieldMapping;
import com.medform.backend.services.forms.template.FieldMappingTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Draws values next to their printed labels on page 1. Works on flat templates with no AcroForm.
 */
@Component
@Slf4j
public class OverlayFillStrategy implements FillStrategy {

    static final float LEFT_MARK_OFFSET = 12f;

    @Override
    public FillMethod method() {
        return FillMethod.OVERLAY;
    }

    @Override
    public FillingResult fill(FillRequest request) {
        List<String> warnings = new ArrayList<>();
        FieldMappingTable table = request.template().table();
        Map<String, String> values = request.form().fields();

        try (PDDocument doc = PdfOutput.open(request)) {
            if (doc.getNumberOfPages() == 0) {
                return FillingResult.failure(method(), "Template has no pages", warnings);
            }
            PDPage page = doc.getPage(0);
            float pageHeight = page.getMediaBox().getHeight();
            AnchorLocator locator = AnchorLocator.scan(doc);

            int placed = 0;
            try (PDPageContentStream cs = new PDPageContentStream(doc, page,
                    PDPageContentStream.AppendMode.APPEND, true, true)) {
                cs.setNonStrokingColor(0f, 0f, 1f);
                for (Map.Entry<String, String> entry : values.entrySet()) {
                    Optional<FieldMapping> mapping = table.find(entry.getKey());
                    if (mapping.isEmpty() || mapping.get().anchor() == null) {
                        warnings.add("No anchor for " + entry.getKey());
                        continue;
                    }
                    AnchorSpec anchor = mapping.get().anchor();
                    Optional<AnchorLocator.Box> box = locator.find(anchor.searchTerms());
                    if (box.isEmpty()) {
                        warnings.add("Could not place " + entry.getKey() + ": anchor not found " + anchor.searchTerms());
                        continue;
                    }
                    draw(cs, anchor, box.get(), pageHeight, entry.getValue());
                    placed++;
                }
            }

            if (placed == 0) {
                return FillingResult.failure(method(), "No anchors matched on template", warnings);
            }
            PdfOutput.save(doc, request.outputPath());
            log.info("[Fill] overlay placed={}/{} output={}", placed, values.size(), request.outputPath());
            return FillingResult.success(request.outputPath(), placed, values.size(), method(), warnings);
        } catch (IOException e) {
            throw new FillingException("Overlay fill failed: " + e.getMessage(), e);
        }
    }

    private static void draw(PDPageContentStream cs, AnchorSpec anchor, AnchorLocator.Box box, float pageHeight,
                             String value) throws IOException {
        float x = anchor.side() == AnchorSide.LEFT_MARK
                ? box.left() - LEFT_MARK_OFFSET
                : box.right() + anchor.offset();
        float y = pageHeight - box.middle();

        List<String> lines = TextLayout.layout(value, anchor.multiline());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isEmpty()) continue;
            cs.beginText();
            cs.setFont(PDType1Font.HELVETICA, anchor.fontSize());
            cs.newLineAtOffset(x, y - i * TextLayout.LINE_SPACING);
            cs.showText(line);
            cs.endText();
        }
    }
}
