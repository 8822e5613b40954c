package com.medform.backend.services.forms.fill;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Collects the text lines of the first page together with the glyph boxes behind every
 * character, so labels can be located in page coordinates.
 */
final class AnchorLocator extends PDFTextStripper {

    /**
     * Bounding box of a located label. {@code top}/{@code bottom} are measured from the top edge.
     */
    record Box(float left, float right, float top, float bottom) {
        float middle() {
            return (top + bottom) / 2f;
        }
    }

    private record Line(String text, List<TextPosition> positions) {
    }

    private final List<Line> lines = new ArrayList<>();
    private StringBuilder current = new StringBuilder();
    private List<TextPosition> currentPositions = new ArrayList<>();

    private AnchorLocator() throws IOException {
        setSortByPosition(true);
        setStartPage(1);
        setEndPage(1);
    }

    static AnchorLocator scan(PDDocument doc) throws IOException {
        AnchorLocator locator = new AnchorLocator();
        locator.getText(doc);
        locator.flush();
        return locator;
    }

    /**
     * First occurrence of any term, tried in order; matching ignores case.
     */
    Optional<Box> find(List<String> terms) {
        for (String term : terms) {
            if (term == null || term.isBlank()) continue;
            String needle = term.toLowerCase(Locale.ROOT);
            for (Line line : lines) {
                int at = line.text().toLowerCase(Locale.ROOT).indexOf(needle);
                if (at >= 0) {
                    Optional<Box> box = boxOf(line, at, needle.length());
                    if (box.isPresent()) return box;
                }
            }
        }
        return Optional.empty();
    }

    int lineCount() {
        return lines.size();
    }

    private static Optional<Box> boxOf(Line line, int start, int length) {
        float left = Float.MAX_VALUE;
        float right = -Float.MAX_VALUE;
        float top = Float.MAX_VALUE;
        float bottom = -Float.MAX_VALUE;
        boolean any = false;
        for (int i = start; i < start + length && i < line.positions().size(); i++) {
            TextPosition p = line.positions().get(i);
            if (p == null) continue;
            any = true;
            left = Math.min(left, p.getXDirAdj());
            right = Math.max(right, p.getXDirAdj() + p.getWidthDirAdj());
            top = Math.min(top, p.getYDirAdj() - p.getHeightDir());
            bottom = Math.max(bottom, p.getYDirAdj());
        }
        return any ? Optional.of(new Box(left, right, top, bottom)) : Optional.empty();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null) continue;
            // one slot per char keeps text offsets and glyph boxes aligned
            for (int i = 0; i < unicode.length(); i++) {
                current.append(unicode.charAt(i));
                currentPositions.add(position);
            }
        }
    }

    @Override
    protected void writeWordSeparator() throws IOException {
        current.append(' ');
        currentPositions.add(null);
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        flush();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        flush();
        super.endPage(page);
    }

    private void flush() {
        if (current.length() > 0) {
            lines.add(new Line(current.toString(), currentPositions));
        }
        current = new StringBuilder();
        currentPositions = new ArrayList<>();
    }
}
