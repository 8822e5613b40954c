package com.medform.backend.services.forms.fill;

import java.util.ArrayList;
import java.util.List;

/**
 * Line breaking and clean-up for overlay text drawn with a standard Type 1 font.
 */
final class TextLayout {

    static final int WRAP_WIDTH = 50;
    static final int MAX_LINES = 3;
    static final int SINGLE_LINE_MAX = 60;
    static final float LINE_SPACING = 12f;

    private TextLayout() {
    }

    /**
     * Multiline values longer than {@link #WRAP_WIDTH} are word-wrapped into at most
     * {@link #MAX_LINES} lines; everything else becomes one (possibly truncated) line.
     */
    static List<String> layout(String value, boolean multiline) {
        String clean = sanitize(value);
        if (multiline && clean.length() > WRAP_WIDTH) {
            return wrap(clean, WRAP_WIDTH, MAX_LINES);
        }
        return List.of(truncate(clean, SINGLE_LINE_MAX));
    }

    static String truncate(String value, int max) {
        if (value.length() <= max) return value;
        return value.substring(0, max - 3) + "...";
    }

    static List<String> wrap(String value, int width, int maxLines) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : value.split("\\s+")) {
            if (word.isEmpty()) continue;
            while (word.length() > width) {
                if (line.length() > 0) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                lines.add(word.substring(0, width));
                word = word.substring(width);
            }
            if (line.length() > 0 && line.length() + 1 + word.length() > width) {
                lines.add(line.toString());
                line.setLength(0);
            }
            if (line.length() > 0) line.append(' ');
            line.append(word);
        }
        if (line.length() > 0) lines.add(line.toString());
        return lines.size() > maxLines ? new ArrayList<>(lines.subList(0, maxLines)) : lines;
    }

    /**
     * Keeps only characters Helvetica's WinAnsi encoding can show. Check glyphs become "X".
     */
    static String sanitize(String value) {
        if (value == null) return "";
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n' || c == '\t') {
                sb.append(' ');
            } else if (c == '✓' || c == '✔' || c == '✗' || c == '✘') {
                sb.append('X');
            } else if (c == '‘' || c == '’') {
                sb.append('\'');
            } else if (c == '“' || c == '”') {
                sb.append('"');
            } else if (c == '–' || c == '—') {
                sb.append('-');
            } else if ((c >= 0x20 && c < 0x7F) || (c >= 0xA0 && c <= 0xFF)) {
                sb.append(c);
            } else {
                sb.append('?');
            }
        }
        return sb.toString().trim();
    }
}
