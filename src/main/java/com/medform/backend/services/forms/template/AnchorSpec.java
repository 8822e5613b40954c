package com.medform.backend.services.forms.template;

import java.util.List;

public record AnchorSpec(List<String> searchTerms, float offset, float fontSize, boolean multiline, AnchorSide side) {

    public static final float DEFAULT_OFFSET = 10f;
    public static final float DEFAULT_FONT_SIZE = 10f;
    public static final float MULTILINE_FONT_SIZE = 9f;

    public AnchorSpec {
        if (searchTerms == null || searchTerms.isEmpty()) {
            throw new IllegalArgumentException("Anchor needs at least one search term");
        }
        searchTerms = List.copyOf(searchTerms);
    }

    public static AnchorSpec text(float offset, String... terms) {
        return new AnchorSpec(List.of(terms), offset, DEFAULT_FONT_SIZE, false, AnchorSide.RIGHT);
    }

    public static AnchorSpec text(String... terms) {
        return text(DEFAULT_OFFSET, terms);
    }

    public static AnchorSpec multiline(String... terms) {
        return new AnchorSpec(List.of(terms), DEFAULT_OFFSET, MULTILINE_FONT_SIZE, true, AnchorSide.RIGHT);
    }

    public static AnchorSpec mark(AnchorSide side, String... terms) {
        return new AnchorSpec(List.of(terms), DEFAULT_OFFSET, DEFAULT_FONT_SIZE, false, side);
    }
}
