package com.medform.backend.services.forms.template;

/**
 * Where an overlay value goes relative to the anchor text it was located by.
 */
public enum AnchorSide {
    /** Right of the label, {@code x = right + offset}. */
    RIGHT,
    /** Checkbox drawn left of its label, {@code x = left - 12}. */
    LEFT_MARK
}
