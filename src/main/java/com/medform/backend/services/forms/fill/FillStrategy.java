package com.medform.backend.services.forms.fill;

/**
 * One way of putting mapped values onto a template. Implementations report "nothing filled"
 * as an unsuccessful result and may throw {@link FillingException} for unreadable templates.
 */
public interface FillStrategy {

    FillMethod method();

    FillingResult fill(FillRequest request);
}
