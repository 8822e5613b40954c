package com.medform.backend.services.extraction;

/**
 * Turns a document into the MNR key/value tree. Implementations never throw for
 * recognition problems; they report them as a failed {@link ExtractionResult}.
 */
public interface ExtractionStrategy {

    ExtractionMethod method();

    boolean isAvailable();

    ExtractionResult extract(SourceDocument document);
}
