package com.materialport.converter.diagnostics;

/**
 * Categories of conditions recorded during a conversion run.
 */
public enum DiagnosticKind {
    EXTRACTION,
    ARCHIVE_ENTRY,
    MATERIAL_PARSE,
    MANIFEST_PARSE,
    CLASSIFICATION_FALLBACK,
    MAPPING,
    UNRESOLVED_REFERENCE,
    OUTPUT
}
