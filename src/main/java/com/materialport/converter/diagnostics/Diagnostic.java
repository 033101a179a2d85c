package com.materialport.converter.diagnostics;

import lombok.NonNull;
import lombok.Value;

/**
 * One recorded condition: what kind it is, a readable message, and the
 * identifier or name it concerns (may be null when nothing specific applies).
 */
@Value
public class Diagnostic {
    @NonNull DiagnosticKind kind;
    @NonNull String message;
    String subject;

    @Override
    public String toString() {
        return subject == null
                ? "[" + kind + "] " + message
                : "[" + kind + "] " + subject + ": " + message;
    }
}
