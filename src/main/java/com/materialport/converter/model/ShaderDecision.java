package com.materialport.converter.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of classifying one material. The basis and detail are kept for
 * diagnostics only; mapping reads the family.
 */
@Value
public class ShaderDecision {
    @NonNull ShaderFamily family;
    @NonNull DecisionBasis basis;
    String detail;

    public static ShaderDecision fallback() {
        return new ShaderDecision(ShaderFamily.GENERIC_OPAQUE, DecisionBasis.DEFAULT, null);
    }
}
