package com.materialport.converter.model;

public enum DecisionBasis {
    EXPLICIT_REFERENCE,
    SIGNATURE_MATCH,
    NAME_HEURISTIC,
    DEFAULT
}
