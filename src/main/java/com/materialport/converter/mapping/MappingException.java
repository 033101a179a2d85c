package com.materialport.converter.mapping;

/**
 * A material has nothing that can be mapped.
 */
public class MappingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String materialName;

    public MappingException(String materialName, String message) {
        super(message);
        this.materialName = materialName;
    }

    public String getMaterialName() {
        return materialName;
    }
}
