package com.materialport.converter.parser;

/**
 * One material file could not be turned into a record. Callers skip that
 * material and carry on with the rest.
 */
public class MaterialParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public MaterialParseException(String message) {
        this(message, 0);
    }

    public MaterialParseException(String message, int line) {
        super(line > 0 ? "Line " + line + ": " + message : message);
        this.line = line;
    }

    public MaterialParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    public int getLine() {
        return line;
    }
}
