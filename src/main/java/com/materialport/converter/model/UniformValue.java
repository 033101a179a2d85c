package com.materialport.converter.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A typed shader uniform value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UniformValue {

    public enum Type {
        BOOL,
        FLOAT,
        VECTOR2,
        COLOR
    }

    @NonNull Type type;
    boolean boolValue;
    double floatValue;
    Vector2 vector;
    RgbaColor color;

    public static UniformValue ofBool(boolean value) {
        return new UniformValue(Type.BOOL, value, 0.0, null, null);
    }

    public static UniformValue ofFloat(double value) {
        return new UniformValue(Type.FLOAT, false, value, null, null);
    }

    public static UniformValue ofVector(Vector2 value) {
        return new UniformValue(Type.VECTOR2, false, 0.0, value, null);
    }

    public static UniformValue ofColor(RgbaColor value) {
        return new UniformValue(Type.COLOR, false, 0.0, null, value);
    }
}
