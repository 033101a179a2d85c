package com.materialport.converter.model;

import lombok.Value;

@Value
public class Vector2 {
    public static final Vector2 ZERO = new Vector2(0, 0);
    public static final Vector2 ONE = new Vector2(1, 1);

    double x;
    double y;
}
