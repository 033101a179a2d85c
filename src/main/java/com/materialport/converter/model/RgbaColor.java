package com.materialport.converter.model;

import lombok.Value;

@Value
public class RgbaColor {
    double r;
    double g;
    double b;
    double a;

    public boolean hasRgb() {
        return r != 0.0 || g != 0.0 || b != 0.0;
    }

    public RgbaColor withAlpha(double alpha) {
        return new RgbaColor(r, g, b, alpha);
    }
}
