package com.materialport.converter.mapping;

import com.materialport.converter.model.RgbaColor;

/**
 * Color-space conversion applied to a mapped color. Alpha is never converted.
 */
public enum ColorSpace {
    NONE,
    SRGB_TO_LINEAR,
    LINEAR_TO_SRGB;

    public RgbaColor apply(RgbaColor color) {
        return switch (this) {
            case NONE -> color;
            case SRGB_TO_LINEAR -> new RgbaColor(toLinear(color.getR()), toLinear(color.getG()), toLinear(color.getB()), color.getA());
            case LINEAR_TO_SRGB -> new RgbaColor(toSrgb(color.getR()), toSrgb(color.getG()), toSrgb(color.getB()), color.getA());
        };
    }

    static double toLinear(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    static double toSrgb(double c) {
        return c <= 0.0031308 ? c * 12.92 : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }
}
