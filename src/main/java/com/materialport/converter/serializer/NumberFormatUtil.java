package com.materialport.converter.serializer;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.materialport.converter.model.RgbaColor;
import com.materialport.converter.model.Vector2;

import lombok.experimental.UtilityClass;

/**
 * Fixed-precision number formatting for resource text.
 * Example: 1 -> "1.0", 0.1234567 -> "0.123457", -0.0 -> "0.0"
 */
@UtilityClass
public class NumberFormatUtil {

    public static final int DECIMAL_PLACES = 6;

    public static String formatFloat(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite value " + value);
        }
        String text = BigDecimal.valueOf(value)
                .setScale(DECIMAL_PLACES, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        if (text.equals("-0")) {
            text = "0";
        }
        return text.contains(".") ? text : text + ".0";
    }

    public static String formatColor(RgbaColor color) {
        return "Color(" + formatFloat(color.getR()) + ", " + formatFloat(color.getG()) + ", "
                + formatFloat(color.getB()) + ", " + formatFloat(color.getA()) + ")";
    }

    public static String formatVector(Vector2 vector) {
        return "Vector2(" + formatFloat(vector.getX()) + ", " + formatFloat(vector.getY()) + ")";
    }
}
