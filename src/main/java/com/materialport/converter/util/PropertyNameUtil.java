package com.materialport.converter.util;

import java.util.Locale;

import lombok.experimental.UtilityClass;

/**
 * Naming helpers shared by the classifier and the mapper.
 */
@UtilityClass
public class PropertyNameUtil {

    /**
     * Lookup key for a material property: leading underscores removed, lower-cased.
     * Example: "_Wind_Direction" and "Wind_Direction" both become "wind_direction".
     */
    public static String normalize(String propertyName) {
        if (propertyName == null) return "";
        int i = 0;
        while (i < propertyName.length() && propertyName.charAt(i) == '_') i++;
        return propertyName.substring(i).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Snake-case uniform name for a property with no declared target.
     * Example: "_AlphaClip" -> "alpha_clip", "_Enable_Breeze" -> "enable_breeze"
     */
    public static String toUniformName(String propertyName) {
        if (propertyName == null || propertyName.isBlank()) return "";

        StringBuilder sb = new StringBuilder();
        for (char c : propertyName.trim().toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString()
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
    }
}
