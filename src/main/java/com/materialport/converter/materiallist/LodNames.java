package com.materialport.converter.materiallist;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * LOD suffix handling for mesh and prefab names ({@code SM_Tree_01_LOD2}).
 */
@UtilityClass
public class LodNames {

    private static final Pattern LOD_SUFFIX = Pattern.compile("_LOD(\\d+)$", Pattern.CASE_INSENSITIVE);

    /**
     * LOD index encoded in the name, 0 when there is no suffix.
     */
    public static int lodIndex(String name) {
        if (name == null) return 0;
        Matcher m = LOD_SUFFIX.matcher(name.trim());
        if (!m.find()) return 0;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds; treat as an unusually deep LOD
            return Integer.MAX_VALUE;
        }
    }

    public static String stripLodSuffix(String name) {
        if (name == null) return null;
        return LOD_SUFFIX.matcher(name.trim()).replaceFirst("");
    }
}
