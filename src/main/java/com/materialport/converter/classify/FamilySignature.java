package com.materialport.converter.classify;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.ShaderFamily;
import com.materialport.converter.util.PropertyNameUtil;

import lombok.Value;

/**
 * Property names whose presence is characteristic of one shader family.
 * Names are held normalized.
 */
@Value
public class FamilySignature {
    ShaderFamily family;
    Set<String> textures;
    Set<String> scalars;
    Set<String> colors;

    public static FamilySignature of(ShaderFamily family, Collection<String> textures,
                                     Collection<String> scalars, Collection<String> colors) {
        return new FamilySignature(family, normalize(textures), normalize(scalars), normalize(colors));
    }

    /**
     * Signature keys present on the material, sorted.
     */
    public Set<String> matchedKeys(MaterialRecord record) {
        Set<String> matched = new TreeSet<>();
        collect(record.getTextures().keySet(), textures, matched);
        collect(record.getScalars().keySet(), scalars, matched);
        collect(record.getColors().keySet(), colors, matched);
        return matched;
    }

    private static void collect(Set<String> present, Set<String> signature, Set<String> matched) {
        for (String name : present) {
            String key = PropertyNameUtil.normalize(name);
            if (signature.contains(key)) {
                matched.add(key);
            }
        }
    }

    private static Set<String> normalize(Collection<String> names) {
        return names.stream()
                .map(PropertyNameUtil::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }
}
