package com.materialport.converter.materiallist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.materialport.converter.model.PrefabMaterials;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PrefabGrouper {

    /**
     * Merges prefab entries that differ only by LOD suffix. The merged entry is
     * named without the suffix and lists meshes in manifest order; groups keep
     * the order of their first entry.
     */
    public static List<PrefabMaterials> group(List<PrefabMaterials> prefabs) {
        Map<String, PrefabMaterials.PrefabMaterialsBuilder> groups = new LinkedHashMap<>();
        for (PrefabMaterials prefab : prefabs) {
            String key = LodNames.stripLodSuffix(prefab.getName());
            groups.computeIfAbsent(key, k -> PrefabMaterials.builder().name(k))
                    .meshes(prefab.getMeshes());
        }

        List<PrefabMaterials> grouped = new ArrayList<>(groups.size());
        groups.values().forEach(b -> grouped.add(b.build()));
        return grouped;
    }
}
