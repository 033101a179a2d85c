package com.materialport.converter.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Mesh and material topology of one prefab, meshes in manifest order.
 */
@Value
@Builder
public class PrefabMaterials {
    @NonNull String name;
    @Singular List<MeshMaterials> meshes;

    /**
     * Distinct material names referenced by any mesh, in first-seen order.
     */
    public Set<String> materialNames() {
        Set<String> names = new LinkedHashSet<>();
        for (MeshMaterials mesh : meshes) {
            mesh.getSlots().stream()
                    .map(MaterialSlot::getMaterialName)
                    .filter(Objects::nonNull)
                    .forEach(names::add);
        }
        return names;
    }
}
