package com.materialport.converter.materiallist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.materialport.converter.model.MaterialSlot;
import com.materialport.converter.model.MeshMaterials;
import com.materialport.converter.model.PrefabMaterials;

import lombok.Data;

/**
 * Parsed contents of one or more material list files.
 */
@Data
public class MaterialListDocument {
    private final List<PrefabMaterials> prefabs = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    public void addPrefab(PrefabMaterials prefab) {
        prefabs.add(prefab);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addNote(String note) {
        notes.add(note);
    }

    /**
     * Appends another document's prefabs and messages after this one's.
     */
    public void merge(MaterialListDocument other) {
        prefabs.addAll(other.getPrefabs());
        warnings.addAll(other.getWarnings());
        notes.addAll(other.getNotes());
    }

    public boolean isEmpty() {
        return prefabs.isEmpty();
    }

    public Set<String> getAllMaterialNames() {
        Set<String> names = new LinkedHashSet<>();
        prefabs.forEach(p -> names.addAll(p.materialNames()));
        return names;
    }

    /**
     * Materials whose slot notes say they use a custom shader.
     */
    public Set<String> getCustomShaderMaterials() {
        Set<String> names = new LinkedHashSet<>();
        forEachNamedSlot(slot -> {
            if (slot.isCustomShader()) names.add(slot.getMaterialName());
        });
        return names;
    }

    /**
     * Material name to texture hint, first hint wins.
     */
    public Map<String, String> getTextureHints() {
        Map<String, String> hints = new LinkedHashMap<>();
        forEachNamedSlot(slot -> {
            if (slot.getTextureHint() != null) hints.putIfAbsent(slot.getMaterialName(), slot.getTextureHint());
        });
        return hints;
    }

    private void forEachNamedSlot(Consumer<MaterialSlot> action) {
        for (PrefabMaterials prefab : prefabs) {
            for (MeshMaterials mesh : prefab.getMeshes()) {
                mesh.getSlots().stream()
                        .filter(s -> s.getMaterialName() != null)
                        .forEach(action);
            }
        }
    }
}
