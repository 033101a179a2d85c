package com.materialport.converter.classify;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.materiallist.LodNames;
import com.materialport.converter.materiallist.PrefabGrouper;
import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.MaterialSlot;
import com.materialport.converter.model.MeshMaterials;
import com.materialport.converter.model.PrefabMaterials;
import com.materialport.converter.model.ShaderDecision;

/**
 * Builds the {@link ShaderCache} for a run.
 *
 * For each prefab group only LOD0 materials are classified. The decision for
 * LOD0 slot {@code i} is recorded for slot {@code i} of every other LOD of
 * the same mesh, whatever those materials would classify as on their own.
 * An LOD mesh is paired with the LOD0 mesh of the same base name, else with
 * the group's first LOD0 mesh. The first decision recorded for a name wins,
 * and only names first decided outside LOD inheritance are reported as unmatched.
 */
public class ShaderCacheBuilder {
    private static final Logger log = LoggerFactory.getLogger(ShaderCacheBuilder.class);

    private final ShaderClassifier classifier;

    public ShaderCacheBuilder(ShaderClassifier classifier) {
        this.classifier = classifier;
    }

    public CacheBuildResult build(Collection<MaterialRecord> records, List<PrefabMaterials> prefabs) {
        Map<String, MaterialRecord> recordsByName = new LinkedHashMap<>();
        records.forEach(r -> recordsByName.putIfAbsent(r.getName(), r));

        Map<String, ShaderDecision> decisions = new LinkedHashMap<>();
        Set<String> unmatched = new TreeSet<>();
        Set<String> referenced = new HashSet<>();

        for (PrefabMaterials group : PrefabGrouper.group(prefabs)) {
            referenced.addAll(group.materialNames());
            buildGroup(group, recordsByName, decisions, unmatched);
        }

        // Materials no prefab references
        for (MaterialRecord record : recordsByName.values()) {
            if (!referenced.contains(record.getName())) {
                record(decisions, record.getName(), classifier.classify(record));
                unmatched.add(record.getName());
            }
        }

        log.info("Shader cache built: {} materials, {} classified independently", decisions.size(), unmatched.size());
        return new CacheBuildResult(new ShaderCache(decisions), Collections.unmodifiableSortedSet(new TreeSet<>(unmatched)));
    }

    private void buildGroup(PrefabMaterials group, Map<String, MaterialRecord> recordsByName,
                            Map<String, ShaderDecision> decisions, Set<String> unmatched) {
        List<MeshMaterials> lod0 = new ArrayList<>();
        List<MeshMaterials> others = new ArrayList<>();
        for (MeshMaterials mesh : group.getMeshes()) {
            (mesh.getLodIndex() == 0 ? lod0 : others).add(mesh);
        }

        if (lod0.isEmpty()) {
            log.debug("Prefab {} has no LOD0 mesh; classifying its materials independently", group.getName());
            for (MeshMaterials mesh : others) {
                mesh.getSlots().forEach(slot -> classifyIndependently(slot, recordsByName, decisions, unmatched));
            }
            return;
        }

        // LOD0 mesh -> decision per slot index
        Map<MeshMaterials, Map<Integer, ShaderDecision>> lod0Decisions = new LinkedHashMap<>();
        for (MeshMaterials mesh : lod0) {
            Map<Integer, ShaderDecision> bySlot = new LinkedHashMap<>();
            for (MaterialSlot slot : mesh.getSlots()) {
                if (slot.getMaterialName() == null) {
                    continue;
                }
                ShaderDecision decision = decisions.containsKey(slot.getMaterialName())
                        ? decisions.get(slot.getMaterialName())
                        : classify(slot.getMaterialName(), recordsByName);
                bySlot.put(slot.getIndex(), decision);
                record(decisions, slot.getMaterialName(), decision);
            }
            lod0Decisions.put(mesh, bySlot);
        }

        for (MeshMaterials mesh : others) {
            Map<Integer, ShaderDecision> inherited = lod0Decisions.get(partnerOf(mesh, lod0));
            for (MaterialSlot slot : mesh.getSlots()) {
                if (slot.getMaterialName() == null) {
                    continue;
                }
                ShaderDecision decision = inherited.get(slot.getIndex());
                if (decision != null) {
                    record(decisions, slot.getMaterialName(), decision);
                } else {
                    classifyIndependently(slot, recordsByName, decisions, unmatched);
                }
            }
        }
    }

    private static MeshMaterials partnerOf(MeshMaterials mesh, List<MeshMaterials> lod0) {
        String base = LodNames.stripLodSuffix(mesh.getMeshName());
        return lod0.stream()
                .filter(candidate -> LodNames.stripLodSuffix(candidate.getMeshName()).equals(base))
                .findFirst()
                .orElse(lod0.get(0));
    }

    private void classifyIndependently(MaterialSlot slot, Map<String, MaterialRecord> recordsByName,
                                       Map<String, ShaderDecision> decisions, Set<String> unmatched) {
        String name = slot.getMaterialName();
        if (name == null || decisions.containsKey(name)) {
            return;
        }
        decisions.put(name, classify(name, recordsByName));
        unmatched.add(name);
    }

    private ShaderDecision classify(String materialName, Map<String, MaterialRecord> recordsByName) {
        MaterialRecord record = recordsByName.get(materialName);
        return record != null ? classifier.classify(record) : classifier.classifyByName(materialName);
    }

    private static void record(Map<String, ShaderDecision> decisions, String materialName, ShaderDecision decision) {
        ShaderDecision existing = decisions.putIfAbsent(materialName, decision);
        if (existing != null && existing.getFamily() != decision.getFamily()) {
            log.debug("{} already cached as {}; ignoring {}", materialName, existing.getFamily(), decision.getFamily());
        }
    }
}
