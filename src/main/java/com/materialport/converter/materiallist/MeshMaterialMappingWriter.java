package com.materialport.converter.materiallist;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.materialport.converter.model.MaterialSlot;
import com.materialport.converter.model.MeshMaterials;
import com.materialport.converter.model.PrefabMaterials;
import com.materialport.converter.util.FileWriteUtil;

/**
 * Writes the mesh-to-material mapping consumed when materials are reattached
 * to imported models.
 *
 * <pre>
 * {
 *   "prefabs" : [ { "name" : "SM_Tree_01", "meshes" : [
 *       { "mesh" : "SM_Tree_01_LOD0", "lod" : 0, "slots" : [ { "slot" : 0, "material" : "Leaf_Mat" } ] } ] } ],
 *   "meshes" : { "SM_Tree_01_LOD0" : [ "Leaf_Mat" ] }
 * }
 * </pre>
 *
 * Slot order is preserved; empty slots appear as {@code null}. When the
 * target file already exists, entries for prefabs and meshes not in this run
 * are kept.
 */
public class MeshMaterialMappingWriter {
    private static final Logger log = LoggerFactory.getLogger(MeshMaterialMappingWriter.class);

    public static final String FILE_NAME = "mesh_material_mapping.json";

    private final ObjectMapper objectMapper;

    public MeshMaterialMappingWriter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toJson(List<PrefabMaterials> groupedPrefabs) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode prefabsNode = root.putArray("prefabs");
        ObjectNode meshesNode = root.putObject("meshes");

        for (PrefabMaterials prefab : groupedPrefabs) {
            ObjectNode prefabNode = prefabsNode.addObject();
            prefabNode.put("name", prefab.getName());
            ArrayNode meshArray = prefabNode.putArray("meshes");

            List<MeshMaterials> byLod = prefab.getMeshes().stream()
                    .sorted(Comparator.comparingInt(MeshMaterials::getLodIndex))
                    .toList();
            for (MeshMaterials mesh : byLod) {
                ObjectNode meshNode = meshArray.addObject();
                meshNode.put("mesh", mesh.getMeshName());
                meshNode.put("lod", mesh.getLodIndex());
                ArrayNode slots = meshNode.putArray("slots");
                ArrayNode flat = meshesNode.putArray(mesh.getMeshName());

                for (MaterialSlot slot : mesh.getSlots()) {
                    ObjectNode slotNode = slots.addObject();
                    slotNode.put("slot", slot.getIndex());
                    slotNode.put("material", slot.getMaterialName());
                    if (slot.isCustomShader()) {
                        slotNode.put("customShader", true);
                    }
                    flat.add(slot.getMaterialName());
                }
            }
        }
        return root;
    }

    /**
     * Writes the mapping to {@code file}, merging with any mapping already there.
     */
    public void write(List<PrefabMaterials> groupedPrefabs, Path file) throws IOException {
        ObjectNode fresh = toJson(groupedPrefabs);
        ObjectNode merged = Files.exists(file) ? merge(readExisting(file), fresh) : fresh;
        FileWriteUtil.safeWriteString(file, objectMapper.writeValueAsString(merged) + "\n");
        log.info("Wrote mesh mapping for {} prefabs to {}", groupedPrefabs.size(), file);
    }

    private JsonNode readExisting(Path file) throws IOException {
        JsonNode existing = objectMapper.readTree(file.toFile());
        if (existing == null || !existing.isObject()) {
            log.warn("Existing mapping {} is not a JSON object; replacing it", file);
            return objectMapper.createObjectNode();
        }
        return existing;
    }

    ObjectNode merge(JsonNode existing, ObjectNode fresh) {
        ObjectNode merged = objectMapper.createObjectNode();

        Map<String, JsonNode> prefabs = new LinkedHashMap<>();
        existing.path("prefabs").forEach(p -> prefabs.put(p.path("name").asText(), p));
        fresh.path("prefabs").forEach(p -> prefabs.put(p.path("name").asText(), p));
        ArrayNode prefabArray = merged.putArray("prefabs");
        prefabs.values().forEach(prefabArray::add);

        ObjectNode meshes = merged.putObject("meshes");
        existing.path("meshes").fields().forEachRemaining(e -> meshes.set(e.getKey(), e.getValue()));
        fresh.path("meshes").fields().forEachRemaining(e -> meshes.set(e.getKey(), e.getValue()));
        return merged;
    }
}
