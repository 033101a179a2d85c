package com.materialport.converter.materiallist;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.model.MaterialSlot;
import com.materialport.converter.model.MeshMaterials;
import com.materialport.converter.model.PrefabMaterials;

/**
 * Parser for material list manifests.
 *
 * Format:
 * - Prefab:  Prefab Name: SM_Env_Tree_01
 * - Mesh:    Mesh Name: SM_Env_Tree_01_LOD1
 * - Slot:    Slot: Tree_Mat_01 (Tree_Texture_01)
 * - Slot:    Slot: Crystal_Mat (Uses custom shader)
 * - Comments: # comment, // comment
 *
 * Indentation is ignored; each line says what it is.
 */
public class MaterialListParser {
    private static final Logger log = LoggerFactory.getLogger(MaterialListParser.class);

    static final String CUSTOM_SHADER_NOTE = "Uses custom shader";

    private static final Pattern PREFAB_PATTERN = Pattern.compile("^Prefab\\s+Name:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MESH_PATTERN = Pattern.compile("^Mesh\\s+Name:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SLOT_PATTERN = Pattern.compile(
            "^Slot:\\s*(.*?)\\s*(?:\\(([^()]*)\\))?$",
            Pattern.CASE_INSENSITIVE
    );

    public MaterialListDocument parse(Path manifest) throws IOException {
        List<String> lines = Files.readAllLines(manifest, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public MaterialListDocument parse(List<String> lines) {
        MaterialListDocument doc = new MaterialListDocument();
        State state = new State(doc);

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            // Skip empty lines and comments
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("//")) {
                continue;
            }

            try {
                parseLine(trimmed, lineNum, state);
            } catch (IllegalArgumentException e) {
                doc.addNote("Line " + lineNum + ": " + e.getMessage());
                log.debug("Skipping material list line {}: {}", lineNum, e.getMessage());
            }
        }
        state.flushPrefab();

        log.debug("Parsed {} prefab entries from material list", doc.getPrefabs().size());
        return doc;
    }

    private void parseLine(String line, int lineNum, State state) {
        Matcher prefab = PREFAB_PATTERN.matcher(line);
        if (prefab.matches()) {
            String name = prefab.group(1).strip();
            if (name.isEmpty()) {
                state.flushPrefab();
                throw new IllegalArgumentException("Prefab line without a name");
            }
            state.startPrefab(name);
            return;
        }

        Matcher mesh = MESH_PATTERN.matcher(line);
        if (mesh.matches()) {
            String name = mesh.group(1).strip();
            if (state.prefab == null) {
                state.doc.addWarning("Line " + lineNum + ": mesh '" + name + "' appears outside a prefab");
                log.warn("Mesh {} on line {} appears outside a prefab, skipping", name, lineNum);
                return;
            }
            if (name.isEmpty()) {
                state.flushMesh();
                throw new IllegalArgumentException("Mesh line without a name");
            }
            state.startMesh(name);
            return;
        }

        Matcher slot = SLOT_PATTERN.matcher(line);
        if (slot.matches()) {
            if (state.mesh == null) {
                state.doc.addWarning("Line " + lineNum + ": slot appears outside a mesh");
                log.warn("Slot on line {} appears outside a mesh, skipping", lineNum);
                return;
            }
            state.addSlot(slot.group(1).strip(), slot.group(2));
            return;
        }

        throw new IllegalArgumentException("Unrecognized line: " + line);
    }

    /**
     * Builders for the prefab and mesh currently being read.
     */
    private static final class State {
        private final MaterialListDocument doc;
        private PrefabMaterials.PrefabMaterialsBuilder prefab;
        private MeshMaterials.MeshMaterialsBuilder mesh;
        private int slotIndex;

        private State(MaterialListDocument doc) {
            this.doc = doc;
        }

        void startPrefab(String name) {
            flushPrefab();
            prefab = PrefabMaterials.builder().name(name);
        }

        void startMesh(String name) {
            flushMesh();
            mesh = MeshMaterials.builder().meshName(name).lodIndex(LodNames.lodIndex(name));
            slotIndex = 0;
        }

        void addSlot(String materialName, String note) {
            String trimmedNote = note == null ? null : note.strip();
            boolean custom = CUSTOM_SHADER_NOTE.equalsIgnoreCase(trimmedNote);
            String hint = custom || trimmedNote == null || trimmedNote.isEmpty() ? null : trimmedNote;
            mesh.slot(new MaterialSlot(slotIndex++, materialName.isEmpty() ? null : materialName, hint, custom));
        }

        void flushMesh() {
            if (mesh != null && prefab != null) {
                prefab.mesh(mesh.build());
            }
            mesh = null;
        }

        void flushPrefab() {
            flushMesh();
            if (prefab != null) {
                doc.addPrefab(prefab.build());
            }
            prefab = null;
        }
    }
}
