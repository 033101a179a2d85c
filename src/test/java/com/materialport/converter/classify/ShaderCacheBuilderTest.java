package com.materialport.converter.classify;

import org.junit.jupiter.api.Test;

import com.materialport.converter.materiallist.LodNames;
import com.materialport.converter.model.DecisionBasis;
import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.MaterialSlot;
import com.materialport.converter.model.MeshMaterials;
import com.materialport.converter.model.PrefabMaterials;
import com.materialport.converter.model.ShaderFamily;

import java.util.ArrayList;
import java.util.List;

import static com.materialport.converter.classify.ClassifyFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ShaderCacheBuilder.
 */
class ShaderCacheBuilderTest {

    private final ShaderCacheBuilder builder = new ShaderCacheBuilder(new ShaderClassifier());

    @Test
    void testLodMaterialsInheritLod0Decision() {
        List<MaterialRecord> records = List.of(foliage("Tree_Mat"), plain("Rock_Like_LOD1_Mat"));
        List<PrefabMaterials> prefabs = List.of(
                prefab("SM_Tree_LOD0", mesh("SM_Tree_LOD0", "Tree_Mat")),
                prefab("SM_Tree_LOD1", mesh("SM_Tree_LOD1", "Rock_Like_LOD1_Mat")));

        CacheBuildResult result = builder.build(records, prefabs);

        ShaderCache cache = result.getCache();
        assertThat(cache.get("Tree_Mat")).hasValueSatisfying(d -> assertThat(d.getFamily()).isEqualTo(ShaderFamily.VEGETATION));
        assertThat(cache.get("Rock_Like_LOD1_Mat")).isEqualTo(cache.get("Tree_Mat"));
        assertThat(result.getUnmatched()).isEmpty();
    }

    @Test
    void testLodMeshPairedByBaseName() {
        List<MaterialRecord> records = List.of(foliage("Pine_Leaves"), plain("Rock_Base"), plain("Pine_LOD2"));
        List<PrefabMaterials> prefabs = List.of(PrefabMaterials.builder()
                .name("SM_Group")
                .mesh(mesh("SM_Rock_LOD0", "Rock_Base"))
                .mesh(mesh("SM_Pine_LOD0", "Pine_Leaves"))
                .mesh(mesh("SM_Pine_LOD2", "Pine_LOD2"))
                .build());

        ShaderCache cache = builder.build(records, prefabs).getCache();

        assertThat(cache.get("Pine_LOD2")).isEqualTo(cache.get("Pine_Leaves"));
        assertThat(cache.get("Rock_Base")).hasValueSatisfying(d -> assertThat(d.getBasis()).isEqualTo(DecisionBasis.DEFAULT));
    }

    @Test
    void testSlotWithoutLod0CounterpartClassifiedIndependently() {
        List<MaterialRecord> records = List.of(foliage("Bush_Mat"), plain("Water_Extra"));
        List<PrefabMaterials> prefabs = List.of(PrefabMaterials.builder()
                .name("SM_Bush")
                .mesh(mesh("SM_Bush_LOD0", "Bush_Mat"))
                .mesh(mesh("SM_Bush_LOD1", "Bush_Mat", "Water_Extra"))
                .build());

        CacheBuildResult result = builder.build(records, prefabs);

        assertThat(result.getCache().get("Water_Extra"))
                .hasValueSatisfying(d -> assertThat(d.getFamily()).isEqualTo(ShaderFamily.WATER));
        assertThat(result.getUnmatched()).containsExactly("Water_Extra");
    }

    @Test
    void testPrefabWithoutLod0() {
        List<PrefabMaterials> prefabs = List.of(prefab("SM_Far", mesh("SM_Far_LOD3", "Far_Mat")));

        CacheBuildResult result = builder.build(List.of(plain("Far_Mat")), prefabs);

        assertThat(result.getCache().contains("Far_Mat")).isTrue();
        assertThat(result.getUnmatched()).containsExactly("Far_Mat");
    }

    @Test
    void testUnreferencedRecordsAndManifestOnlyNames() {
        List<MaterialRecord> records = List.of(foliage("Tree_Mat"), plain("Loose_Rock"));
        List<PrefabMaterials> prefabs = List.of(prefab("SM_Gem", mesh("SM_Gem", "Ruby_Gem_Mat")));

        CacheBuildResult result = builder.build(records, prefabs);

        assertThat(result.getCache().size()).isEqualTo(3);
        assertThat(result.getCache().get("Ruby_Gem_Mat"))
                .hasValueSatisfying(d -> assertThat(d.getFamily()).isEqualTo(ShaderFamily.CRYSTAL));
        assertThat(result.getUnmatched()).containsExactly("Loose_Rock", "Tree_Mat");
    }

    @Test
    void testFirstDecisionForNameWins() {
        List<MaterialRecord> records = List.of(foliage("Shared_Mat"), plain("Water_Top"));
        List<PrefabMaterials> prefabs = List.of(
                prefab("SM_A", mesh("SM_A_LOD0", "Shared_Mat")),
                prefab("SM_B", mesh("SM_B_LOD0", "Water_Top"), mesh("SM_B_LOD1", "Shared_Mat")));

        ShaderCache cache = builder.build(records, prefabs).getCache();

        assertThat(cache.get("Shared_Mat"))
                .hasValueSatisfying(d -> assertThat(d.getFamily()).isEqualTo(ShaderFamily.VEGETATION));
    }

    @Test
    void testInheritedNameNotReportedAsUnmatched() {
        List<MaterialRecord> records = List.of(foliage("Shared_Mat"));
        List<PrefabMaterials> prefabs = List.of(
                prefab("Rock_A", mesh("Rock_A_LOD0", "Shared_Mat")),
                prefab("Rock_B", mesh("Rock_B_LOD2", "Shared_Mat")));

        CacheBuildResult result = builder.build(records, prefabs);

        assertThat(result.getCache().get("Shared_Mat"))
                .hasValueSatisfying(d -> assertThat(d.getFamily()).isEqualTo(ShaderFamily.VEGETATION));
        assertThat(result.getUnmatched()).isEmpty();
    }

    @Test
    void testNameSeenTwiceOutsideInheritanceReportedOnce() {
        List<PrefabMaterials> prefabs = List.of(
                prefab("SM_Far_A", mesh("SM_Far_A_LOD3", "Far_Mat")),
                prefab("SM_Far_B", mesh("SM_Far_B_LOD2", "Far_Mat")));

        CacheBuildResult result = builder.build(List.of(plain("Far_Mat")), prefabs);

        assertThat(result.getUnmatched()).containsExactly("Far_Mat");
    }

    private static MeshMaterials mesh(String name, String... materials) {
        List<MaterialSlot> slots = new ArrayList<>();
        for (int i = 0; i < materials.length; i++) {
            slots.add(new MaterialSlot(i, materials[i], null, false));
        }
        return MeshMaterials.builder().meshName(name).lodIndex(LodNames.lodIndex(name)).slots(slots).build();
    }

    private static PrefabMaterials prefab(String name, MeshMaterials... meshes) {
        return PrefabMaterials.builder().name(name).meshes(List.of(meshes)).build();
    }
}
