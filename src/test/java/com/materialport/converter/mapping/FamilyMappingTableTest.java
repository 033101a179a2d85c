package com.materialport.converter.mapping;

import org.junit.jupiter.api.Test;

import com.materialport.converter.model.ShaderFamily;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FamilyMappingTable and the default MappingTables.
 */
class FamilyMappingTableTest {

    @Test
    void testEntriesKeyedByNormalizedSourceFirstWins() {
        FamilyMappingTable table = FamilyMappingTable.builder(ShaderFamily.WATER)
                .scalar("_Foam_Depth", "foam_depth")
                .scalar("Foam_Depth", "ignored")
                .build();

        assertThat(table.getScalars()).containsOnlyKeys("foam_depth");
        assertThat(table.scalar("_FOAM_DEPTH")).hasValueSatisfying(m -> assertThat(m.getTarget()).isEqualTo("foam_depth"));
        assertThat(table.scalar("_Other")).isEmpty();
    }

    @Test
    void testUniformOrderFollowsDeclaration() {
        FamilyMappingTable table = FamilyMappingTable.builder(ShaderFamily.CRYSTAL)
                .texture("_Top", "top_albedo")
                .texture("_Base", "base_albedo")
                .scalar("_Opacity", "opacity")
                .scalar("_Alpha", "opacity")
                .color("_Tint", "tint")
                .defaultValue("fresnel_power", 2.0)
                .defaultValue("opacity", 0.7)
                .build();

        assertThat(table.getUniformOrder()).containsExactly("top_albedo", "base_albedo", "opacity", "tint", "fresnel_power");
    }

    @Test
    void testInheritingPutsOwnEntriesFirst() {
        FamilyMappingTable base = FamilyMappingTable.builder(ShaderFamily.GENERIC_OPAQUE)
                .texture("_Normal", "normal_texture")
                .texture("_Emission", "emission_texture")
                .defaultValue("smoothness", 0.5)
                .build();
        FamilyMappingTable own = FamilyMappingTable.builder(ShaderFamily.VEGETATION)
                .texture("_Normal", "leaf_normal")
                .defaultValue("leaf_smoothness", 0.1)
                .build();

        FamilyMappingTable merged = own.inheriting(base);

        assertThat(merged.getFamily()).isEqualTo(ShaderFamily.VEGETATION);
        assertThat(merged.getTextures().get("normal").getTarget()).isEqualTo("leaf_normal");
        assertThat(merged.getTextures()).containsKeys("emission");
        assertThat(merged.getDefaults()).containsOnlyKeys("leaf_smoothness");
        assertThat(merged.getUniformOrder()).startsWith("leaf_normal", "emission_texture");
    }

    @Test
    void testDefaultTablesCoverEveryFamily() {
        MappingTables tables = MappingTables.defaults();

        for (ShaderFamily family : ShaderFamily.values()) {
            assertThat(tables.forFamily(family)).isNotNull();
            assertThat(tables.forFamily(family).getFamily()).isEqualTo(family);
        }
        assertThat(tables.forFamily(ShaderFamily.SKY_DOME).scalar("_Distance"))
                .hasValueSatisfying(m -> assertThat(m.getTarget()).isEqualTo("distance_"));
        // inherited from the generic table
        assertThat(tables.forFamily(ShaderFamily.SKY_DOME).getTextures()).containsKey("basemap");
    }

    @Test
    void testSpecialPropertySets() {
        MappingTables tables = MappingTables.defaults();

        assertThat(tables.isBooleanProperty("_Enable_Fresnel")).isTrue();
        assertThat(tables.isBooleanProperty("enable_fresnel")).isTrue();
        assertThat(tables.isBooleanProperty("_Fresnel_Power")).isFalse();
        assertThat(tables.needsAlphaFix("_Deep_Color")).isTrue();
        assertThat(tables.needsAlphaFix("_Fog_Color")).isFalse();
    }

    @Test
    void testPropertyMappingRename() {
        PropertyMapping mapping = PropertyMapping.rename("_Metallic", "metallic");

        assertThat(mapping.getScale()).isEqualTo(1.0);
        assertThat(mapping.getColorSpace()).isEqualTo(ColorSpace.NONE);
        assertThatThrownBy(() -> PropertyMapping.rename(null, "x")).isInstanceOf(NullPointerException.class);
    }
}
