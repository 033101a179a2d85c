package com.materialport.converter.materiallist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LodNames.
 */
class LodNamesTest {

    @ParameterizedTest
    @CsvSource({
            "SM_Tree_01_LOD0, 0",
            "SM_Tree_01_LOD3, 3",
            "SM_Tree_01_lod2, 2",
            "SM_Tree_01, 0",
            "SM_LOD1_Tree, 0",
            "SM_Tree_LOD99999999999, 2147483647"
    })
    void testLodIndex(String name, int expected) {
        assertThat(LodNames.lodIndex(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "SM_Tree_01_LOD0, SM_Tree_01",
            "SM_Tree_01_LOD12, SM_Tree_01",
            "SM_Tree_01, SM_Tree_01",
            "SM_LOD1_Tree, SM_LOD1_Tree"
    })
    void testStripLodSuffix(String name, String expected) {
        assertThat(LodNames.stripLodSuffix(name)).isEqualTo(expected);
    }

    @Test
    void testNullName() {
        assertThat(LodNames.lodIndex(null)).isZero();
        assertThat(LodNames.stripLodSuffix(null)).isNull();
    }
}
