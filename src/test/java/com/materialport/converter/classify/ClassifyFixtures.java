package com.materialport.converter.classify;

import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.TextureRef;
import com.materialport.converter.model.Vector2;

/**
 * Material records for classification tests.
 */
final class ClassifyFixtures {

    private ClassifyFixtures() {
    }

    static TextureRef texture(String identifier) {
        return new TextureRef(identifier, Vector2.ONE, Vector2.ZERO);
    }

    static MaterialRecord foliage(String name) {
        return MaterialRecord.builder()
                .name(name)
                .texture("_Leaf_Texture", texture("11111111111111111111111111111111"))
                .scalar("_Wind_Direction", 45.0)
                .build();
    }

    static MaterialRecord plain(String name) {
        return MaterialRecord.builder()
                .name(name)
                .texture("_Albedo_Map", texture("22222222222222222222222222222222"))
                .scalar("_Smoothness", 0.5)
                .build();
    }
}
