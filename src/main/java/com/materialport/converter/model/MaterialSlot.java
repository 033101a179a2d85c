package com.materialport.converter.model;

import lombok.Value;

/**
 * One material assignment of a mesh. The material name is null when the
 * manifest lists an empty slot.
 */
@Value
public class MaterialSlot {
    int index;
    String materialName;
    String textureHint;
    boolean customShader;
}
