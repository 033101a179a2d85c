package com.materialport.converter.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class MeshMaterials {
    @NonNull String meshName;
    int lodIndex;
    @Singular List<MaterialSlot> slots;
}
