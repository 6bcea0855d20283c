package com.rigdef.model.element;

import lombok.Data;

@Data
public class CollisionRange {
    private float nodeCollisionRange;
}
