package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Hook {
    private NodeRef node;

    private float hookRange = 0.4f;
    private float speedCoef = 1f;
    private float maxForce = 10000000f;
    private float timer = 5f;
    private int hookgroup = -1;
    private int lockgroup = -1;
    private float minRangeMeters;

    private boolean selfLock;
    private boolean autoLock;
    private boolean noDisable;
    private boolean noRope;
    private boolean visible;
}
