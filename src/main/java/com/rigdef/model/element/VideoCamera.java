package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;

import lombok.Data;

@Data
public class VideoCamera {
    private NodeRef referenceNode;
    private NodeRef leftNode;
    private NodeRef bottomNode;
    /** {@code null} when written as "-1". */
    private NodeRef altReferenceNode;
    /** {@code null} when written as "-1". */
    private NodeRef altOrientationNode;
    private Vector3 offset = new Vector3();
    private Vector3 rotation = new Vector3();
    private float fieldOfView;
    private int textureWidth;
    private int textureHeight;
    private float minClipDistance;
    private float maxClipDistance;
    private int cameraRole;
    private int cameraMode;
    private String materialName;
    private String cameraName = "";
}
