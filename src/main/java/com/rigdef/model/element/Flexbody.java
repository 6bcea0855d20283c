package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.CameraSettings;
import com.rigdef.model.NodeRange;
import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;

import lombok.Data;

@Data
public class Flexbody {
    private NodeRef referenceNode;
    private NodeRef xAxisNode;
    private NodeRef yAxisNode;
    private Vector3 offset = new Vector3();
    private Vector3 rotation = new Vector3();
    private String meshName;

    /** Nodes that deform the mesh, from "forset". */
    private List<NodeRange> nodeListToImport = new ArrayList<>();
    private CameraSettings cameraSettings = new CameraSettings();
}
