package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.CameraSettings;
import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;

import lombok.Data;

@Data
public class Prop {
    private NodeRef referenceNode;
    private NodeRef xAxisNode;
    private NodeRef yAxisNode;
    private Vector3 offset = new Vector3();
    private Vector3 rotation = new Vector3();
    private String meshName;
    private PropSpecial special = PropSpecial.NONE;

    /** Set for beacon props that specify a flare. */
    private Beacon beacon;

    /** Set for dashboard props. */
    private Dashboard dashboard;

    private List<Animation> animations = new ArrayList<>();
    private CameraSettings cameraSettings = new CameraSettings();

    @Data
    public static class Beacon {
        private String flareMaterialName;
        private float red;
        private float green;
        private float blue;
    }

    @Data
    public static class Dashboard {
        private String meshName = "dirwheel.mesh";
        private Vector3 offset = new Vector3();
        private boolean offsetSet;
        private float rotationAngle = 160f;
    }
}
