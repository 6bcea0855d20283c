package com.rigdef.model;

import lombok.Data;

/**
 * Visibility of a prop or flexbody depending on the active camera.
 */
@Data
public class CameraSettings {

    public enum Mode {
        /** Visible from every camera ({@code -2}). */
        ALWAYS,
        /** Visible only from external cameras ({@code -1}). */
        EXTERNAL,
        /** Visible only from the cinecam with {@link CameraSettings#getCinecamIndex()}. */
        CINECAM
    }

    private Mode mode = Mode.ALWAYS;
    private int cinecamIndex;
}
