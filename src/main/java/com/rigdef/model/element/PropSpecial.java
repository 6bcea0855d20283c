package com.rigdef.model.element;

import java.util.Locale;

/**
 * Special behavior of a prop, detected from its mesh name.
 */
public enum PropSpecial {
    NONE,
    MIRROR_LEFT,
    MIRROR_RIGHT,
    DASHBOARD_LEFT,
    DASHBOARD_RIGHT,
    AERO_PROP_SPIN,
    AERO_PROP_BLADE,
    DRIVER_SEAT,
    DRIVER_SEAT_2,
    BEACON,
    REDBEACON,
    LIGHTBAR;

    /**
     * Mirrors and dashboards match anywhere in the mesh name, the rest match a case-insensitive
     * prefix.
     */
    public static PropSpecial fromMeshName(String meshName) {
        if (meshName.contains("leftmirror")) {
            return MIRROR_LEFT;
        }
        if (meshName.contains("rightmirror")) {
            return MIRROR_RIGHT;
        }
        if (meshName.contains("dashboard-rh")) {
            return DASHBOARD_RIGHT;
        }
        if (meshName.contains("dashboard")) {
            return DASHBOARD_LEFT;
        }
        String lower = meshName.toLowerCase(Locale.ROOT);
        if (lower.startsWith("spinprop")) {
            return AERO_PROP_SPIN;
        }
        if (lower.startsWith("pale")) {
            return AERO_PROP_BLADE;
        }
        if (lower.startsWith("seat2")) {
            return DRIVER_SEAT_2;
        }
        if (lower.startsWith("seat")) {
            return DRIVER_SEAT;
        }
        if (lower.startsWith("beacon")) {
            return BEACON;
        }
        if (lower.startsWith("redbeacon")) {
            return REDBEACON;
        }
        if (lower.startsWith("lightb")) {
            return LIGHTBAR;
        }
        return NONE;
    }

    public boolean isDashboard() {
        return this == DASHBOARD_LEFT || this == DASHBOARD_RIGHT;
    }
}
