package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

/**
 * Sound source audible only from certain cameras.
 */
@Data
public class SoundSource2 {

    public enum Mode {
        /** Audible from every camera ({@code -2}). */
        ALWAYS,
        /** Audible from outside cameras only ({@code -1}). */
        OUTSIDE,
        CINECAM
    }

    private NodeRef node;
    private Mode mode = Mode.ALWAYS;
    private int cinecamIndex;
    private String soundScriptName;
}
