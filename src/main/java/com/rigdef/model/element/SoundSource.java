package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class SoundSource {
    private NodeRef node;
    private String soundScriptName;
}
