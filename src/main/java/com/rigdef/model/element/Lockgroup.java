package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Lockgroup {
    private int number;
    private List<NodeRef> nodes = new ArrayList<>();
}
