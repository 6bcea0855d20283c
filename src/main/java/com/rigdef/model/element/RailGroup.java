package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class RailGroup {
    private int id;
    private List<NodeRef> nodes = new ArrayList<>();
}
