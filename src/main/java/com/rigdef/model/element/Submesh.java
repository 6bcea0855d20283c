package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Surface mesh made of cab triangles, started by "submesh".
 */
@Data
public class Submesh {
    private boolean backmesh;
    private List<Texcoord> texcoords = new ArrayList<>();
    private List<Cab> cabTriangles = new ArrayList<>();
}
