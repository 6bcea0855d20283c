package com.rigdef.model;

/**
 * Element that implicitly creates nodes. Legacy documents number those nodes sequentially after
 * the nodes declared before the element.
 */
public interface GeneratesNodes {

    int generatedNodeCount();

    void setGeneratedNodes(GeneratedNodeRange range);

    GeneratedNodeRange getGeneratedNodes();
}
