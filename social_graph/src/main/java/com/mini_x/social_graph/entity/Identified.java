package com.mini_x.social_graph.entity;

/**
 * Anything that carries a graph identity. Passing such an object as a
 * target is the same as passing its id.
 */
public interface Identified {

    Object getId();
}
