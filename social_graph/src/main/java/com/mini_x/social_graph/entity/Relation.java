package com.mini_x.social_graph.entity;

public enum Relation {

    FOLLOWING("following"),
    FOLLOWERS("followers");

    private final String suffix;

    Relation(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }
}
