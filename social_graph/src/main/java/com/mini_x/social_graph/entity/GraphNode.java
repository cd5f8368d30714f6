package com.mini_x.social_graph.entity;

import java.util.Objects;

import com.mini_x.social_graph.exception.InvalidInputException;

/**
 * Keys owned by one identity in the store.
 *
 * Redis Structure:
 *   (namespace:)(prefix:)id:following = set(ids)
 *   (namespace:)(prefix:)id:followers = set(ids)
 */
public final class GraphNode {

    private final String id;
    private final String keyPrefix;
    private final String key;
    private final String followingKey;
    private final String followersKey;

    public GraphNode(String id, String keyPrefix, String key, String followingKey, String followersKey) {
        this.id = id;
        this.keyPrefix = keyPrefix;
        this.key = key;
        this.followingKey = followingKey;
        this.followersKey = followersKey;
    }

    public static GraphNode of(String namespace, String prefix, String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("ID can not be empty");
        }
        String keyPrefix = segment(namespace) + segment(prefix);
        String key = keyPrefix + id;
        return new GraphNode(id, keyPrefix, key,
                key + ":" + Relation.FOLLOWING.getSuffix(),
                key + ":" + Relation.FOLLOWERS.getSuffix());
    }

    public String keyFor(Relation relation) {
        return relation == Relation.FOLLOWING ? followingKey : followersKey;
    }

    // key of another identity living under the same prefix
    public String keyOf(String otherId, Relation relation) {
        return keyPrefix + otherId + ":" + relation.getSuffix();
    }

    public String getId() {
        return id;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public String getKey() {
        return key;
    }

    public String getFollowingKey() {
        return followingKey;
    }

    public String getFollowersKey() {
        return followersKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return Objects.equals(id, that.id) && Objects.equals(keyPrefix, that.keyPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, keyPrefix);
    }

    @Override
    public String toString() {
        return "GraphNode[" + key + "]";
    }

    private static String segment(String part) {
        return (part == null || part.isBlank()) ? "" : part + ":";
    }
}
