package com.mini_x.social_graph.service;


import java.util.List;
import java.util.Set;

import com.mini_x.social_graph.entity.GraphNode;
import com.mini_x.social_graph.entity.Identified;



/**
 * Follow graph seen from one identity. Targets are identities,
 * {@link Identified} objects or one level of nested collections of those.
 */
public interface SocialGraph extends Identified {

    @Override
    String getId();

    GraphNode getNode();

    long follow(List<?> targets);

    long unfollow(List<?> targets);

    Set<String> getFollowing();

    Set<String> getFollowers();

    long countFollowing();

    long countFollowers();

    boolean isFollowing(Object target);

    boolean hasFollower(Object target);

    Set<String> commonFollowers(List<?> others);

    Set<String> commonFollowing(List<?> others);

    Set<String> differentFollowers(List<?> others);

    Set<String> differentFollowing(List<?> others);

    List<String> randomFollowers(int count);

    List<String> randomFollowing(int count);

}
