package com.mini_x.social_graph.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mini_x.social_graph.entity.GraphNode;
import com.mini_x.social_graph.entity.Relation;
import com.mini_x.social_graph.exception.InvalidInputException;
import com.mini_x.social_graph.repo.SetBatch;
import com.mini_x.social_graph.repo.SetStore;



/**
 * Architecture Flow:
 * Host application → Social Graph → Set Store → Redis
 */
public class SocialGraphImp implements SocialGraph {

    private static final Logger logger = LoggerFactory.getLogger(SocialGraphImp.class);

    private final GraphNode node;
    private final SetStore setStore;
    private final BoundedRandomSampler sampler;


    public SocialGraphImp(GraphNode node, SetStore setStore, BoundedRandomSampler sampler) {
        this.node = node;
        this.setStore = setStore;
        this.sampler = sampler;
    }


    @Override
    public String getId() {
        return node.getId();
    }

    @Override
    public GraphNode getNode() {
        return node;
    }

    @Override
    public long follow(List<?> targets) {
        List<Object> users = TargetNormalizer.flatten(targets);
        if (users.isEmpty()) {
            return 0;
        }
        SetBatch batch = setStore.batch();
        for (Object user : users) {
            batch.add(keyOf(user, Relation.FOLLOWERS), node.getId());
            batch.add(node.getFollowingKey(), TargetNormalizer.identityOf(user));
        }
        long followed = countChanged(batch.execute());
        logger.debug("User {} followed {} of {} users", node.getId(), followed, users.size());
        return followed;
    }

    @Override
    public long unfollow(List<?> targets) {
        List<Object> users = TargetNormalizer.flatten(targets);
        if (users.isEmpty()) {
            return 0;
        }
        SetBatch batch = setStore.batch();
        for (Object user : users) {
            batch.remove(keyOf(user, Relation.FOLLOWERS), node.getId());
            batch.remove(node.getFollowingKey(), TargetNormalizer.identityOf(user));
        }
        long unfollowed = countChanged(batch.execute());
        logger.debug("User {} unfollowed {} of {} users", node.getId(), unfollowed, users.size());
        return unfollowed;
    }

    @Override
    public Set<String> getFollowing() {
        return setStore.members(node.getFollowingKey());
    }

    @Override
    public Set<String> getFollowers() {
        return setStore.members(node.getFollowersKey());
    }

    @Override
    public long countFollowing() {
        return setStore.cardinality(node.getFollowingKey());
    }

    @Override
    public long countFollowers() {
        return setStore.cardinality(node.getFollowersKey());
    }

    @Override
    public boolean isFollowing(Object target) {
        return setStore.isMember(node.getFollowingKey(), TargetNormalizer.identityOf(target));
    }

    @Override
    public boolean hasFollower(Object target) {
        return setStore.isMember(node.getFollowersKey(), TargetNormalizer.identityOf(target));
    }

    @Override
    public Set<String> commonFollowers(List<?> others) {
        return setStore.intersect(node.getFollowersKey(), keysOf(others, Relation.FOLLOWERS));
    }

    @Override
    public Set<String> commonFollowing(List<?> others) {
        return setStore.intersect(node.getFollowingKey(), keysOf(others, Relation.FOLLOWING));
    }

    @Override
    public Set<String> differentFollowers(List<?> others) {
        return setStore.diff(node.getFollowersKey(), keysOf(others, Relation.FOLLOWERS));
    }

    @Override
    public Set<String> differentFollowing(List<?> others) {
        return setStore.diff(node.getFollowingKey(), keysOf(others, Relation.FOLLOWING));
    }

    @Override
    public List<String> randomFollowers(int count) {
        return random(Relation.FOLLOWERS, count);
    }

    @Override
    public List<String> randomFollowing(int count) {
        return random(Relation.FOLLOWING, count);
    }

    @Override
    public String toString() {
        return "SocialGraph[" + node.getKey() + "]";
    }


    private List<String> random(Relation relation, int count) {
        if (count < 0) {
            throw new InvalidInputException("Random count can not be negative: " + count);
        }
        if (count == 0) {
            return Collections.emptyList();
        }
        String key = node.keyFor(relation);
        long size = setStore.cardinality(key);
        // nothing to sample when the whole set fits in the answer
        if (size <= count) {
            return new ArrayList<>(setStore.members(key));
        }
        return sampler.sample(key, count, size);
    }

    // a SocialGraph target is addressed through its own keys, a bare id under our prefix
    private String keyOf(Object target, Relation relation) {
        if (target instanceof SocialGraph) {
            return ((SocialGraph) target).getNode().keyFor(relation);
        }
        return node.keyOf(TargetNormalizer.identityOf(target), relation);
    }

    private List<String> keysOf(List<?> targets, Relation relation) {
        List<String> keys = new ArrayList<>();
        for (Object target : TargetNormalizer.flatten(targets)) {
            keys.add(keyOf(target, relation));
        }
        return keys;
    }

    // replies alternate (target's followers set, our following set); count changes to ours
    private static long countChanged(List<Object> replies) {
        long changed = 0;
        for (int i = 1; i < replies.size(); i += 2) {
            Object reply = replies.get(i);
            if (reply instanceof Number) {
                changed += ((Number) reply).longValue();
            }
        }
        return changed;
    }
}
