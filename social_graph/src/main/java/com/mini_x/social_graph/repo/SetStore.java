package com.mini_x.social_graph.repo;

import java.util.Collection;
import java.util.Set;



/**
 * Set primitives the graph is built on. Mirrors the Redis set commands
 * (SADD, SREM, SMEMBERS, SCARD, SISMEMBER, SINTER, SDIFF, SRANDMEMBER).
 */
public interface SetStore {

    long add(String key, String... members);

    long remove(String key, String... members);

    Set<String> members(String key);

    long cardinality(String key);

    boolean isMember(String key, String member);

    Set<String> intersect(String key, Collection<String> otherKeys);

    Set<String> diff(String key, Collection<String> otherKeys);

    /**
     * One random member, left in the set. Consecutive calls may return the
     * same member. {@code null} when the set is empty.
     */
    String randomMember(String key);

    /**
     * Starts a pipelined batch. Nothing reaches the store until
     * {@link SetBatch#execute()}.
     */
    SetBatch batch();
}
