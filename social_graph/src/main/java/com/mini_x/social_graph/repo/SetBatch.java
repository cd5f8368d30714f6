package com.mini_x.social_graph.repo;

import java.util.List;

/**
 * Commands queued for a single round trip. Results come back in the order
 * the commands were queued. The batch is ordered, not isolated.
 */
public interface SetBatch {

    SetBatch add(String key, String... members);

    SetBatch remove(String key, String... members);

    SetBatch randomMember(String key);

    SetBatch cardinality(String key);

    int size();

    /**
     * Sends the queued commands. An empty batch returns an empty list without
     * touching the store.
     */
    List<Object> execute();
}
