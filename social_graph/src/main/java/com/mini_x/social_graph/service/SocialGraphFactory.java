package com.mini_x.social_graph.service;

import java.util.concurrent.Executor;

import com.mini_x.social_graph.entity.GraphNode;
import com.mini_x.social_graph.repo.SetStore;

/**
 * Builds graphs that share one store connection, sampler and namespace.
 */
public class SocialGraphFactory {

    private final SetStore setStore;
    private final BoundedRandomSampler sampler;
    private final Executor executor;
    private final String namespace;

    public SocialGraphFactory(SetStore setStore, BoundedRandomSampler sampler, Executor executor, String namespace) {
        this.setStore = setStore;
        this.sampler = sampler;
        this.executor = executor;
        this.namespace = namespace;
    }


    public SocialGraph forUser(Object id) {
        return forUser(id, null);
    }

    public SocialGraph forUser(Object id, String prefix) {
        GraphNode node = GraphNode.of(namespace, prefix, TargetNormalizer.identityOf(id));
        return new SocialGraphImp(node, setStore, sampler);
    }

    public AsyncSocialGraph async(SocialGraph graph) {
        return new AsyncSocialGraph(graph, executor);
    }

    public String getNamespace() {
        return namespace;
    }
}
