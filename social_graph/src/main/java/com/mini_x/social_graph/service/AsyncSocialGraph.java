package com.mini_x.social_graph.service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Non-blocking face of a {@link SocialGraph}. Each call runs on the given
 * executor, hands its outcome to the handler and then completes the returned
 * future. Store errors and
 * {@link com.mini_x.social_graph.exception.InvalidInputException}s reach the
 * handler unwrapped.
 *
 * There is no timeout here; callers bound a call with
 * {@link CompletableFuture#orTimeout}.
 */
public class AsyncSocialGraph {

    private final SocialGraph graph;
    private final Executor executor;

    public AsyncSocialGraph(SocialGraph graph, Executor executor) {
        this.graph = graph;
        this.executor = executor;
    }


    public SocialGraph getGraph() {
        return graph;
    }

    public CompletableFuture<Long> follow(List<?> targets, CompletionHandler<Long> handler) {
        return submit(() -> graph.follow(targets), handler);
    }

    public CompletableFuture<Long> unfollow(List<?> targets, CompletionHandler<Long> handler) {
        return submit(() -> graph.unfollow(targets), handler);
    }

    public CompletableFuture<Set<String>> getFollowing(CompletionHandler<Set<String>> handler) {
        return submit(graph::getFollowing, handler);
    }

    public CompletableFuture<Set<String>> getFollowers(CompletionHandler<Set<String>> handler) {
        return submit(graph::getFollowers, handler);
    }

    public CompletableFuture<Long> countFollowing(CompletionHandler<Long> handler) {
        return submit(graph::countFollowing, handler);
    }

    public CompletableFuture<Long> countFollowers(CompletionHandler<Long> handler) {
        return submit(graph::countFollowers, handler);
    }

    public CompletableFuture<Boolean> isFollowing(Object target, CompletionHandler<Boolean> handler) {
        return submit(() -> graph.isFollowing(target), handler);
    }

    public CompletableFuture<Boolean> hasFollower(Object target, CompletionHandler<Boolean> handler) {
        return submit(() -> graph.hasFollower(target), handler);
    }

    public CompletableFuture<Set<String>> commonFollowers(List<?> others, CompletionHandler<Set<String>> handler) {
        return submit(() -> graph.commonFollowers(others), handler);
    }

    public CompletableFuture<Set<String>> commonFollowing(List<?> others, CompletionHandler<Set<String>> handler) {
        return submit(() -> graph.commonFollowing(others), handler);
    }

    public CompletableFuture<Set<String>> differentFollowers(List<?> others, CompletionHandler<Set<String>> handler) {
        return submit(() -> graph.differentFollowers(others), handler);
    }

    public CompletableFuture<Set<String>> differentFollowing(List<?> others, CompletionHandler<Set<String>> handler) {
        return submit(() -> graph.differentFollowing(others), handler);
    }

    public CompletableFuture<List<String>> randomFollowers(int count, CompletionHandler<List<String>> handler) {
        return submit(() -> graph.randomFollowers(count), handler);
    }

    public CompletableFuture<List<String>> randomFollowing(int count, CompletionHandler<List<String>> handler) {
        return submit(() -> graph.randomFollowing(count), handler);
    }


    private <T> CompletableFuture<T> submit(Supplier<T> call, CompletionHandler<T> handler) {
        CompletableFuture<T> future = new CompletableFuture<>();
        executor.execute(() -> {
            T result = null;
            Throwable failure = null;
            try {
                result = call.get();
            } catch (Throwable e) {
                failure = e;
            }
            try {
                handler.onComplete(failure, result);
            } finally {
                if (failure != null) {
                    future.completeExceptionally(failure);
                } else {
                    future.complete(result);
                }
            }
            // the caller has been told, the worker thread still has to see the Error
            if (failure instanceof Error) {
                throw (Error) failure;
            }
        });
        return future;
    }
}
