package com.mini_x.social_graph.service;

/**
 * Receives the outcome of an asynchronous graph call. Exactly one of
 * {@code error} and {@code result} is meaningful: on failure {@code error} is
 * set and {@code result} is null.
 */
@FunctionalInterface
public interface CompletionHandler<T> {

    void onComplete(Throwable error, T result);

    static <T> CompletionHandler<T> ignore() {
        return (error, result) -> { };
    }
}
