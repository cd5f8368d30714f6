package com.mini_x.social_graph.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mini_x.social_graph.exception.InvalidInputException;
import com.mini_x.social_graph.repo.SetBatch;
import com.mini_x.social_graph.repo.SetStore;

/**
 * Draws up to {@code k} distinct members of a set using only the store's
 * "one random member" command.
 *
 * <p>Each round pipelines {@code oversamplingFactor * k} draws in one round
 * trip and merges the distinct results into an accumulator kept in order of
 * first acquisition. Sampling stops when:
 * <ol>
 * <li>k distinct members are collected (the first k are returned),</li>
 * <li>the accumulator holds the whole set, measured as the smaller of
 * {@code totalSize} and the set's live size, which every round reads with
 * SCARD in the same pipeline,</li>
 * <li>a round draws nothing because the set has been emptied, or</li>
 * <li>{@code max(totalSize, minRounds)} rounds have run; what was collected is
 * returned as a partial sample.</li>
 * </ol>
 *
 * <p>Draws are with replacement, so the result is an approximately uniform
 * sample, not an exact without-replacement one. The source set is never
 * modified.
 */
public class BoundedRandomSampler {

    private static final Logger logger = LoggerFactory.getLogger(BoundedRandomSampler.class);

    public static final int DEFAULT_OVERSAMPLING_FACTOR = 2;
    public static final int DEFAULT_MIN_ROUNDS = 8;

    private final SetStore setStore;
    private final int oversamplingFactor;
    private final int minRounds;

    public BoundedRandomSampler(SetStore setStore) {
        this(setStore, DEFAULT_OVERSAMPLING_FACTOR, DEFAULT_MIN_ROUNDS);
    }

    public BoundedRandomSampler(SetStore setStore, int oversamplingFactor, int minRounds) {
        if (oversamplingFactor < 1) {
            throw new IllegalArgumentException("oversamplingFactor must be at least 1, was " + oversamplingFactor);
        }
        if (minRounds < 1) {
            throw new IllegalArgumentException("minRounds must be at least 1, was " + minRounds);
        }
        this.setStore = setStore;
        this.oversamplingFactor = oversamplingFactor;
        this.minRounds = minRounds;
    }


    public List<String> sample(String key, int k, long totalSize) {
        if (k < 0) {
            throw new InvalidInputException("Sample size can not be negative: " + k);
        }
        if (k == 0 || totalSize <= 0) {
            return Collections.emptyList();
        }

        int draws = Math.multiplyExact(k, oversamplingFactor);
        long roundBound = Math.max(totalSize, minRounds);
        Set<String> collected = new LinkedHashSet<>();

        for (long round = 1; round <= roundBound; round++) {
            Round drawn = drawRound(key, draws, collected);
            // the set may have shrunk since totalSize was read
            long reachable = Math.min(totalSize, drawn.liveSize);
            logger.debug("Sampling {}: round {} holds {}/{} distinct members, {} live",
                    key, round, collected.size(), k, drawn.liveSize);

            if (collected.size() >= k) {
                return firstOf(collected, k);
            }
            if (collected.size() >= reachable || !drawn.drewAny) {
                return new ArrayList<>(collected);
            }
        }

        logger.debug("Sampling {} stopped after {} rounds with {} of {} requested members",
                key, roundBound, collected.size(), k);
        return new ArrayList<>(collected);
    }

    public int getOversamplingFactor() {
        return oversamplingFactor;
    }

    public int getMinRounds() {
        return minRounds;
    }

    // draws and SCARD travel in the same pipeline, the size reply comes last
    private Round drawRound(String key, int draws, Set<String> collected) {
        SetBatch batch = setStore.batch();
        for (int i = 0; i < draws; i++) {
            batch.randomMember(key);
        }
        batch.cardinality(key);
        List<Object> replies = batch.execute();

        boolean drewAny = false;
        int drawReplies = Math.min(draws, replies.size());
        for (Object value : replies.subList(0, drawReplies)) {
            if (value != null) {
                drewAny = true;
                collected.add(value.toString());
            }
        }
        Object size = replies.size() > draws ? replies.get(draws) : null;
        long liveSize = size instanceof Number ? ((Number) size).longValue() : Long.MAX_VALUE;
        return new Round(drewAny, liveSize);
    }

    private static List<String> firstOf(Set<String> collected, int k) {
        List<String> result = new ArrayList<>(k);
        for (String member : collected) {
            if (result.size() == k) {
                break;
            }
            result.add(member);
        }
        return result;
    }


    private static final class Round {

        private final boolean drewAny;
        private final long liveSize;

        private Round(boolean drewAny, long liveSize) {
            this.drewAny = drewAny;
            this.liveSize = liveSize;
        }
    }
}
