package com.mini_x.social_graph.repo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Process local set store with Redis set semantics. Every command, and every
 * batch as a whole, runs under one lock so callers observe the same per-command
 * ordering a single Redis connection gives.
 */
public class InMemorySetStore implements SetStore {

    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Random random;

    public InMemorySetStore() {
        this(null);
    }

    // a seeded Random gives reproducible draws
    public InMemorySetStore(Random random) {
        this.random = random;
    }


    @Override
    public synchronized long add(String key, String... members) {
        Set<String> set = sets.computeIfAbsent(key, k -> new LinkedHashSet<>());
        long added = 0;
        for (String member : members) {
            if (set.add(member)) {
                added++;
            }
        }
        return added;
    }

    @Override
    public synchronized long remove(String key, String... members) {
        Set<String> set = sets.get(key);
        if (set == null) {
            return 0;
        }
        long removed = 0;
        for (String member : members) {
            if (set.remove(member)) {
                removed++;
            }
        }
        // Redis drops a key once its set is empty
        if (set.isEmpty()) {
            sets.remove(key);
        }
        return removed;
    }

    @Override
    public synchronized Set<String> members(String key) {
        Set<String> set = sets.get(key);
        return set == null ? Collections.emptySet() : new LinkedHashSet<>(set);
    }

    @Override
    public synchronized long cardinality(String key) {
        Set<String> set = sets.get(key);
        return set == null ? 0 : set.size();
    }

    @Override
    public synchronized boolean isMember(String key, String member) {
        Set<String> set = sets.get(key);
        return set != null && set.contains(member);
    }

    @Override
    public synchronized Set<String> intersect(String key, Collection<String> otherKeys) {
        Set<String> result = members(key);
        for (String other : otherKeys) {
            result.retainAll(sets.getOrDefault(other, Collections.emptySet()));
        }
        return result;
    }

    @Override
    public synchronized Set<String> diff(String key, Collection<String> otherKeys) {
        Set<String> result = members(key);
        for (String other : otherKeys) {
            result.removeAll(sets.getOrDefault(other, Collections.emptySet()));
        }
        return result;
    }

    @Override
    public synchronized String randomMember(String key) {
        Set<String> set = sets.get(key);
        if (set == null || set.isEmpty()) {
            return null;
        }
        int index = random().nextInt(set.size());
        for (String member : set) {
            if (index-- == 0) {
                return member;
            }
        }
        return null;
    }

    @Override
    public SetBatch batch() {
        return new InMemoryBatch();
    }

    private Random random() {
        return random != null ? random : ThreadLocalRandom.current();
    }


    private class InMemoryBatch implements SetBatch {

        private final List<Function<SetStore, Object>> commands = new ArrayList<>();

        @Override
        public SetBatch add(String key, String... members) {
            commands.add(store -> store.add(key, members));
            return this;
        }

        @Override
        public SetBatch remove(String key, String... members) {
            commands.add(store -> store.remove(key, members));
            return this;
        }

        @Override
        public SetBatch randomMember(String key) {
            commands.add(store -> store.randomMember(key));
            return this;
        }

        @Override
        public SetBatch cardinality(String key) {
            commands.add(store -> store.cardinality(key));
            return this;
        }

        @Override
        public int size() {
            return commands.size();
        }

        @Override
        public List<Object> execute() {
            if (commands.isEmpty()) {
                return Collections.emptyList();
            }
            List<Object> results = new ArrayList<>(commands.size());
            synchronized (InMemorySetStore.this) {
                for (Function<SetStore, Object> command : commands) {
                    results.add(command.apply(InMemorySetStore.this));
                }
            }
            return results;
        }
    }
}
