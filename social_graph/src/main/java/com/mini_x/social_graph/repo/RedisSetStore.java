package com.mini_x.social_graph.repo;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis backed set store.
 * Connection errors surface as Spring {@link DataAccessException}s and are not retried here.
 */
public class RedisSetStore implements SetStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisSetStore.class);

    private final StringRedisTemplate redisTemplate;

    public RedisSetStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }


    @Override
    public long add(String key, String... members) {
        Long added = redisTemplate.opsForSet().add(key, members);
        return added == null ? 0 : added;
    }

    @Override
    public long remove(String key, String... members) {
        Long removed = redisTemplate.opsForSet().remove(key, (Object[]) members);
        return removed == null ? 0 : removed;
    }

    @Override
    public Set<String> members(String key) {
        Set<String> members = redisTemplate.opsForSet().members(key);
        return members == null ? Collections.emptySet() : members;
    }

    @Override
    public long cardinality(String key) {
        Long size = redisTemplate.opsForSet().size(key);
        return size == null ? 0 : size;
    }

    @Override
    public boolean isMember(String key, String member) {
        Boolean result = redisTemplate.opsForSet().isMember(key, member);
        return result != null && result;
    }

    @Override
    public Set<String> intersect(String key, Collection<String> otherKeys) {
        Set<String> result = redisTemplate.opsForSet().intersect(key, otherKeys);
        return result == null ? Collections.emptySet() : result;
    }

    @Override
    public Set<String> diff(String key, Collection<String> otherKeys) {
        Set<String> result = redisTemplate.opsForSet().difference(key, otherKeys);
        return result == null ? Collections.emptySet() : result;
    }

    @Override
    public String randomMember(String key) {
        return redisTemplate.opsForSet().randomMember(key);
    }

    @Override
    public SetBatch batch() {
        return new RedisBatch();
    }


    /**
     * Pipelined replies as the rest of the library reads them: SADD, SREM and
     * SCARD as {@code Long}, SRANDMEMBER as {@code String} or {@code null}.
     * Raw {@code byte[]} members, which a template without a value serializer
     * hands back, are decoded as UTF-8.
     */
    static List<Object> toReplies(List<Object> raw) {
        if (raw == null) {
            return Collections.emptyList();
        }
        List<Object> replies = new ArrayList<>(raw.size());
        for (Object reply : raw) {
            if (reply instanceof byte[]) {
                replies.add(new String((byte[]) reply, StandardCharsets.UTF_8));
            } else if (reply instanceof Number && !(reply instanceof Long)) {
                replies.add(((Number) reply).longValue());
            } else {
                replies.add(reply);
            }
        }
        return replies;
    }


    private class RedisBatch implements SetBatch {

        private final List<Consumer<SetOperations<String, String>>> commands = new ArrayList<>();

        @Override
        public SetBatch add(String key, String... members) {
            commands.add(ops -> ops.add(key, members));
            return this;
        }

        @Override
        public SetBatch remove(String key, String... members) {
            commands.add(ops -> ops.remove(key, (Object[]) members));
            return this;
        }

        @Override
        public SetBatch randomMember(String key) {
            commands.add(ops -> ops.randomMember(key));
            return this;
        }

        @Override
        public SetBatch cardinality(String key) {
            commands.add(ops -> ops.size(key));
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
            logger.debug("Pipelining {} set commands", commands.size());
            // inside a pipeline every call returns null, the replies come back from executePipelined
            List<Object> replies = redisTemplate.executePipelined(new SessionCallback<Object>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> Object execute(RedisOperations<K, V> operations) throws DataAccessException {
                    SetOperations<String, String> ops = (SetOperations<String, String>) operations.opsForSet();
                    commands.forEach(command -> command.accept(ops));
                    return null;
                }
            });
            return toReplies(replies);
        }
    }
}
