package com.mini_x.social_graph.repo;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RedisSetStoreTest {

    private StringRedisTemplate template;
    private SetOperations<String, String> setOps;
    private RedisSetStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(StringRedisTemplate.class);
        setOps = mock(SetOperations.class);
        when(template.opsForSet()).thenReturn(setOps);
        store = new RedisSetStore(template);
    }

    @Test
    void delegatesToSetCommands() {
        when(setOps.add("k", "a", "b")).thenReturn(2L);
        when(setOps.size("k")).thenReturn(5L);
        when(setOps.isMember("k", "a")).thenReturn(true);
        when(setOps.members("k")).thenReturn(Set.of("a", "b"));
        when(setOps.randomMember("k")).thenReturn("b");

        assertThat(store.add("k", "a", "b")).isEqualTo(2);
        assertThat(store.cardinality("k")).isEqualTo(5);
        assertThat(store.isMember("k", "a")).isTrue();
        assertThat(store.members("k")).containsExactlyInAnyOrder("a", "b");
        assertThat(store.randomMember("k")).isEqualTo("b");
    }

    @Test
    void intersectAndDiffPassAllKeys() {
        when(setOps.intersect("a", List.of("b", "c"))).thenReturn(Set.of("x"));
        when(setOps.difference("a", List.of("b"))).thenReturn(Set.of("y"));

        assertThat(store.intersect("a", List.of("b", "c"))).containsExactly("x");
        assertThat(store.diff("a", List.of("b"))).containsExactly("y");
    }

    @Test
    void nullRepliesBecomeEmptyValues() {
        assertThat(store.cardinality("k")).isZero();
        assertThat(store.isMember("k", "a")).isFalse();
        assertThat(store.members("k")).isEmpty();
        assertThat(store.remove("k", "a")).isZero();
    }

    @Test
    void connectionErrorsPropagate() {
        RedisConnectionFailureException failure = new RedisConnectionFailureException("down");
        when(setOps.size("k")).thenThrow(failure);

        assertThatThrownBy(() -> store.cardinality("k")).isSameAs(failure);
    }

    @Test
    @SuppressWarnings("unchecked")
    void batchRunsQueuedCommandsInOnePipeline() {
        RedisOperations<String, String> operations = mock(RedisOperations.class);
        when(operations.opsForSet()).thenReturn(setOps);
        when(template.executePipelined(any(SessionCallback.class))).thenAnswer(invocation -> {
            SessionCallback<?> callback = invocation.getArgument(0);
            callback.execute(operations);
            return Arrays.asList(1L, 1L, "u3", null, 4L);
        });

        List<Object> replies = store.batch()
                .add("u2:followers", "u1")
                .remove("u1:following", "u9")
                .randomMember("u1:followers")
                .randomMember("empty:followers")
                .cardinality("u1:followers")
                .execute();

        assertThat(replies).containsExactly(1L, 1L, "u3", null, 4L);
        verify(setOps).add("u2:followers", "u1");
        verify(setOps).remove("u1:following", "u9");
        verify(setOps).randomMember("u1:followers");
        verify(setOps).randomMember("empty:followers");
        verify(setOps).size("u1:followers");
    }

    @Test
    @DisplayName("raw pipeline replies are read as Long counts and String members")
    void rawPipelineRepliesAreDecoded() {
        List<Object> raw = Arrays.asList(
                1L,
                "u7".getBytes(StandardCharsets.UTF_8),
                null,
                3,
                "u8");

        assertThat(RedisSetStore.toReplies(raw)).containsExactly(1L, "u7", null, 3L, "u8");
        assertThat(RedisSetStore.toReplies(null)).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void byteRepliesFromThePipelineReachCallersAsStrings() {
        when(template.executePipelined(any(SessionCallback.class)))
                .thenReturn(Arrays.asList("u5".getBytes(StandardCharsets.UTF_8), 2L));

        List<Object> replies = store.batch().randomMember("k").cardinality("k").execute();

        assertThat(replies).containsExactly("u5", 2L);
    }

    @Test
    void emptyBatchSkipsTheRoundTrip() {
        StringRedisTemplate untouched = mock(StringRedisTemplate.class);

        assertThat(new RedisSetStore(untouched).batch().execute()).isEmpty();
        verifyNoInteractions(untouched);
    }
}
