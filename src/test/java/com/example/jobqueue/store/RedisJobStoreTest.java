package com.example.jobqueue.store;

import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.exception.BackendOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisListCommands.Direction;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Redis-specific bookkeeping around leasing, checked against mocked Redis operations.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisJobStore Tests")
class RedisJobStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");
    private static final String QUEUE_KEY = "jobqueue:queue:default";

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ListOperations<String, String> listOps;

    @Mock
    private ValueOperations<String, String> valueOps;

    @Mock
    private ZSetOperations<String, String> zSetOps;

    private final JsonCodec codec = new JsonCodec();
    private RedisJobStore store;

    @BeforeEach
    void setUp() {
        store = new RedisJobStore(redis, codec);
    }

    private String jobJson(String id, JobStatus status) {
        var job = Job.builder().id(id).function("echo").queue("default").status(status).createdAt(NOW).build();
        return codec.write(job);
    }

    @Nested
    @DisplayName("Leasing")
    class Leasing {

        @Test
        @DisplayName("Should leave the taken id in the processing list when the lease write fails")
        @SuppressWarnings("unchecked")
        void shouldKeepIdWhenLeaseWriteFails() {
            // Given
            when(redis.opsForZSet()).thenReturn(zSetOps);
            when(redis.opsForList()).thenReturn(listOps);
            when(zSetOps.rangeByScore(eq("jobqueue:delayed:default"), anyDouble(), anyDouble())).thenReturn(Set.of());
            when(listOps.move(QUEUE_KEY, Direction.LEFT, RedisJobStore.PROCESSING, Direction.RIGHT)).thenReturn("job-1");
            when(redis.execute(any(SessionCallback.class))).thenThrow(new RedisConnectionFailureException("connection reset"));

            // When / Then
            assertThatThrownBy(() -> store.lease(List.of("default"), "w1", NOW, NOW.plusSeconds(30)))
                    .isInstanceOf(BackendOperationException.class);
            verify(listOps, never()).leftPop(anyString());
            verify(listOps, never()).remove(eq(RedisJobStore.PROCESSING), anyLong(), any());
        }

        @Test
        @DisplayName("Should return empty when every queue is empty")
        void shouldReturnEmptyForEmptyQueues() {
            // Given
            when(redis.opsForZSet()).thenReturn(zSetOps);
            when(redis.opsForList()).thenReturn(listOps);
            when(zSetOps.rangeByScore(eq("jobqueue:delayed:default"), anyDouble(), anyDouble())).thenReturn(Set.of());
            when(listOps.move(QUEUE_KEY, Direction.LEFT, RedisJobStore.PROCESSING, Direction.RIGHT)).thenReturn(null);

            // When / Then
            assertThat(store.lease(List.of("default"), "w1", NOW, NOW.plusSeconds(30))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Stranded job recovery")
    class StrandedRecovery {

        @Test
        @DisplayName("Should requeue pending jobs left in the processing list and drop the rest")
        void shouldRequeueStrandedJobs() {
            // Given
            when(redis.opsForList()).thenReturn(listOps);
            when(redis.opsForValue()).thenReturn(valueOps);
            when(listOps.range(RedisJobStore.PROCESSING, 0, -1)).thenReturn(List.of("stranded", "leased", "gone"));
            when(valueOps.get("jobqueue:job:stranded")).thenReturn(jobJson("stranded", JobStatus.PENDING));
            when(valueOps.get("jobqueue:job:leased")).thenReturn(jobJson("leased", JobStatus.RUNNING));
            when(valueOps.get("jobqueue:job:gone")).thenReturn(null);

            // When
            var restored = store.recoverStrandedJobs();

            // Then
            assertThat(restored).isEqualTo(1);
            verify(listOps).leftPush(QUEUE_KEY, "stranded");
            verify(listOps, never()).leftPush(QUEUE_KEY, "leased");
            verify(listOps).remove(RedisJobStore.PROCESSING, 1, "stranded");
            verify(listOps).remove(RedisJobStore.PROCESSING, 1, "leased");
            verify(listOps).remove(RedisJobStore.PROCESSING, 1, "gone");
        }

        @Test
        @DisplayName("Should do nothing when no id is being processed")
        void shouldIgnoreEmptyProcessingList() {
            // Given
            when(redis.opsForList()).thenReturn(listOps);
            when(listOps.range(RedisJobStore.PROCESSING, 0, -1)).thenReturn(List.of());

            // When / Then
            assertThat(store.recoverStrandedJobs()).isZero();
            verify(listOps, never()).leftPush(anyString(), anyString());
        }
    }
}
