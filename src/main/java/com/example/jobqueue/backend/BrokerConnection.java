package com.example.jobqueue.backend;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis connection factory (Lettuce, thread-safe) and a string template over it.
 */
@Slf4j
@Getter
public class BrokerConnection implements BackendConnection {

    private final LettuceConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;

    public BrokerConnection(LettuceConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        this.redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @Override
    public BackendType getType() {
        return BackendType.REDIS;
    }

    @Override
    public void close() {
        log.info("Closing Redis connection factory");
        connectionFactory.destroy();
    }
}
