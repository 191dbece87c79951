package com.example.feedreader.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.listener.ReactiveRedisMessageListenerContainer;

@Configuration
public class RedisConfig {

    /**
     * Shared listener container for per-user delivery channels. All stream
     * sessions of this process multiplex over its single pub/sub connection.
     */
    @Bean(destroyMethod = "destroy")
    public ReactiveRedisMessageListenerContainer notificationListenerContainer(ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveRedisMessageListenerContainer(connectionFactory);
    }
}
