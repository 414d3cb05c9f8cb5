package com.flowys.flowys_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.engine.RedisEventBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Multi-instance event delivery. Off by default; with it off events go straight to the local broker.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "flowys.events.redis-bridge.enabled", havingValue = "true")
public class RedisEventBridgeConfig {

    @Bean
    public RedisEventBridge redisEventBridge(StringRedisTemplate redisTemplate,
                                             SimpMessagingTemplate messagingTemplate,
                                             ObjectMapper objectMapper) {
        log.info("[Events] Redis bridge enabled on channel {}", RedisEventBridge.REDIS_CHANNEL);
        return new RedisEventBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer redisEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                     RedisEventBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(RedisEventBridge.REDIS_CHANNEL));
        return container;
    }
}
