package com.flowys.flowys_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fans execution events out through Redis pub/sub so the instance holding the subscriber's
 * WebSocket session delivers them, whichever instance ran the workflow.
 * Registered by RedisEventBridgeConfig when flowys.events.redis-bridge.enabled=true.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisEventBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "flowys:execution-events";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            redisTemplate.convertAndSend(REDIS_CHANNEL, objectMapper.writeValueAsString(new TopicMessage(destination, payload)));
        } catch (JsonProcessingException e) {
            log.error("[Events] Failed to serialize event for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            TopicMessage topicMessage = objectMapper.readValue(
                    new String(message.getBody(), StandardCharsets.UTF_8), TopicMessage.class);
            messagingTemplate.convertAndSend(topicMessage.destination(), topicMessage.payload());
        } catch (Exception e) {
            log.error("[Events] Failed to forward Redis message to WebSocket", e);
        }
    }

    record TopicMessage(String destination, Map<String, Object> payload) {}
}
