package com.example.crosstab.service.room;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import static com.example.crosstab.util.Constants.ROOM_EVENTS_CHANNEL;

@Slf4j
@RequiredArgsConstructor
public class RedisRoomEventRelay implements RoomEventRelay {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void publish(RoomEventEnvelope envelope) {
        try {
            redisTemplate.convertAndSend(ROOM_EVENTS_CHANNEL, objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize room event {} for relay: {}", envelope.getEvent(), e.getMessage());
        }
    }
}
