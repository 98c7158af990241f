package com.example.crosstab.config;

import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.room.LocalRoomEventRelay;
import com.example.crosstab.service.room.RedisRoomEventListener;
import com.example.crosstab.service.room.RedisRoomEventRelay;
import com.example.crosstab.service.room.RoomEventRelay;
import com.example.crosstab.store.CaffeineCoordinationStore;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.RedisCoordinationStore;
import com.example.crosstab.util.Constants;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Picks the coordination store and the cross-pod event relay from {@code crosstab.store.type}.
 */
@Configuration
@Slf4j
public class CoordinationStoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "crosstab.store.type", havingValue = "memory", matchIfMissing = true)
    static class InMemory {

        @Bean
        public CoordinationStore coordinationStore(ObjectMapper objectMapper, AppProperties appProperties) {
            log.info("Using in-process Caffeine coordination store (single pod)");
            return new CaffeineCoordinationStore(objectMapper, appProperties.getStore().getMaximumSize());
        }

        @Bean
        public RoomEventRelay roomEventRelay() {
            return new LocalRoomEventRelay();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "crosstab.store.type", havingValue = "redis")
    static class Redis {

        @Bean
        public CoordinationStore coordinationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                                   AppProperties appProperties) {
            log.info("Using Redis coordination store");
            return new RedisCoordinationStore(redisTemplate, objectMapper, appProperties.getStore().getMaxCasAttempts());
        }

        @Bean
        public RoomEventRelay roomEventRelay(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
            return new RedisRoomEventRelay(redisTemplate, objectMapper);
        }

        @Bean
        public RedisRoomEventListener redisRoomEventListener(ObjectMapper objectMapper,
                                                             EventPropagationService eventPropagationService,
                                                             LeaderElectionService leaderElectionService,
                                                             AppProperties appProperties) {
            return new RedisRoomEventListener(objectMapper, eventPropagationService, leaderElectionService, appProperties);
        }

        @Bean
        public RedisMessageListenerContainer roomEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                        RedisRoomEventListener listener) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.addMessageListener(listener, new ChannelTopic(Constants.ROOM_EVENTS_CHANNEL));
            return container;
        }
    }
}
