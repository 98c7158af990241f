package com.example.crosstab.service.room;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.RoomType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import java.nio.charset.StandardCharsets;

/**
 * Delivers emissions published by other pods to the members held here.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisRoomEventListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final EventPropagationService eventPropagationService;
    private final LeaderElectionService leaderElectionService;
    private final AppProperties appProperties;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            RoomEventEnvelope envelope = objectMapper.readValue(body, RoomEventEnvelope.class);
            if (appProperties.getPodName().equals(envelope.getOriginPodId())) {
                return;
            }

            int delivered = eventPropagationService.deliverLocally(envelope);
            log.debug("Relayed {} from pod {} to {} local connection(s)", envelope.getEvent(), envelope.getOriginPodId(), delivered);

            boolean leadership = CrossTabEventType.fromWireName(envelope.getEvent())
                    .map(CrossTabEventType::isLeadershipEvent)
                    .orElse(false);
            if (leadership) {
                for (RoomEventEnvelope.Delivery delivery : envelope.getDeliveries()) {
                    String roomId = delivery.getRoomId();
                    if (roomId != null && roomId.startsWith(RoomType.USER.prefix())) {
                        leaderElectionService.syncLocalLeadership(roomId.substring(RoomType.USER.prefix().length()));
                    }
                }
            }
        } catch (Exception e) {
            log.error("Failed to process relayed room event: {}", e.getMessage(), e);
        }
    }
}
