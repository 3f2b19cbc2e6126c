package com.platform.servicehost.api;

import com.platform.servicehost.model.ServicesUpdatedEvent;
import com.platform.servicehost.model.StatusBatchEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards both monitor event streams to their STOMP topics.
 */
@Slf4j
@Component
public class StatusEventBroadcaster {
    
    public static final String SERVICES_TOPIC = "/topic/services";
    public static final String STATUS_TOPIC = "/topic/status";
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public StatusEventBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    @EventListener
    public void onServicesUpdated(ServicesUpdatedEvent event) {
        send(SERVICES_TOPIC, event, event.changed().size());
    }
    
    @EventListener
    public void onStatusBatch(StatusBatchEvent event) {
        send(STATUS_TOPIC, event, event.statusUpdates().size());
    }
    
    private void send(String topic, Object payload, int size) {
        try {
            messagingTemplate.convertAndSend(topic, payload);
            log.debug("Broadcast {} entries to {}", size, topic);
        } catch (MessagingException e) {
            log.warn("Failed to broadcast to {}: {}", topic, e.getMessage());
        }
    }
}
