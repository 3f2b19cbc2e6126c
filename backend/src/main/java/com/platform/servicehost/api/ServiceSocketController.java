package com.platform.servicehost.api;

import com.platform.servicehost.core.LifecycleOrchestrator;
import com.platform.servicehost.model.ServicesUpdatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

import java.time.Clock;

/**
 * Lets a newly connected client ask for the full service list on the services topic.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ServiceSocketController {
    
    private final LifecycleOrchestrator orchestrator;
    private final Clock clock;
    
    @MessageMapping("/services")
    @SendTo(StatusEventBroadcaster.SERVICES_TOPIC)
    public ServicesUpdatedEvent requestSnapshot() {
        log.debug("WebSocket: client requested service snapshot");
        return new ServicesUpdatedEvent(orchestrator.getAll(), clock.instant());
    }
}
