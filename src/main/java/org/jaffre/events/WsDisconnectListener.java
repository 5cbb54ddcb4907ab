package org.jaffre.events;

import lombok.RequiredArgsConstructor;
import org.jaffre.service.GameService;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@RequiredArgsConstructor
public class WsDisconnectListener {

    private final GameService service;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        service.disconnect(e.getSessionId());
    }
}
