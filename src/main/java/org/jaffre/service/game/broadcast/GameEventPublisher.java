package org.jaffre.service.game.broadcast;

import lombok.RequiredArgsConstructor;
import org.jaffre.dto.game.GameEvent;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.exception.GameException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Les événements publics partent sur {@code /topic/game/{id}} ; l'état (mains comprises)
 * et les réponses individuelles partent vers la session STOMP sur {@code /user/queue/game}.
 */
@Service
@RequiredArgsConstructor
public class GameEventPublisher {
    public static final String GAME_TOPIC = "/topic/game/";
    public static final String PRIVATE_QUEUE = "/queue/game";

    private final SimpMessagingTemplate broker;

    public void toGame(GameEvent evt) {
        broker.convertAndSend(GAME_TOPIC + evt.getGameId(), evt);
    }

    public void toGame(String gameId, GameEventType type, Object payload) {
        toGame(GameEvent.of(type, gameId, payload));
    }

    public void toConnection(String connectionId, GameEventType type, String gameId, Object payload) {
        if (connectionId == null) return;
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(connectionId);
        headers.setLeaveMutable(true);
        broker.convertAndSendToUser(connectionId, PRIVATE_QUEUE,
                GameEvent.of(type, gameId, payload), headers.getMessageHeaders());
    }

    public void error(String connectionId, GameException ex) {
        toConnection(connectionId, GameEventType.ERROR, null,
                Map.of("message", ex.getMessage(), "code", ex.getCode()));
    }
}
