package org.jaffre.dto.game;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GameEvent {
    private GameEventType type;
    private String gameId;
    private Object payload;

    public static GameEvent of(GameEventType type, String gameId, Object payload) {
        return GameEvent.builder().type(type).gameId(gameId).payload(payload).build();
    }
}
