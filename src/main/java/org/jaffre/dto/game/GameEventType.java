package org.jaffre.dto.game;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GameEventType {
    GAME_CREATED("game_created"),
    PLAYER_JOINED("player_joined"),
    PLAYER_LEFT("player_left"),
    GAME_UPDATED("game_updated"),
    GAME_UPDATED_DELTA("game_updated_delta"),
    ROUND_STARTED("round_started"),
    TRICK_RESOLVED("trick_resolved"),
    ROUND_ENDED("round_ended"),
    GAME_OVER("game_over"),
    TIMEOUT_COUNTDOWN("timeout_countdown"),
    TIMEOUT_WARNING("timeout_warning"),
    AUTO_ACTION_TAKEN("auto_action_taken"),
    PLAYER_DISCONNECTED("player_disconnected"),
    PLAYER_RECONNECTED("player_reconnected"),
    PLAYER_KICKED("kicked_from_game"),
    RECONNECTION_TOKEN("reconnection_token"),
    ERROR("error");

    private final String wire;

    GameEventType(String wire) { this.wire = wire; }

    @JsonValue
    public String wire() { return wire; }
}
