package org.jaffre.model.game;

import jakarta.persistence.*;
import lombok.Data;

/** Session de reconnexion active, conservée pour survivre au redémarrage. */
@Entity
@Table(name = "reconnection_session", indexes = @Index(name = "idx_reco_game_seat", columnList = "game_id,seat_name"))
@Data
public class ReconnectionSessionEntity {
    @Id
    @Column(name = "token_id", length = 64)
    private String tokenId;

    @Column(name = "game_id", length = 64, nullable = false)
    private String gameId;

    @Column(name = "seat_name", length = 64, nullable = false)
    private String seatName;

    @Column(name = "issued_at")
    private long issuedAt;

    @Column(name = "last_used_at")
    private long lastUsedAt;
}
