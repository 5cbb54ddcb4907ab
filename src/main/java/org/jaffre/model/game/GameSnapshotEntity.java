package org.jaffre.model.game;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/** Instantané JSON d'une partie en cours, relu au redémarrage. */
@Entity
@Table(name = "game_snapshot")
@Data
public class GameSnapshotEntity {
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "phase", length = 20)
    private String phase;

    @Lob
    @Column(name = "state_json", nullable = false)
    private String stateJson;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
