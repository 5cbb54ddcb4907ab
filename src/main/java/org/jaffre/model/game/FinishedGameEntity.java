package org.jaffre.model.game;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "finished_game")
@Data
public class FinishedGameEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", length = 64, nullable = false)
    private String gameId;

    @Column(name = "winning_team")
    private Integer winningTeam;

    @Column(name = "team1_score")
    private int team1Score;

    @Column(name = "team2_score")
    private int team2Score;

    @Column(name = "rounds")
    private int rounds;

    // "nom:équipe" séparés par des virgules
    @Column(name = "players", length = 512)
    private String players;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;
}
