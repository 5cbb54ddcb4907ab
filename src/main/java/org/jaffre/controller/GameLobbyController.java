package org.jaffre.controller;

import lombok.RequiredArgsConstructor;
import org.jaffre.dto.game.GameSummaryDTO;
import org.jaffre.exception.GameNotFoundException;
import org.jaffre.service.GameService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameLobbyController {

    private final GameService service;

    @GetMapping
    public List<GameSummaryDTO> list() {
        return service.listJoinableGames();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> summary(@PathVariable String id) {
        try {
            return ResponseEntity.ok(service.getSummary(id));
        } catch (GameNotFoundException ex) {
            return ResponseEntity.status(404).body(Map.of("error", ex.getMessage()));
        }
    }
}
