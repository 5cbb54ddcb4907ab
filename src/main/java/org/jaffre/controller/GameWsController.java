package org.jaffre.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.dto.game.*;
import org.jaffre.exception.ErrorCode;
import org.jaffre.exception.GameException;
import org.jaffre.model.game.Card;
import org.jaffre.service.GameService;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Map;

/**
 * Commandes STOMP des joueurs. Le siège est retrouvé par l'identifiant de session
 * WebSocket ; les erreurs repartent sur la file privée de cette session.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class GameWsController {

    private final GameService service;
    private final GameEventPublisher publisher;

    // ----------------------------------------------------------------
    // lobby

    @MessageMapping("/game/create")
    public void create(@Valid @Payload CreateGameMsg msg, SimpMessageHeaderAccessor acc) {
        String conn = acc.getSessionId();
        guard(conn, () -> service.createGame(conn, msg.getPlayerName()));
    }

    @MessageMapping("/game/join")
    public void join(@Valid @Payload JoinGameMsg msg, SimpMessageHeaderAccessor acc) {
        String conn = acc.getSessionId();
        guard(conn, () -> service.joinGame(conn, msg.getGameId(), msg.getPlayerName()));
    }

    @MessageMapping("/game/reconnect")
    public void reconnect(@Valid @Payload ReconnectMsg msg, SimpMessageHeaderAccessor acc) {
        String conn = acc.getSessionId();
        guard(conn, () -> service.reconnect(conn, msg.getToken()));
    }

    @MessageMapping("/game/take_over_bot")
    public void takeOverBot(@Valid @Payload TakeOverBotMsg msg, SimpMessageHeaderAccessor acc) {
        String conn = acc.getSessionId();
        guard(conn, () -> service.takeOverBot(conn, msg.getGameId(), msg.getBotName(), msg.getPlayerName()));
    }

    // ----------------------------------------------------------------
    // sélection des équipes

    @MessageMapping("/game/add_bot")
    public void addBot(@Valid @Payload GameRefMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.AddBot(msg.getGameId()));
    }

    @MessageMapping("/game/select_team")
    public void selectTeam(@Valid @Payload SelectTeamMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.SelectTeam(msg.getGameId(), msg.getTeamId()));
    }

    @MessageMapping("/game/swap_position")
    public void swapPosition(@Valid @Payload SwapPositionMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.SwapPosition(msg.getGameId(), msg.getTargetName()));
    }

    @MessageMapping("/game/kick")
    public void kick(@Valid @Payload SeatTargetMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.KickPlayer(msg.getGameId(), msg.getSeatName()));
    }

    @MessageMapping("/game/start")
    public void start(@Valid @Payload GameRefMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.StartGame(msg.getGameId()));
    }

    // ----------------------------------------------------------------
    // jeu

    @MessageMapping("/game/bet")
    public void bet(@Valid @Payload PlaceBetMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(),
                new GameCommand.PlaceBet(msg.getGameId(), msg.getAmount(), msg.isWithoutTrump(), msg.isSkipped()));
    }

    @MessageMapping("/game/play_card")
    public void playCard(@Valid @Payload PlayCardMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(),
                new GameCommand.PlayCard(msg.getGameId(), new Card(msg.getColor(), msg.getValue())));
    }

    @MessageMapping("/game/ready")
    public void ready(@Valid @Payload GameRefMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.PlayerReady(msg.getGameId()));
    }

    @MessageMapping("/game/vote_rematch")
    public void voteRematch(@Valid @Payload GameRefMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.VoteRematch(msg.getGameId()));
    }

    // ----------------------------------------------------------------
    // sièges

    @MessageMapping("/game/leave")
    public void leave(@Valid @Payload GameRefMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.LeaveGame(msg.getGameId()));
    }

    @MessageMapping("/game/replace_with_bot")
    public void replaceWithBot(@Valid @Payload SeatTargetMsg msg, SimpMessageHeaderAccessor acc) {
        handle(acc, msg.getGameId(), new GameCommand.ReplaceWithBot(msg.getGameId(), msg.getSeatName()));
    }

    // ----------------------------------------------------------------

    @MessageExceptionHandler(MethodArgumentNotValidException.class)
    public void onInvalid(MethodArgumentNotValidException ex, SimpMessageHeaderAccessor acc) {
        publisher.toConnection(acc.getSessionId(), GameEventType.ERROR, null,
                Map.of("message", "Message invalide", "code", ErrorCode.VALIDATION));
    }

    private void handle(SimpMessageHeaderAccessor acc, String gameId, GameCommand command) {
        String conn = acc.getSessionId();
        guard(conn, () -> service.handle(conn, gameId, command));
    }

    private void guard(String connectionId, Runnable action) {
        try {
            action.run();
        } catch (GameException ex) {
            log.debug("Commande refusée pour {} : {}", connectionId, ex.getMessage());
            publisher.error(connectionId, ex);
        } catch (RuntimeException ex) {
            log.error("Erreur inattendue pour la connexion {}", connectionId, ex);
            publisher.toConnection(connectionId, GameEventType.ERROR, null,
                    Map.of("message", "Erreur serveur", "code", ErrorCode.INTERNAL));
        }
    }
}
