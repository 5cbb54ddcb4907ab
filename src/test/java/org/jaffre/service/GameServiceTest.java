package org.jaffre.service;

import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameCommand;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.dto.game.GameSummaryDTO;
import org.jaffre.exception.GameValidationException;
import org.jaffre.model.game.GamePhase;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;
import org.jaffre.service.game.broadcast.DeltaBroadcaster;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.jaffre.service.game.continuity.ConnectionContinuityService;
import org.jaffre.service.game.engine.GameReducer;
import org.jaffre.service.game.engine.RoundEngine;
import org.jaffre.service.game.engine.Transition;
import org.jaffre.service.game.identity.ReconnectionTokenService;
import org.jaffre.service.game.registry.GameRegistry;
import org.jaffre.service.game.util.Locks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.*;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GameServiceTest {

    @Mock GameRegistry registry;
    @Mock GameReducer reducer;
    @Mock RoundEngine engine;
    @Mock ConnectionContinuityService continuity;
    @Mock ReconnectionTokenService tokens;
    @Mock DeltaBroadcaster broadcaster;
    @Mock GameEventPublisher publisher;
    @Mock Locks locks;
    @Spy GameProperties props = new GameProperties();

    @InjectMocks GameService service;

    GameSession g;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        when(locks.of(anyString())).thenReturn(new Object());

        g = new GameSession("G1", System.currentTimeMillis());
        g.getSeats().add(new Seat("A", "c1", 1));
        g.setCreatorName("A");
        when(registry.get("G1")).thenReturn(g);
    }

    // ------------------------------------------------------------
    // lobby
    // ------------------------------------------------------------
    @Test
    void createGame_enregistreEtEnvoieLeJeton() {
        when(registry.newId()).thenReturn("G1");
        when(reducer.create(eq("G1"), eq("A"), eq("c1"), anyLong())).thenReturn(g);

        GameSession out = service.createGame("c1", "A");

        assertThat(out).isSameAs(g);
        verify(registry).put(g);
        verify(continuity).bind("c1", "G1", "A");
        verify(publisher).toConnection(eq("c1"), eq(GameEventType.GAME_CREATED), eq("G1"), any());
        verify(continuity).issueToken(g, "A", "c1");
        verify(broadcaster).broadcast(g, true);
    }

    @Test
    void joinGame_lieLaConnexionAuNouveauSiege() {
        Transition t = Transition.of("G1", GamePhase.TEAM_SELECTION);
        t.setJoinedSeat("B");
        when(reducer.apply(eq(g), isNull(), eq("c2"), any(GameCommand.JoinGame.class), anyLong())).thenReturn(t);

        service.joinGame("c2", "G1", "B");

        verify(continuity).bind("c2", "G1", "B");
        verify(continuity).issueToken(g, "B", "c2");
        verify(engine).afterTransition(g, t);
        verify(continuity).checkEmpty(g);
    }

    @Test
    void takeOverBot_envoieLEtatCompletAuRepreneur() {
        Transition t = Transition.of("G1", GamePhase.PLAYING);
        t.setJoinedSeat("E");
        t.setTakenOverBot("D");
        when(reducer.apply(eq(g), isNull(), eq("c5"), any(GameCommand.TakeOverBot.class), anyLong())).thenReturn(t);

        service.takeOverBot("c5", "G1", "D", "E");

        verify(continuity).bind("c5", "G1", "E");
        verify(continuity).issueToken(g, "E", "c5");
        verify(continuity).afterSeatChanges(g, t);
        verify(broadcaster).sendFullTo(g, "c5");
    }

    // ------------------------------------------------------------
    // commandes en partie
    // ------------------------------------------------------------
    @Test
    void handle_connexionHorsPartie_refuse() {
        assertThatThrownBy(() -> service.handle("inconnue", "G1", new GameCommand.StartGame("G1")))
                .isInstanceOf(GameValidationException.class);

        verifyNoInteractions(reducer, engine);
    }

    @Test
    void handle_resoutLAuteurParSaConnexion() {
        Transition t = Transition.of("G1", GamePhase.TEAM_SELECTION);
        GameCommand cmd = new GameCommand.SelectTeam("G1", 2);
        when(reducer.apply(eq(g), eq("A"), eq("c1"), eq(cmd), anyLong())).thenReturn(t);

        service.handle("c1", "G1", cmd);

        verify(engine).afterTransition(g, t);
        verify(continuity, never()).afterSeatChanges(any(), any());
    }

    @Test
    void handle_siegesModifies_suitesDeDepart() {
        Transition t = Transition.of("G1", GamePhase.PLAYING);
        t.setBotifiedSeat("A");
        when(reducer.apply(eq(g), eq("A"), eq("c1"), any(), anyLong())).thenReturn(t);

        service.handle("c1", "G1", new GameCommand.LeaveGame("G1"));

        verify(continuity).afterSeatChanges(g, t);
    }

    @Test
    void disconnect_delegue() {
        service.disconnect("c1");

        verify(continuity).onDisconnect("c1");
    }

    @Test
    void reconnect_delegue() {
        when(continuity.reconnect("jeton", "c9")).thenReturn(g);

        assertThat(service.reconnect("c9", "jeton")).isSameAs(g);
    }

    // ------------------------------------------------------------
    // lecture
    // ------------------------------------------------------------
    @Test
    void listJoinableGames_seulementLesPartiesOuvertes() {
        GameSession started = new GameSession("G2", 0L);
        started.setPhase(GamePhase.BETTING);
        when(registry.all()).thenReturn(List.of(g, started));

        List<GameSummaryDTO> out = service.listJoinableGames();

        assertThat(out).extracting(GameSummaryDTO::getId).containsExactly("G1");
        assertThat(out.get(0).getPlayers()).containsExactly("A");
        assertThat(out.get(0).getSeatsTaken()).isEqualTo(1);
    }

    // ------------------------------------------------------------
    // maintenance
    // ------------------------------------------------------------
    @Test
    void wireHydration_reprendLesPartiesRelues() {
        service.wireHydration();

        verify(registry).setHydrationListener(any());
    }

    @Test
    void recoverGames_marqueDeconnecteEtRearme() {
        when(registry.all()).thenReturn(List.of(g));

        service.recoverGames();

        verify(continuity).markAllDisconnected(g);
        verify(engine).rearm(g);
    }

    @Test
    void sweepStaleGames_fermeLesPartiesInactives() {
        GameSession idle = new GameSession("G2", 0L);
        when(registry.all()).thenReturn(List.of(g, idle));
        when(registry.cached("G2")).thenReturn(Optional.of(idle));

        service.sweepStaleGames();

        verify(engine).closeGame(eq("G2"), anyString());
        verify(continuity).forgetGame("G2");
        verify(engine, never()).closeGame(eq("G1"), anyString());
        verify(tokens).purgeExpired();
    }

    @Test
    void flushAll_sauvegardeChaquePartie() {
        when(registry.all()).thenReturn(List.of(g));

        service.flushAll();

        verify(broadcaster).saveNow(g);
    }
}
