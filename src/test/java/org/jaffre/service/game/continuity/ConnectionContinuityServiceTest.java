package org.jaffre.service.game.continuity;

import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameCommand;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.exception.GameSecurityException;
import org.jaffre.exception.GameValidationException;
import org.jaffre.model.game.*;
import org.jaffre.model.game.Card.Color;
import org.jaffre.service.game.broadcast.DeltaBroadcaster;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.jaffre.service.game.engine.GameReducer;
import org.jaffre.service.game.engine.RoundEngine;
import org.jaffre.service.game.engine.Transition;
import org.jaffre.service.game.identity.ReconnectionSession;
import org.jaffre.service.game.identity.ReconnectionTokenService;
import org.jaffre.service.game.registry.GameRegistry;
import org.jaffre.service.game.util.Locks;
import org.jaffre.service.game.util.ScheduledEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConnectionContinuityServiceTest {

    @Mock GameRegistry registry;
    @Mock RoundEngine engine;
    @Mock ReconnectionTokenService tokens;
    @Mock DeltaBroadcaster broadcaster;
    @Mock GameEventPublisher publisher;
    @Mock ScheduledEvents events;

    GameProperties props = new GameProperties();
    GameReducer reducer = new GameReducer(props);
    ConnectionContinuityService service;
    GameSession g;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        service = new ConnectionContinuityService(registry, reducer, engine, tokens, broadcaster, publisher,
                events, new Locks(), props);

        g = reducer.create("G1", "A", "cA", 0L);
        reducer.apply(g, null, "cB", new GameCommand.JoinGame("G1", "B"), 0L);
        reducer.apply(g, null, "cC", new GameCommand.JoinGame("G1", "C"), 0L);
        reducer.apply(g, null, "cD", new GameCommand.JoinGame("G1", "D"), 0L);
        for (Seat s : g.getSeats()) service.bind(s.getConnectionId(), "G1", s.getName());

        when(registry.cached("G1")).thenReturn(Optional.of(g));
        when(registry.find("G1")).thenReturn(Optional.of(g));
    }

    private void playingWithBOnTurn() {
        reducer.apply(g, "A", "cA", new GameCommand.StartGame("G1"), 0L);
        g.setPhase(GamePhase.PLAYING);
        g.setHighestBet(Bet.of("B", "cB", 8, false));
        g.getCurrentBets().add(Bet.of("B", "cB", 8, false));
        g.getCurrentTrick().add(new TrickCard("A", "cA", new Card(Color.RED, 1), 0));
        g.nextTurn(1);
    }

    private Runnable graceTaskFor(String seat) {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(events).schedule(eq("G1"), eq(ScheduledEvents.RECONNECT_GRACE), eq(seat),
                eq(props.getReconnectGraceMs()), task.capture());
        return task.getValue();
    }

    // -------------------------------------------------------------------------
    // déconnexion
    // -------------------------------------------------------------------------
    @Test
    void onDisconnect_marqueLeSiegeEtLanceLeDelaiDeGrace() {
        playingWithBOnTurn();

        service.onDisconnect("cB");

        Seat b = g.findSeat("B").orElseThrow();
        assertThat(b.getConnectionStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(b.getDisconnectedAt()).isNotNull();
        graceTaskFor("B");
        verify(publisher).toGame("G1", GameEventType.PLAYER_DISCONNECTED, Map.of("playerName", "B"));
        verify(broadcaster).broadcast(g, false);
        verify(events).cancel("G1", ScheduledEvents.EMPTY_GAME, null);
        assertThat(service.seatOf("cB")).isNull();
    }

    @Test
    void onDisconnect_connexionInconnue_ignore() {
        service.onDisconnect("inconnue");

        verifyNoInteractions(events, publisher, broadcaster);
    }

    @Test
    void onDisconnect_connexionPerimee_ignore() {
        g.findSeat("B").orElseThrow().setConnectionId("cB2");

        service.onDisconnect("cB");

        assertThat(g.findSeat("B").orElseThrow().getConnectionStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        verifyNoInteractions(publisher);
    }

    // -------------------------------------------------------------------------
    // reconnexion
    // -------------------------------------------------------------------------
    @Test
    void reconnect_dansLeDelai_reprendLeSiegeSurLaNouvelleConnexion() {
        playingWithBOnTurn();
        List<Card> handBefore = new ArrayList<>(g.findSeat("B").orElseThrow().getHand());
        service.onDisconnect("cB");
        ReconnectionSession rs = new ReconnectionSession("t1", "G1", "B", 0L, 0L);
        when(tokens.validate("jeton")).thenReturn(rs);
        when(tokens.rotate(rs)).thenReturn("jeton2");

        GameSession out = service.reconnect("jeton", "cB2");

        assertThat(out).isSameAs(g);
        Seat b = g.findSeat("B").orElseThrow();
        assertThat(b.getConnectionId()).isEqualTo("cB2");
        assertThat(b.getConnectionStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(b.getDisconnectedAt()).isNull();
        assertThat(b.getHand()).isEqualTo(handBefore);
        assertThat(g.getCurrentBets().get(0).getSeatName()).isEqualTo("B");
        assertThat(g.getCurrentBets().get(0).getConnectionId()).isEqualTo("cB2");
        assertThat(g.actingSeat().getName()).isEqualTo("B");

        verify(events).cancel("G1", ScheduledEvents.RECONNECT_GRACE, "B");
        verify(engine).resumeTurn(g);
        verify(publisher).toConnection(eq("cB2"), eq(GameEventType.RECONNECTION_TOKEN), eq("G1"),
                argThat(p -> ((Map<?, ?>) p).get("token").equals("jeton2")));
        verify(publisher).toGame("G1", GameEventType.PLAYER_RECONNECTED, Map.of("playerName", "B"));
        verify(broadcaster).sendFullTo(g, "cB2");
        assertThat(service.seatOf("cB2")).isEqualTo(new ConnectionContinuityService.SeatRef("G1", "B"));
    }

    @Test
    void reconnect_partieTerminee_refuseEtRevoque() {
        g.setPhase(GamePhase.GAME_OVER);
        when(tokens.validate("jeton")).thenReturn(new ReconnectionSession("t1", "G1", "B", 0L, 0L));

        assertThatThrownBy(() -> service.reconnect("jeton", "cB2"))
                .isInstanceOf(GameValidationException.class);
        verify(tokens).invalidate("G1", "B");
    }

    @Test
    void reconnect_siegeDevenuBot_refuse() {
        g.findSeat("B").orElseThrow().setBot(true);
        when(tokens.validate("jeton")).thenReturn(new ReconnectionSession("t1", "G1", "B", 0L, 0L));

        assertThatThrownBy(() -> service.reconnect("jeton", "cB2"))
                .isInstanceOf(GameSecurityException.class);
        verify(tokens).invalidate("G1", "B");
        verify(engine, never()).resumeTurn(any());
    }

    // -------------------------------------------------------------------------
    // fin du délai de grâce
    // -------------------------------------------------------------------------
    @Test
    void graceExpiree_enJeu_botRemplaceLeJoueur() {
        playingWithBOnTurn();
        service.onDisconnect("cB");

        graceTaskFor("B").run();

        Seat b = g.findSeat("B").orElseThrow();
        assertThat(b.isBot()).isTrue();
        verify(engine).afterTransition(eq(g), argThat(t -> "B".equals(t.getBotifiedSeat())));
        verify(tokens).invalidate("G1", "B");
    }

    @Test
    void graceExpiree_avantLancement_retireLeSiege() {
        service.onDisconnect("cC");

        graceTaskFor("C").run();

        assertThat(g.findSeat("C")).isEmpty();
        verify(publisher, never()).toConnection(any(), eq(GameEventType.PLAYER_KICKED), any(), any());
    }

    @Test
    void graceExpiree_joueurRevenu_ignore() {
        playingWithBOnTurn();
        service.onDisconnect("cB");
        Runnable task = graceTaskFor("B");
        Seat b = g.findSeat("B").orElseThrow();
        b.setConnectionStatus(ConnectionStatus.CONNECTED);
        b.setConnectionId("cB2");

        task.run();

        assertThat(b.isBot()).isFalse();
        verify(engine, never()).afterTransition(any(), any());
    }

    // -------------------------------------------------------------------------
    // sièges et partie vide
    // -------------------------------------------------------------------------
    @Test
    void afterSeatChanges_exclusion_previentLExclu() {
        Transition t = reducer.apply(g, "A", "cA", new GameCommand.KickPlayer("G1", "C"), 0L);

        service.afterSeatChanges(g, t);

        verify(tokens).invalidate("G1", "C");
        verify(publisher).toConnection(eq("cC"), eq(GameEventType.PLAYER_KICKED), eq("G1"), any());
        assertThat(service.seatOf("cC")).isNull();
    }

    @Test
    void afterSeatChanges_plusPersonne_fermeLaPartie() {
        GameSession solo = reducer.create("G2", "Z", "cZ", 0L);
        Transition t = reducer.apply(solo, "Z", "cZ", new GameCommand.LeaveGame("G2"), 0L);

        service.afterSeatChanges(solo, t);

        verify(engine).closeGame(eq("G2"), anyString());
    }

    @Test
    void checkEmpty_aucunHumainConnecte_suppressionDifferee() {
        for (Seat s : g.getSeats()) s.setConnectionStatus(ConnectionStatus.DISCONNECTED);

        service.checkEmpty(g);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(events).schedule(eq("G1"), eq(ScheduledEvents.EMPTY_GAME), isNull(),
                eq(props.getEmptyGameGraceMs()), task.capture());

        task.getValue().run();

        verify(engine).closeGame(eq("G1"), anyString());
    }

    @Test
    void checkEmpty_unJoueurRevenuAvantLaFin_garderLaPartie() {
        for (Seat s : g.getSeats()) s.setConnectionStatus(ConnectionStatus.DISCONNECTED);
        service.checkEmpty(g);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(events).schedule(eq("G1"), eq(ScheduledEvents.EMPTY_GAME), isNull(), anyLong(), task.capture());

        g.findSeat("A").orElseThrow().setConnectionStatus(ConnectionStatus.CONNECTED);
        task.getValue().run();

        verify(engine, never()).closeGame(any(), any());
    }

    @Test
    void markAllDisconnected_planifieUneGraceParHumain() {
        g.findSeat("D").orElseThrow().setBot(true);

        service.markAllDisconnected(g);

        assertThat(g.getSeats()).filteredOn(s -> !s.isBot())
                .allSatisfy(s -> assertThat(s.getConnectionStatus()).isEqualTo(ConnectionStatus.DISCONNECTED));
        verify(events, times(3)).schedule(eq("G1"), eq(ScheduledEvents.RECONNECT_GRACE), anyString(), anyLong(),
                any(Runnable.class));
    }

    @Test
    void forgetGame_oublieLesConnexions() {
        service.forgetGame("G1");

        assertThat(service.seatOf("cA")).isNull();
    }
}
