package org.jaffre.service.game.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.model.game.*;
import org.jaffre.model.game.Card.Color;
import org.jaffre.service.game.persistence.GamePersistence;
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

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeltaBroadcasterTest {

    @Mock GameEventPublisher publisher;
    @Mock GamePersistence persistence;
    @Mock ScheduledEvents events;

    GameProperties props = new GameProperties();
    DeltaBroadcaster broadcaster;
    GameSession g;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        broadcaster = new DeltaBroadcaster(new ObjectMapper(), publisher, new Payloads(), persistence, events, props, new Locks());
        g = new GameSession("G1", 0L);
        g.getSeats().add(new Seat("A", "cA", 1));
        g.getSeats().add(new Seat("B", "cB", 2));
        g.getSeats().add(new Seat("C", "cC", 1));
        g.getSeats().add(Seat.bot("D", 2));
        g.setPhase(GamePhase.PLAYING);
        for (Seat s : g.getSeats()) s.setHand(new ArrayList<>(List.of(new Card(Color.RED, 1), new Card(Color.BLUE, 1))));
    }

    @Test
    void broadcast_premierEnvoi_etatCompletAuxHumains() {
        broadcaster.broadcast(g, false);

        verify(publisher).toConnection(eq("cA"), eq(GameEventType.GAME_UPDATED), eq("G1"), any());
        verify(publisher).toConnection(eq("cB"), eq(GameEventType.GAME_UPDATED), eq("G1"), any());
        verify(publisher).toConnection(eq("cC"), eq(GameEventType.GAME_UPDATED), eq("G1"), any());
        verify(publisher, times(3)).toConnection(any(), any(), any(), any());
        verify(events).schedule(eq("G1"), eq(ScheduledEvents.SAVE), isNull(), eq(props.getPersistDebounceMs()),
                any(Runnable.class));
    }

    @Test
    void broadcast_rienNAChange_rienNEstEnvoye() {
        broadcaster.broadcast(g, false);
        clearInvocations(publisher);

        broadcaster.broadcast(g, false);

        verifyNoInteractions(publisher);
    }

    @Test
    void broadcast_changement_deltaParConnexion() {
        broadcaster.broadcast(g, false);
        clearInvocations(publisher);

        g.getSeats().get(1).getHand().remove(0);
        g.setCurrentSeatIndex(2);
        broadcaster.broadcast(g, false);

        ArgumentCaptor<Object> forA = ArgumentCaptor.forClass(Object.class);
        ArgumentCaptor<Object> forB = ArgumentCaptor.forClass(Object.class);
        verify(publisher).toConnection(eq("cA"), eq(GameEventType.GAME_UPDATED_DELTA), eq("G1"), forA.capture());
        verify(publisher).toConnection(eq("cB"), eq(GameEventType.GAME_UPDATED_DELTA), eq("G1"), forB.capture());
        verify(publisher, never()).toConnection(any(), eq(GameEventType.GAME_UPDATED), any(), any());

        assertThat(changesOfSeat(forA.getValue(), 1)).doesNotContainKey("hand").containsEntry("handSize", 1);
        assertThat(changesOfSeat(forB.getValue(), 1)).containsKey("hand");
        assertThat(asMap(forA.getValue())).containsEntry("currentSeatIndex", 2);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> changesOfSeat(Object delta, int index) {
        List<Map<String, Object>> updates = (List<Map<String, Object>>) ((Map<String, Object>) delta).get("playerUpdates");
        return updates.stream()
                .filter(u -> (int) u.get("index") == index)
                .map(u -> (Map<String, Object>) u.get("changes"))
                .findFirst().orElseThrow();
    }

    @Test
    void broadcast_changementDePhase_etatComplet() {
        broadcaster.broadcast(g, false);
        clearInvocations(publisher);

        g.setPhase(GamePhase.SCORING);
        broadcaster.broadcast(g, false);

        verify(publisher, times(3)).toConnection(any(), eq(GameEventType.GAME_UPDATED), eq("G1"), any());
    }

    @Test
    void broadcast_sauvegardeDiffereeDUneCopie() {
        broadcaster.broadcast(g, false);
        ArgumentCaptor<Runnable> save = ArgumentCaptor.forClass(Runnable.class);
        verify(events).schedule(eq("G1"), eq(ScheduledEvents.SAVE), isNull(), anyLong(), save.capture());

        save.getValue().run();

        ArgumentCaptor<GameSession> saved = ArgumentCaptor.forClass(GameSession.class);
        verify(persistence).saveGame(saved.capture());
        assertThat(saved.getValue()).isNotSameAs(g);
        assertThat(saved.getValue().getId()).isEqualTo("G1");
        assertThat(saved.getValue().getSeats()).hasSize(4);
    }

    @Test
    void sauvegardeDifferee_apresFermeture_nEcritRien() {
        broadcaster.broadcast(g, false);
        ArgumentCaptor<Runnable> save = ArgumentCaptor.forClass(Runnable.class);
        verify(events).schedule(eq("G1"), eq(ScheduledEvents.SAVE), isNull(), anyLong(), save.capture());

        // la partie est fermée avant l'échéance
        broadcaster.forget("G1");
        save.getValue().run();

        verify(persistence, never()).saveGame(any());
    }

    @Test
    void snapshot_copieProfonde() {
        GameSession copy = broadcaster.snapshot(g);

        g.getSeats().get(0).getHand().clear();

        assertThat(copy.getSeats().get(0).getHand()).hasSize(2);
        assertThat(copy).isEqualTo(broadcaster.snapshot(copy));
    }

    @Test
    void sendFullTo_vueDuSiegeDeLaConnexion() {
        broadcaster.sendFullTo(g, "cB");

        ArgumentCaptor<Object> state = ArgumentCaptor.forClass(Object.class);
        verify(publisher).toConnection(eq("cB"), eq(GameEventType.GAME_UPDATED), eq("G1"), state.capture());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> seats = (List<Map<String, Object>>) ((Map<String, Object>) state.getValue()).get("seats");
        assertThat(seats.get(1)).containsKey("hand");
        assertThat(seats.get(0)).doesNotContainKey("hand");
    }

    @Test
    void forget_annuleLaSauvegarde() {
        broadcaster.forget("G1");

        verify(events).cancel("G1", ScheduledEvents.SAVE, null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object o) {
        return (Map<String, Object>) o;
    }
}
