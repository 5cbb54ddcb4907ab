package org.jaffre.service.game.engine;

import lombok.RequiredArgsConstructor;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameCommand;
import org.jaffre.dto.game.GameCommand.*;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.exception.GameConflictException;
import org.jaffre.exception.GameNotFoundException;
import org.jaffre.exception.GameValidationException;
import org.jaffre.model.game.*;
import org.jaffre.model.game.rules.*;
import org.jaffre.service.game.broadcast.Payloads;
import org.jaffre.service.game.continuity.SeatReferences;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Machine à états d'une partie. Chaque commande est entièrement validée avant
 * la première écriture : une commande refusée laisse l'état intact.
 * L'appelant détient le verrou de la partie.
 */
@Service
@RequiredArgsConstructor
public class GameReducer {

    public static final int MAX_NAME_LENGTH = 20;
    public static final int MAX_BOTS = GameSession.SEATS - 1;
    private static final List<String> BOT_NAMES = List.of("Bot_Alice", "Bot_Bob", "Bot_Carol", "Bot_Dave");

    private final GameProperties props;

    public GameSession create(String gameId, String playerName, String connectionId, long now) {
        String name = normalizeName(playerName);
        GameSession g = new GameSession(gameId, now);
        g.getSeats().add(new Seat(name, connectionId, 1));
        g.setCreatorName(name);
        return g;
    }

    public Transition apply(GameSession g, String actor, String connectionId, GameCommand command, long now) {
        Transition t = Transition.of(g.getId(), g.getPhase());
        if (command instanceof JoinGame c) join(g, c, connectionId, t);
        else if (command instanceof AddBot) addBot(g, actor, t);
        else if (command instanceof SelectTeam c) selectTeam(g, actor, c.teamId());
        else if (command instanceof SwapPosition c) swapPosition(g, actor, c.targetSeatName());
        else if (command instanceof StartGame) startGame(g, t);
        else if (command instanceof PlaceBet c) placeBet(g, actor, c, t);
        else if (command instanceof PlayCard c) playCard(g, actor, c.card(), t);
        else if (command instanceof ClearTrick) clearTrick(g, t);
        else if (command instanceof PlayerReady) playerReady(g, actor, t);
        else if (command instanceof StartNextRound) {
            if (g.getPhase() == GamePhase.SCORING) startNextRound(g, t);
        }
        else if (command instanceof VoteRematch) voteRematch(g, actor, t);
        else if (command instanceof LeaveGame) leave(g, actor, t);
        else if (command instanceof KickPlayer c) kick(g, actor, c.seatName(), t);
        else if (command instanceof ReplaceWithBot c) replaceWithBot(g, actor, c.seatName(), t);
        else if (command instanceof TakeOverBot c) takeOverBot(g, c, connectionId, t);
        else throw new GameValidationException("Commande non prise en charge : " + command.getClass().getSimpleName());

        g.setLastActiveAt(now);
        return t;
    }

    // ---------------------------------------------------------------- sélection des équipes

    private void join(GameSession g, JoinGame c, String connectionId, Transition t) {
        requirePhase(g, GamePhase.TEAM_SELECTION, "La partie a déjà commencé");
        String name = normalizeName(c.playerName());
        if (g.getSeats().size() >= GameSession.SEATS) throw new GameValidationException("Partie complète");
        if (g.findSeat(name).isPresent()) throw new GameConflictException("Ce nom est déjà pris dans la partie");

        int team = g.teamSize(1) <= g.teamSize(2) ? 1 : 2;
        g.getSeats().add(new Seat(name, connectionId, team));
        t.setJoinedSeat(name);
        t.emit(GameEventType.PLAYER_JOINED, Map.of("playerName", name, "teamId", team));
    }

    private void addBot(GameSession g, String actor, Transition t) {
        requireActor(g, actor);
        if (!Objects.equals(actor, g.getCreatorName())) throw new GameValidationException("Seul l'hôte peut ajouter un bot");
        requirePhase(g, GamePhase.TEAM_SELECTION, "La partie a déjà commencé");
        if (g.getSeats().size() >= GameSession.SEATS) throw new GameValidationException("Partie complète");
        if (g.getSeats().stream().filter(Seat::isBot).count() >= MAX_BOTS) {
            throw new GameValidationException("Trois bots au maximum par partie");
        }
        String name = nextBotName(g);
        int team = g.teamSize(1) <= g.teamSize(2) ? 1 : 2;
        g.getSeats().add(Seat.bot(name, team));
        t.setForceFull(true);
        t.emit(GameEventType.PLAYER_JOINED, Map.of("playerName", name, "teamId", team, "bot", true));
    }

    private static String nextBotName(GameSession g) {
        for (String name : BOT_NAMES) {
            if (g.findSeat(name).isEmpty()) return name;
        }
        int n = BOT_NAMES.size() + 1;
        while (g.findSeat("Bot_" + n).isPresent()) n++;
        return "Bot_" + n;
    }

    private void selectTeam(GameSession g, String actor, int teamId) {
        requirePhase(g, GamePhase.TEAM_SELECTION, "Les équipes sont figées");
        Seat seat = requireActor(g, actor);
        if (teamId != 1 && teamId != 2) throw new GameValidationException("Équipe invalide");
        if (seat.getTeamId() == teamId) throw new GameValidationException("Vous êtes déjà dans cette équipe");
        if (g.teamSize(teamId) >= GameSession.SEATS_PER_TEAM) throw new GameValidationException("Équipe complète");
        seat.setTeamId(teamId);
    }

    private void swapPosition(GameSession g, String actor, String target) {
        requirePhase(g, GamePhase.TEAM_SELECTION, "Les places sont figées");
        requireActor(g, actor);
        if (Objects.equals(actor, target)) throw new GameValidationException("Impossible d'échanger avec soi-même");
        int a = g.seatIndexOf(actor);
        int b = target == null ? -1 : g.seatIndexOf(target);
        if (b < 0) throw new GameNotFoundException("Joueur introuvable");
        Collections.swap(g.getSeats(), a, b);
    }

    private void startGame(GameSession g, Transition t) {
        requirePhase(g, GamePhase.TEAM_SELECTION, "La partie a déjà commencé");
        if (g.getSeats().size() != GameSession.SEATS) throw new GameValidationException("Il faut 4 joueurs pour commencer");
        if (g.teamSize(1) != GameSession.SEATS_PER_TEAM || g.teamSize(2) != GameSession.SEATS_PER_TEAM) {
            throw new GameValidationException("Les équipes doivent être équilibrées (2 contre 2)");
        }
        alternateTeams(g);
        g.setTeamScores(new TeamScores());
        g.setRoundNumber(0);
        g.getRoundHistory().clear();
        g.setWinningTeam(null);
        // la donne tourne avant la première distribution : le deuxième siège donne
        g.setDealerIndex(0);
        startNextRound(g, t);
    }

    // partenaires face à face : équipe 1 aux places 0 et 2, équipe 2 aux places 1 et 3
    private void alternateTeams(GameSession g) {
        List<Seat> team1 = g.getSeats().stream().filter(s -> s.getTeamId() == 1).toList();
        List<Seat> team2 = g.getSeats().stream().filter(s -> s.getTeamId() == 2).toList();
        List<Seat> ordered = new ArrayList<>(List.of(team1.get(0), team2.get(0), team1.get(1), team2.get(1)));
        g.setSeats(ordered);
    }

    // ---------------------------------------------------------------- annonces

    private void placeBet(GameSession g, String actor, PlaceBet c, Transition t) {
        requirePhase(g, GamePhase.BETTING, "Ce n'est pas le moment d'annoncer");
        Seat seat = requireActor(g, actor);
        requireTurn(g, seat, "Ce n'est pas votre tour d'annoncer");
        if (g.getCurrentBets().stream().anyMatch(b -> b.getSeatName().equals(seat.getName()))) {
            throw new GameValidationException("Vous avez déjà annoncé");
        }
        boolean isDealer = g.getCurrentSeatIndex() == g.getDealerIndex();
        BettingRules.check(c.amount(), c.withoutTrump(), c.skipped(), isDealer, g.getCurrentBets(), props.ruleSet());

        Bet bet = c.skipped()
                ? Bet.skip(seat.getName(), seat.getConnectionId())
                : Bet.of(seat.getName(), seat.getConnectionId(), c.amount(), c.withoutTrump());
        g.getCurrentBets().add(bet);
        String dealerName = g.dealer().getName();
        g.setHighestBet(copyOf(BettingRules.highest(g.getCurrentBets(), dealerName)));

        if (g.getCurrentBets().size() < GameSession.SEATS) {
            g.nextTurn(GameSession.after(g.getCurrentSeatIndex()));
        } else if (BettingRules.allSkipped(g.getCurrentBets())) {
            g.getCurrentBets().clear();
            g.setHighestBet(null);
            g.nextTurn(GameSession.after(g.getDealerIndex()));
        } else {
            g.setPhase(GamePhase.PLAYING);
            g.nextTurn(g.seatIndexOf(g.getHighestBet().getSeatName()));
        }
        t.setTurnChanged(true);
    }

    // ---------------------------------------------------------------- plis

    private void playCard(GameSession g, String actor, Card card, Transition t) {
        requirePhase(g, GamePhase.PLAYING, "Ce n'est pas le moment de jouer");
        Seat seat = requireActor(g, actor);
        if (g.getCurrentTrick().size() >= GameSession.SEATS) {
            throw new GameValidationException("Attendez la fin du pli en cours");
        }
        requireTurn(g, seat, "Ce n'est pas votre tour");
        if (g.getCurrentTrick().stream().anyMatch(tc -> tc.getSeatName().equals(seat.getName()))) {
            throw new GameValidationException("Vous avez déjà joué dans ce pli");
        }
        if (card == null || card.color() == null) throw new GameValidationException("Carte invalide");
        if (!seat.getHand().contains(card)) throw new GameValidationException("Vous n'avez pas cette carte");
        if (!TrickRules.isLegalPlay(seat.getHand(), g.getCurrentTrick(), card)) {
            throw new GameValidationException("Vous devez fournir la couleur demandée");
        }

        boolean firstCardOfRound = g.getCurrentRoundTricks().isEmpty() && g.getCurrentTrick().isEmpty();
        if (firstCardOfRound && g.getTrump() == null
                && (g.getHighestBet() == null || !g.getHighestBet().isWithoutTrump())) {
            g.setTrump(card.color());
        }
        seat.getHand().remove(card);
        g.getCurrentTrick().add(new TrickCard(seat.getName(), seat.getConnectionId(), card, g.getCurrentTrick().size()));

        if (g.getCurrentTrick().size() < GameSession.SEATS) {
            g.nextTurn(GameSession.after(g.getCurrentSeatIndex()));
            t.setTurnChanged(true);
            return;
        }
        resolveTrick(g, t);
    }

    // le pli reste affiché jusqu'à ClearTrick
    private void resolveTrick(GameSession g, Transition t) {
        TrickRules.Resolution r = TrickRules.resolve(g.getCurrentTrick(), g.getTrump(), props.ruleSet());
        Seat winner = g.findSeat(r.winnerName()).orElseThrow();
        winner.setTricksWon(winner.getTricksWon() + 1);
        winner.setPointsWon(winner.getPointsWon() + r.points());

        List<TrickCard> cards = new ArrayList<>();
        for (TrickCard tc : g.getCurrentTrick()) {
            cards.add(new TrickCard(tc.getSeatName(), tc.getConnectionId(), tc.getCard(), tc.getOrder()));
        }
        TrickResult result = new TrickResult(cards, r.winnerName(), r.points());
        g.setPreviousTrick(result);
        g.getCurrentRoundTricks().add(new TrickResult(new ArrayList<>(cards), r.winnerName(), r.points()));
        g.nextTurn(g.seatIndexOf(r.winnerName()));

        t.setTrickCompleted(true);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("winnerName", r.winnerName());
        payload.put("points", r.points());
        payload.put("cards", Payloads.trickView(cards));
        t.emit(GameEventType.TRICK_RESOLVED, payload);
    }

    private void clearTrick(GameSession g, Transition t) {
        if (g.getPhase() != GamePhase.PLAYING || g.getCurrentTrick().size() < GameSession.SEATS) return;
        g.getCurrentTrick().clear();
        boolean handsEmpty = g.getSeats().stream().allMatch(s -> s.getHand().isEmpty());
        if (handsEmpty) {
            scoreRound(g, t);
        } else {
            t.setTurnChanged(true);
        }
    }

    // ---------------------------------------------------------------- décompte

    private void scoreRound(GameSession g, Transition t) {
        RuleSet rules = props.ruleSet();
        Bet bet = g.getHighestBet();
        Seat bettor = g.findSeat(bet.getSeatName()).orElseThrow();
        int offenseTeam = bettor.getTeamId();
        int defenseTeam = ScoringRules.opponent(offenseTeam);
        int offensePoints = teamPoints(g, offenseTeam);
        int defensePoints = teamPoints(g, defenseTeam);

        ScoringRules.Outcome o = ScoringRules.score(bet.getAmount(), bet.isWithoutTrump(), offensePoints, defensePoints);
        g.getTeamScores().add(offenseTeam, o.offenseDelta());
        g.getTeamScores().add(defenseTeam, o.defenseDelta());

        RoundRecord record = RoundRecord.builder()
                .roundNumber(g.getRoundNumber())
                .bettorName(bettor.getName())
                .bettorTeam(offenseTeam)
                .betAmount(bet.getAmount())
                .withoutTrump(bet.isWithoutTrump())
                .offensePoints(offensePoints)
                .defensePoints(defensePoints)
                .betMade(o.betMade())
                .team1Delta(offenseTeam == 1 ? o.offenseDelta() : o.defenseDelta())
                .team2Delta(offenseTeam == 2 ? o.offenseDelta() : o.defenseDelta())
                .scoresAfter(g.getTeamScores().copy())
                .seatStats(g.getSeats().stream()
                        .map(s -> new RoundRecord.SeatStats(s.getName(), s.getTeamId(), s.getTricksWon(), s.getPointsWon()))
                        .toList())
                .build();
        g.getRoundHistory().add(record);
        g.getPlayersReady().clear();
        g.setPhase(GamePhase.SCORING);
        t.setRoundScored(true);
        t.emit(GameEventType.ROUND_ENDED, record);

        Integer winner = ScoringRules.winner(g.getTeamScores(), offenseTeam, rules);
        if (winner != null) {
            g.setPhase(GamePhase.GAME_OVER);
            g.setWinningTeam(winner);
            g.getRematchVotes().clear();
            g.getSeats().stream().filter(Seat::isBot).forEach(s -> g.getRematchVotes().add(s.getName()));
            t.setGameOver(true);
            t.emit(GameEventType.GAME_OVER, Map.of("winningTeam", winner, "teamScores", g.getTeamScores().copy()));
        }
    }

    private int teamPoints(GameSession g, int teamId) {
        return g.getSeats().stream().filter(s -> s.getTeamId() == teamId).mapToInt(Seat::getPointsWon).sum();
    }

    private void playerReady(GameSession g, String actor, Transition t) {
        requirePhase(g, GamePhase.SCORING, "Aucune manche à valider");
        Seat seat = requireActor(g, actor);
        if (!g.getPlayersReady().contains(seat.getName())) g.getPlayersReady().add(seat.getName());
        boolean allReady = g.getSeats().stream()
                .allMatch(s -> s.isBot() || g.getPlayersReady().contains(s.getName()));
        if (allReady) startNextRound(g, t);
    }

    private void startNextRound(GameSession g, Transition t) {
        g.setDealerIndex(GameSession.after(g.getDealerIndex()));
        g.setRoundNumber(g.getRoundNumber() + 1);
        DealingRules.deal(g, newDeck());
        g.setTrump(null);
        g.getCurrentBets().clear();
        g.setHighestBet(null);
        g.getCurrentTrick().clear();
        g.setPreviousTrick(null);
        g.getCurrentRoundTricks().clear();
        g.getPlayersReady().clear();
        g.setPhase(GamePhase.BETTING);
        g.nextTurn(GameSession.after(g.getDealerIndex()));

        t.setRoundStarted(true);
        t.setTurnChanged(true);
        t.emit(GameEventType.ROUND_STARTED, Map.of(
                "roundNumber", g.getRoundNumber(),
                "dealerName", g.dealer().getName()));
    }

    protected Deck newDeck() {
        return new Deck();
    }

    // ---------------------------------------------------------------- revanche

    private void voteRematch(GameSession g, String actor, Transition t) {
        requirePhase(g, GamePhase.GAME_OVER, "La partie n'est pas terminée");
        Seat seat = requireActor(g, actor);
        if (g.getRematchVotes().contains(seat.getName())) throw new GameValidationException("Vous avez déjà voté");
        g.getRematchVotes().add(seat.getName());
        if (allVotedRematch(g)) resetForRematch(g, t);
    }

    private boolean allVotedRematch(GameSession g) {
        return g.getSeats().stream().allMatch(s -> g.getRematchVotes().contains(s.getName()));
    }

    private void resetForRematch(GameSession g, Transition t) {
        for (Seat s : g.getSeats()) s.resetForNextRound();
        g.setPhase(GamePhase.TEAM_SELECTION);
        g.setTeamScores(new TeamScores());
        g.setRoundNumber(0);
        g.getRoundHistory().clear();
        g.setTrump(null);
        g.getCurrentBets().clear();
        g.setHighestBet(null);
        g.getCurrentTrick().clear();
        g.setPreviousTrick(null);
        g.getCurrentRoundTricks().clear();
        g.getPlayersReady().clear();
        g.getRematchVotes().clear();
        g.setWinningTeam(null);
        g.setDealerIndex(0);
        g.nextTurn(0);
        t.setRematchStarted(true);
        t.setForceFull(true);
    }

    // ---------------------------------------------------------------- sièges

    private void leave(GameSession g, String actor, Transition t) {
        Seat seat = requireActor(g, actor);
        if (seatsRemovable(g)) {
            removeSeat(g, seat, t);
            t.emit(GameEventType.PLAYER_LEFT, Map.of("playerName", seat.getName(), "replacedByBot", false));
        } else {
            convertToBot(g, seat, t);
            t.emit(GameEventType.PLAYER_LEFT, Map.of("playerName", seat.getName(), "replacedByBot", true));
        }
    }

    private void kick(GameSession g, String actor, String target, Transition t) {
        requireActor(g, actor);
        if (!Objects.equals(actor, g.getCreatorName())) throw new GameValidationException("Seul l'hôte peut exclure un joueur");
        requirePhase(g, GamePhase.TEAM_SELECTION, "Impossible d'exclure une fois la partie lancée");
        if (Objects.equals(actor, target)) throw new GameValidationException("Impossible de s'exclure soi-même");
        Seat seat = g.findSeat(target).orElseThrow(() -> new GameNotFoundException("Joueur introuvable"));
        removeSeat(g, seat, t);
        t.setKicked(true);
        t.emit(GameEventType.PLAYER_LEFT, Map.of("playerName", seat.getName(), "kicked", true));
    }

    private void replaceWithBot(GameSession g, String actor, String target, Transition t) {
        Seat me = requireActor(g, actor);
        Seat seat = g.findSeat(target).orElseThrow(() -> new GameNotFoundException("Joueur introuvable"));
        if (seat.isBot()) throw new GameValidationException("Ce siège est déjà un bot");
        if (g.getPhase() == GamePhase.GAME_OVER) throw new GameValidationException("La partie est terminée");
        boolean allowed = me == seat
                || Objects.equals(me.getName(), g.getCreatorName())
                || seat.getConnectionStatus() == ConnectionStatus.DISCONNECTED;
        if (!allowed) throw new GameValidationException("Vous ne pouvez pas remplacer ce joueur");
        long humansLeft = g.getSeats().stream().filter(s -> !s.isBot() && s != seat).count();
        if (humansLeft < 1) throw new GameValidationException("Impossible : vous êtes le dernier joueur humain");
        convertToBot(g, seat, t);
        t.emit(GameEventType.PLAYER_LEFT, Map.of("playerName", seat.getName(), "replacedByBot", true));
    }

    private void takeOverBot(GameSession g, TakeOverBot c, String connectionId, Transition t) {
        if (g.getPhase() == GamePhase.GAME_OVER) throw new GameValidationException("La partie est terminée");
        Seat seat = g.findSeat(c.botName()).orElseThrow(() -> new GameNotFoundException("Bot introuvable"));
        if (!seat.isBot()) throw new GameValidationException("Ce siège n'est pas un bot");
        String name = normalizeName(c.playerName());
        if (!name.equals(seat.getName()) && g.findSeat(name).isPresent()) {
            throw new GameConflictException("Ce nom est déjà pris dans la partie");
        }
        if (g.findSeatByConnection(connectionId).isPresent()) {
            throw new GameConflictException("Vous occupez déjà un siège dans cette partie");
        }
        String oldName = seat.getName();
        SeatReferences.renameSeat(g, oldName, name);
        seat.setBot(false);
        seat.setConnectionStatus(ConnectionStatus.CONNECTED);
        seat.setDisconnectedAt(null);
        SeatReferences.rebindConnection(g, name, connectionId);
        g.getRematchVotes().remove(name);

        t.setTakenOverBot(oldName);
        t.setJoinedSeat(name);
        if (g.inPlay() && g.actingSeat() == seat) t.setTurnChanged(true);
        t.emit(GameEventType.PLAYER_JOINED, Map.of("playerName", name, "teamId", seat.getTeamId(), "replacedBot", oldName));
    }

    private boolean seatsRemovable(GameSession g) {
        return g.getPhase() == GamePhase.TEAM_SELECTION || g.getPhase() == GamePhase.GAME_OVER;
    }

    private void removeSeat(GameSession g, Seat seat, Transition t) {
        g.getSeats().remove(seat);
        g.getPlayersReady().remove(seat.getName());
        g.getRematchVotes().remove(seat.getName());
        if (seat.getName().equals(g.getCreatorName())) {
            g.setCreatorName(g.getSeats().stream().filter(s -> !s.isBot()).map(Seat::getName).findFirst().orElse(null));
        }
        g.setCurrentSeatIndex(0);
        g.setDealerIndex(0);
        t.setRemovedSeat(seat.getName());
        t.setRemovedConnectionId(seat.getConnectionId());
        t.setForceFull(true);
        if (g.getPhase() == GamePhase.GAME_OVER && !g.getSeats().isEmpty() && allVotedRematch(g)) {
            resetForRematch(g, t);
        }
    }

    private void convertToBot(GameSession g, Seat seat, Transition t) {
        t.setBotifiedSeat(seat.getName());
        t.setBotifiedConnectionId(seat.getConnectionId());
        seat.setBot(true);
        seat.setConnectionStatus(ConnectionStatus.CONNECTED);
        seat.setDisconnectedAt(null);
        SeatReferences.rebindConnection(g, seat.getName(), null);
        if (g.getPhase() == GamePhase.GAME_OVER && !g.getRematchVotes().contains(seat.getName())) {
            g.getRematchVotes().add(seat.getName());
        }
        if (g.inPlay() && g.actingSeat() == seat) t.setTurnChanged(true);
    }

    // ---------------------------------------------------------------- helpers

    private static String normalizeName(String raw) {
        if (raw == null || raw.isBlank()) throw new GameValidationException("Nom de joueur requis");
        String name = raw.trim();
        if (name.length() > MAX_NAME_LENGTH) name = name.substring(0, MAX_NAME_LENGTH);
        return name;
    }

    private static void requirePhase(GameSession g, GamePhase phase, String message) {
        if (g.getPhase() != phase) throw new GameValidationException(message);
    }

    private static Seat requireActor(GameSession g, String actor) {
        return g.findSeat(actor).orElseThrow(() -> new GameValidationException("Vous n'êtes pas dans cette partie"));
    }

    private static void requireTurn(GameSession g, Seat seat, String message) {
        if (g.actingSeat() != seat) throw new GameValidationException(message);
    }

    private static Bet copyOf(Bet b) {
        if (b == null) return null;
        return new Bet(b.getSeatName(), b.getConnectionId(), b.getAmount(), b.isWithoutTrump(), b.isSkipped());
    }
}
