/*
 * utala: kaos 9
 * Copyright (C) 2026  utala developers
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package utala.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import com.google.common.annotations.VisibleForTesting;

import utala.game.action.Action;
import utala.game.action.ActionCatalog;

/**
 * Owns a game: validates and applies every action, holds the only RNG that touches the game
 * world, and drives the phase machine PLACEMENT, DOGFIGHTS, ENDED.
 *
 * <p>Placement moves go through {@link #applyAction(int)}. Each contested square is then
 * resolved with {@link #beginDogfight()}, two or three calls to
 * {@link #applyDogfightTurnAction(Player, int)} and {@link #finishDogfight()}.
 *
 * <p>An illegal move is reported by returning false and leaves no trace. Calling the wrong
 * method for the phase, or acting out of turn, throws {@link ProtocolViolationException}.
 *
 * <p>Not thread-safe. Rollouts each build their own engine through
 * {@link #forSimulation(GameState, long)}.
 */
public class GameEngine {
    /** Card value at or above which an undefended offensive weapon hits. */
    public static final int HIT_THRESHOLD = 7;

    private final long seed;
    private final Random rng;
    private final GameState state;
    private final ActionCatalog catalog = ActionCatalog.get();
    private final List<Pair<Player, Integer>> actionHistory = new ArrayList<>();

    public GameEngine() {
        this(ThreadLocalRandom.current().nextLong(0, Integer.MAX_VALUE));
    }

    public GameEngine(long seed) {
        this.seed = seed;
        this.rng = new Random(seed);
        this.state = new GameState(seed);
        // P1's pile first, then P2's, both from the engine stream
        for (Player p : Player.values()) {
            state.getResources(p).shuffleDrawPile(rng);
        }
    }

    private GameEngine(GameState snapshot, long seed) {
        this.seed = seed;
        this.rng = new Random(seed);
        this.state = snapshot.copy();
    }

    /**
     * Builds a disposable engine that continues from a copy of the given state with its own
     * RNG stream. Used by rollouts; the history starts empty.
     */
    public static GameEngine forSimulation(GameState snapshot, long seed) {
        return new GameEngine(snapshot, seed);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return a deep copy of the current state
     */
    public GameState getStateSnapshot() {
        return state.copy();
    }

    @VisibleForTesting
    GameState state() {
        return state;
    }

    public List<Pair<Player, Integer>> getActionHistory() {
        return Collections.unmodifiableList(actionHistory);
    }

    public Phase getPhase() {
        return state.getPhase();
    }

    public Player getCurrentPlayer() {
        return state.getCurrentPlayer();
    }

    public List<Integer> getLegalActions() {
        return getLegalActions(state.getCurrentPlayer());
    }

    public List<Integer> getLegalActions(Player player) {
        return catalog.legalIndices(state, player);
    }

    public boolean[] getLegalActionsMask(Player player) {
        return catalog.legalMask(state, player);
    }

    // ------------------------------------------------------------------
    // Placement
    // ------------------------------------------------------------------

    /**
     * Places a unit for the current player.
     *
     * @return false if the index is not legal for the current player; nothing changes then
     * @throws ProtocolViolationException outside the placement phase
     */
    public boolean applyAction(int index) {
        if (state.getPhase() != Phase.PLACEMENT) {
            throw new ProtocolViolationException("applyAction called during " + state.getPhase());
        }
        Player player = state.getCurrentPlayer();
        if (!catalog.isLegal(state, player, index)) {
            return false;
        }

        Action action = catalog.get(index);
        state.square(action.getPosition()).add(Unit.place(player, action.getPower()));
        state.getResources(player).removeUnplaced(action.getPower());
        actionHistory.add(ImmutablePair.of(player, index));
        state.incrementTurnNumber();
        state.setCurrentPlayer(player.opponent());

        if (!state.getResources(Player.ONE).hasUnplacedUnits()
                && !state.getResources(Player.TWO).hasUnplacedUnits()) {
            startDogfightPhase();
        }
        return true;
    }

    private void startDogfightPhase() {
        state.setPhase(Phase.DOGFIGHTS);
        List<Position> order = new ArrayList<>();
        for (Position pos : Position.RESOLUTION_ORDER) {
            if (state.getSquare(pos).isContested()) {
                order.add(pos);
            }
        }
        state.setDogfightOrder(order);
        if (order.isEmpty()) {
            endGame();
        }
    }

    // ------------------------------------------------------------------
    // Dogfight turn protocol
    // ------------------------------------------------------------------

    /**
     * Starts the next dogfight: both units are revealed and the underdog is chosen. The lower
     * power acts first; on equal power the priority holder does, and the token flips.
     */
    public DogfightContext beginDogfight() {
        if (state.getPhase() != Phase.DOGFIGHTS) {
            throw new ProtocolViolationException("beginDogfight called during " + state.getPhase());
        }
        if (state.getDogfightTurn() != null) {
            throw new ProtocolViolationException("Dogfight at " + state.getDogfightTurn().getPosition()
                    + " is still active");
        }
        if (!state.hasRemainingDogfights()) {
            throw new ProtocolViolationException("No dogfights remaining");
        }

        Position pos = state.getCurrentDogfightPosition();
        Square square = state.square(pos);
        Unit one = square.getUnit(Player.ONE);
        Unit two = square.getUnit(Player.TWO);
        one.reveal();
        two.reveal();

        Player underdog;
        if (one.getPower() < two.getPower()) {
            underdog = Player.ONE;
        } else if (two.getPower() < one.getPower()) {
            underdog = Player.TWO;
        } else {
            underdog = state.getPriorityHolder();
            state.flipPriority();
        }

        DogfightTurnState turn = new DogfightTurnState(pos, underdog);
        state.setDogfightTurn(turn);
        return turn.toContext();
    }

    /**
     * @return the player expected to act in the active dogfight, or null if none is waiting
     */
    public Player getDogfightActor() {
        DogfightTurnState turn = state.getDogfightTurn();
        return turn == null ? null : turn.getCurrentActor();
    }

    public DogfightContext getDogfightContext() {
        return state.getDogfightContext();
    }

    public List<Integer> getDogfightLegalActions(Player player) {
        requireActor(player);
        return catalog.legalIndices(state, player);
    }

    /**
     * Records one dogfight move. The weapon's role follows from the turn order.
     *
     * @return false if the index is not legal for the player; nothing changes then
     */
    public boolean applyDogfightTurnAction(Player player, int index) {
        DogfightTurnState turn = requireActor(player);
        if (!catalog.isLegal(state, player, index)) {
            return false;
        }
        turn.record(catalog.get(index));
        actionHistory.add(ImmutablePair.of(player, index));
        return true;
    }

    private DogfightTurnState requireActor(Player player) {
        DogfightTurnState turn = state.getDogfightTurn();
        if (turn == null) {
            throw new ProtocolViolationException("No active dogfight");
        }
        if (turn.isComplete()) {
            throw new ProtocolViolationException("Dogfight at " + turn.getPosition() + " is complete");
        }
        if (turn.getCurrentActor() != player) {
            throw new ProtocolViolationException("Not " + player + "'s turn, waiting on " + turn.getCurrentActor());
        }
        return turn;
    }

    public boolean isDogfightComplete() {
        DogfightTurnState turn = state.getDogfightTurn();
        return turn != null && turn.isComplete();
    }

    public Position getCurrentDogfightPosition() {
        return state.getCurrentDogfightPosition();
    }

    /**
     * Resolves the completed dogfight, advances to the next one and checks for the end of
     * the game.
     */
    public DogfightResult finishDogfight() {
        DogfightTurnState turn = state.getDogfightTurn();
        if (turn == null) {
            throw new ProtocolViolationException("No active dogfight");
        }
        if (!turn.isComplete()) {
            throw new ProtocolViolationException("Dogfight at " + turn.getPosition() + " is not complete");
        }

        DogfightResult result = resolve(turn);
        Square square = state.square(turn.getPosition());
        for (Player p : result.getEliminated()) {
            square.removeUnitOf(p);
        }

        state.setDogfightTurn(null);
        state.advanceDogfightIndex();

        if (state.hasThreeInRow(Player.ONE) || state.hasThreeInRow(Player.TWO)
                || !state.hasRemainingDogfights()) {
            endGame();
        }
        return result;
    }

    private DogfightResult resolve(DogfightTurnState turn) {
        Commitment offense = turn.getOffense();
        Commitment defense = turn.getDefense();
        if (defense != null && (offense == null || defense.isOffensive())) {
            throw new IllegalStateException("Unreachable weapon commitments: " + offense + ", " + defense);
        }
        if (offense != null && !offense.isOffensive()) {
            throw new IllegalStateException("Unreachable weapon commitments: " + offense + ", " + defense);
        }

        if (offense != null) {
            state.getResources(offense.getPlayer()).removeWeapon(offense.getWeaponSlot());
        }
        if (defense != null) {
            state.getResources(defense.getPlayer()).removeWeapon(defense.getWeaponSlot());
        }

        Map<Player, List<Integer>> draws = new EnumMap<>(Player.class);
        for (Player p : Player.values()) {
            draws.put(p, new ArrayList<>(2));
        }
        Set<Player> eliminated = EnumSet.noneOf(Player.class);

        if (offense != null && defense == null) {
            Player attacker = offense.getPlayer();
            int card = draw(attacker, draws);
            if (card >= HIT_THRESHOLD) {
                eliminated.add(attacker.opponent());
                return new DogfightResult(turn.getPosition(), attacker, eliminated, draws, true);
            }
        }

        // offense and defense cancel; a miss or no weapons lands here too
        Square square = state.getSquare(turn.getPosition());
        int total1 = square.getUnit(Player.ONE).getPower() + draw(Player.ONE, draws);
        int total2 = square.getUnit(Player.TWO).getPower() + draw(Player.TWO, draws);

        Player winner = null;
        if (total1 > total2) {
            winner = Player.ONE;
            eliminated.add(Player.TWO);
        } else if (total2 > total1) {
            winner = Player.TWO;
            eliminated.add(Player.ONE);
        } else {
            eliminated.add(Player.ONE);
            eliminated.add(Player.TWO);
        }
        return new DogfightResult(turn.getPosition(), winner, eliminated, draws, false);
    }

    private int draw(Player player, Map<Player, List<Integer>> draws) {
        int card = state.getResources(player).draw(rng);
        draws.get(player).add(card);
        return card;
    }

    // ------------------------------------------------------------------
    // End of game
    // ------------------------------------------------------------------

    private void endGame() {
        boolean oneLine = state.hasThreeInRow(Player.ONE);
        boolean twoLine = state.hasThreeInRow(Player.TWO);

        GameOutcome outcome;
        if (oneLine && twoLine) {
            outcome = GameOutcome.winFor(state.getPriorityHolder());
        } else if (oneLine) {
            outcome = GameOutcome.PLAYER_ONE;
        } else if (twoLine) {
            outcome = GameOutcome.PLAYER_TWO;
        } else {
            int one = state.countControlledSquares(Player.ONE);
            int two = state.countControlledSquares(Player.TWO);
            outcome = one > two ? GameOutcome.PLAYER_ONE
                    : two > one ? GameOutcome.PLAYER_TWO
                    : GameOutcome.DRAW;
        }
        state.setOutcome(outcome);
        state.setPhase(Phase.ENDED);
    }

    public boolean isGameOver() {
        return state.isGameOver();
    }

    /**
     * @return the outcome, or null while the game runs
     */
    public GameOutcome getOutcome() {
        return state.getOutcome();
    }

    /**
     * @return the winner, or null on a draw or while the game runs
     */
    public Player getWinner() {
        return state.getWinner();
    }

    @Override
    public String toString() {
        return "GameEngine[seed=" + seed + "]\n" + state;
    }
}
