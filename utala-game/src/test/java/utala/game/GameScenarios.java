package utala.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import utala.game.action.ActionCatalog;

/**
 * Builds engines in known positions for tests. Lives in the engine's package so it can reach
 * the state mutators.
 */
final class GameScenarios {
    static final ActionCatalog CATALOG = ActionCatalog.get();

    private GameScenarios() {
    }

    /**
     * Plays out placement from two 3x3 power grids. Squares are filled in row-major order,
     * P1 then P2 on each, so every square ends up contested.
     */
    static GameEngine placed(long seed, int[][] p1Powers, int[][] p2Powers) {
        GameEngine engine = new GameEngine(seed);
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                if (!engine.applyAction(CATALOG.placementIndex(p1Powers[r][c], r, c))) {
                    throw new IllegalArgumentException("P1 placement rejected at " + r + "," + c);
                }
                if (!engine.applyAction(CATALOG.placementIndex(p2Powers[r][c], r, c))) {
                    throw new IllegalArgumentException("P2 placement rejected at " + r + "," + c);
                }
            }
        }
        return engine;
    }

    /**
     * Replaces a player's draw pile with the given cards in draw order. The discard pile gets
     * the rest of the deck so the two still add up to a full deck.
     */
    static void rigDrawPile(GameEngine engine, Player player, Integer... cards) {
        List<Integer> pile = Arrays.asList(cards);
        List<Integer> discard = new ArrayList<>();
        for (int card = 1; card <= PlayerResources.DECK_SIZE; card++) {
            if (!pile.contains(card)) {
                discard.add(card);
            }
        }
        PlayerResources resources = engine.state().getResources(player);
        resources.setDrawPile(pile);
        resources.setDiscardPile(discard);
    }

    /** Draw piles that give P1 13, 12, 11... and P2 1, 2, 3... */
    static void rigDescendingVsAscending(GameEngine engine) {
        rigDrawPile(engine, Player.ONE, 13, 12, 11, 10, 9, 8, 7, 6, 5, 4, 3, 2, 1);
        rigDrawPile(engine, Player.TWO, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13);
    }

    /** Runs one dogfight in which both players only pass. */
    static DogfightResult resolveWithPasses(GameEngine engine) {
        engine.beginDogfight();
        while (!engine.isDogfightComplete()) {
            engine.applyDogfightTurnAction(engine.getDogfightActor(), CATALOG.passIndex());
        }
        return engine.finishDogfight();
    }

    /**
     * Sets the board directly and jumps to the dogfight phase with the given resolution order.
     * A positive cell is a unit of that power, 0 is empty.
     */
    static GameEngine dogfightsFrom(long seed, int[][] p1Powers, int[][] p2Powers, Position... order) {
        GameEngine engine = new GameEngine(seed);
        GameState state = engine.state();
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                if (p1Powers[r][c] > 0) {
                    state.square(Position.of(r, c)).add(Unit.place(Player.ONE, p1Powers[r][c]));
                }
                if (p2Powers[r][c] > 0) {
                    state.square(Position.of(r, c)).add(Unit.place(Player.TWO, p2Powers[r][c]));
                }
            }
        }
        for (Player p : Player.values()) {
            for (int power = Unit.MIN_POWER; power <= Unit.MAX_POWER; power++) {
                state.getResources(p).removeUnplaced(power);
            }
        }
        state.setPhase(Phase.DOGFIGHTS);
        state.setDogfightOrder(Arrays.asList(order));
        return engine;
    }

    /** Plays uniformly random legal moves until the game ends. */
    static void playRandomly(GameEngine engine, Random rng) {
        while (!engine.isGameOver()) {
            step(engine, rng);
        }
    }

    /** Applies one random legal move; begins or finishes a dogfight as needed. */
    static void step(GameEngine engine, Random rng) {
        if (engine.getPhase() == Phase.PLACEMENT) {
            List<Integer> legal = engine.getLegalActions();
            engine.applyAction(legal.get(rng.nextInt(legal.size())));
        } else if (engine.isDogfightComplete()) {
            engine.finishDogfight();
        } else if (engine.getDogfightActor() == null) {
            engine.beginDogfight();
        } else {
            Player actor = engine.getDogfightActor();
            List<Integer> legal = engine.getDogfightLegalActions(actor);
            engine.applyDogfightTurnAction(actor, legal.get(rng.nextInt(legal.size())));
        }
    }
}
