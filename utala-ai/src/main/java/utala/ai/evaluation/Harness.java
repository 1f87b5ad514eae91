package utala.ai.evaluation;

import java.io.PrintStream;
import java.util.List;
import java.util.function.Consumer;

import org.apache.commons.lang3.time.StopWatch;

import utala.ai.Agent;
import utala.game.GameEngine;
import utala.game.GameOutcome;
import utala.game.GameState;
import utala.game.Phase;
import utala.game.Player;
import utala.game.action.ActionCatalog;
import utala.game.replay.Replay;
import utala.game.replay.ReplayMetadata;

/**
 * Runs games between agents and collects the results.
 *
 * Every decision gets a fresh snapshot taken right before it, so in a dogfight the second
 * and third movers see what was played before them.
 */
public class Harness {
    private final PrintStream log;
    private Consumer<GameRecord> gameListener;

    public Harness() {
        this(null);
    }

    /**
     * @param log  receives a move-by-move account of every game; null for silence
     */
    public Harness(PrintStream log) {
        this.log = log;
    }

    /**
     * Called after every game of a match, in play order.
     */
    public Harness setGameListener(Consumer<GameRecord> listener) {
        this.gameListener = listener;
        return this;
    }

    public GameRecord runGame(Agent agentOne, Agent agentTwo, long seed) {
        StopWatch sw = StopWatch.createStarted();
        GameEngine engine = new GameEngine(seed);
        agentOne.onGameStart(Player.ONE, seed);
        agentTwo.onGameStart(Player.TWO, seed);
        log("=== Game start (seed=" + seed + "): " + agentOne.getName() + " vs " + agentTwo.getName() + " ===");

        int dogfights = 0;
        while (!engine.isGameOver()) {
            if (engine.getPhase() == Phase.PLACEMENT) {
                Player player = engine.getCurrentPlayer();
                Agent agent = player == Player.ONE ? agentOne : agentTwo;
                GameState state = engine.getStateSnapshot();
                int action = agent.selectAction(state, engine.getLegalActions(), player);
                log("Turn " + state.getTurnNumber() + ": " + player + " " + ActionCatalog.get().get(action));
                if (!engine.applyAction(action)) {
                    throw new IllegalStateException(agent.getName() + " chose illegal placement " + action);
                }
                continue;
            }

            log("Dogfight @ " + engine.beginDogfight().getPosition());
            while (!engine.isDogfightComplete()) {
                Player actor = engine.getDogfightActor();
                Agent agent = actor == Player.ONE ? agentOne : agentTwo;
                List<Integer> legal = engine.getDogfightLegalActions(actor);
                int action = agent.selectAction(engine.getStateSnapshot(), legal, actor);
                log("  " + actor + " plays " + ActionCatalog.get().get(action));
                if (!engine.applyDogfightTurnAction(actor, action)) {
                    throw new IllegalStateException(agent.getName() + " chose illegal dogfight action " + action);
                }
            }
            log("  " + engine.finishDogfight());
            dogfights++;
        }

        GameState finalState = engine.getStateSnapshot();
        GameOutcome outcome = engine.getOutcome();
        agentOne.onGameEnd(finalState, outcome);
        agentTwo.onGameEnd(finalState, outcome);
        sw.stop();
        log("=== Game over: " + outcome + " ===");
        log(finalState.toString());

        Replay replay = Replay.fromGame(engine, new ReplayMetadata(agentOne.getName(), agentTwo.getName()));
        return new GameRecord(outcome, finalState.getTurnNumber(), seed, agentOne.getName(), agentTwo.getName(),
                dogfights, sw.getTime(), replay);
    }

    /**
     * Plays {@code games} games with the same seats; the seed goes up by one per game.
     */
    public MatchResult runMatch(Agent agentOne, Agent agentTwo, int games, long startingSeed) {
        MatchResult result = new MatchResult(agentOne.getName(), agentTwo.getName());
        for (int i = 0; i < games; i++) {
            record(result, runGame(agentOne, agentTwo, startingSeed + i), false);
        }
        log(result.toString());
        return result;
    }

    /**
     * Plays half the games with {@code agentOne} seated first and half with the seats
     * swapped. Results are counted from {@code agentOne}'s side.
     *
     * @throws IllegalArgumentException if {@code games} is odd
     */
    public MatchResult runBalancedMatch(Agent agentOne, Agent agentTwo, int games, long startingSeed) {
        if (games % 2 != 0) {
            throw new IllegalArgumentException("A balanced match needs an even number of games, got " + games);
        }
        int half = games / 2;
        MatchResult result = new MatchResult(agentOne.getName(), agentTwo.getName());
        for (int i = 0; i < half; i++) {
            record(result, runGame(agentOne, agentTwo, startingSeed + i), false);
        }
        for (int i = 0; i < half; i++) {
            record(result, runGame(agentTwo, agentOne, startingSeed + half + i), true);
        }
        log("=== Balanced match: " + half + " games in each seat ===");
        log(result.toString());
        return result;
    }

    private void record(MatchResult result, GameRecord game, boolean swapped) {
        Player winner = game.getWinner();
        if (winner == null) {
            result.addDraw(game);
        } else if ((winner == Player.ONE) != swapped) {
            result.addWinForOne(game);
        } else {
            result.addWinForTwo(game);
        }
        if (gameListener != null) {
            gameListener.accept(game);
        }
    }

    private void log(String message) {
        if (log != null) {
            log.println(message);
        }
    }
}
