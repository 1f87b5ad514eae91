package utala.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.lang3.time.StopWatch;

import utala.ai.simulation.RolloutEvaluator;
import utala.game.DogfightContext;
import utala.game.GameState;
import utala.game.Phase;
import utala.game.Player;
import utala.game.action.ActionCatalog;

/**
 * Picks the candidate with the best playout win rate.
 *
 * Every placement is searched. In dogfights only the opening move of a fresh dogfight, made
 * by this agent as underdog, is searched, and only if the profile enables it; every other
 * dogfight move is a uniform random choice. Equal scores are broken at random.
 */
public class RolloutAgent implements Agent {
    private final String name;
    private final RolloutEvaluator evaluator;
    private final boolean evaluateDogfights;
    private final boolean debug;
    private final Random rng;

    public RolloutAgent(String name, String profile, long seed) {
        this(name, RolloutEvaluator.fromProfile(profile),
                AiProfileUtil.getBoolProperty(profile, AiProps.EVALUATE_DOGFIGHTS),
                AiProfileUtil.getBoolProperty(profile, AiProps.ROLLOUT_DEBUG),
                seed);
    }

    public RolloutAgent(String name, RolloutEvaluator evaluator, boolean evaluateDogfights, boolean debug, long seed) {
        this.name = name;
        this.evaluator = evaluator;
        this.evaluateDogfights = evaluateDogfights;
        this.debug = debug;
        this.rng = new Random(seed);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int selectAction(GameState state, List<Integer> legalActions, Player player) {
        if (legalActions.size() == 1) {
            return legalActions.get(0);
        }
        if (state.getPhase() == Phase.DOGFIGHTS && !shouldSearchDogfight(state, player)) {
            return legalActions.get(rng.nextInt(legalActions.size()));
        }

        StopWatch sw = StopWatch.createStarted();
        double bestScore = -1.0;
        List<Integer> best = new ArrayList<>();
        for (int action : legalActions) {
            double score = evaluator.evaluate(state, action, player);
            if (debug) {
                System.err.printf("  %s %-18s %.3f%n", name, ActionCatalog.get().get(action), score);
            }
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(action);
            } else if (score == bestScore) {
                best.add(action);
            }
        }
        sw.stop();

        int choice = best.get(rng.nextInt(best.size()));
        if (debug) {
            System.err.println(name + " chose " + ActionCatalog.get().get(choice) + " (" + String.format("%.3f", bestScore)
                    + ", " + legalActions.size() + " candidates, " + sw.getTime() + " ms)");
        }
        return choice;
    }

    private boolean shouldSearchDogfight(GameState state, Player player) {
        if (!evaluateDogfights) {
            return false;
        }
        DogfightContext ctx = state.getDogfightContext();
        return ctx != null && !ctx.isOffensivePending() && ctx.getUnderdog() == player;
    }

    public RolloutEvaluator getEvaluator() {
        return evaluator;
    }

    public boolean isEvaluatingDogfights() {
        return evaluateDogfights;
    }

    @Override
    public String toString() {
        return "RolloutAgent(" + name + ", trials=" + evaluator.getTrials()
                + (evaluator.isUsingInformationSets() ? ", info sets" : "") + ")";
    }
}
