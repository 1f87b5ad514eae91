package utala.ai;

import java.util.List;
import java.util.Random;

import utala.game.GameState;
import utala.game.Player;

/**
 * Picks uniformly among the legal actions.
 */
public class RandomAgent implements Agent {
    private final String name;
    private final Random rng;

    public RandomAgent(String name, long seed) {
        this.name = name;
        this.rng = new Random(seed);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int selectAction(GameState state, List<Integer> legalActions, Player player) {
        return legalActions.get(rng.nextInt(legalActions.size()));
    }

    @Override
    public String toString() {
        return "RandomAgent(" + name + ")";
    }
}
