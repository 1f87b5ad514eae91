package utala.ai;

import java.util.List;
import java.util.Random;

import utala.game.GameEngine;
import utala.game.Phase;

/**
 * Drives engines into known phases through the public engine API.
 */
final class AgentTestSupport {
    private AgentTestSupport() {
    }

    /** Random placements until the first dogfight has begun. */
    static GameEngine atFirstDogfight(long seed) {
        GameEngine engine = new GameEngine(seed);
        Random rng = new Random(seed);
        while (engine.getPhase() == Phase.PLACEMENT) {
            List<Integer> legal = engine.getLegalActions();
            engine.applyAction(legal.get(rng.nextInt(legal.size())));
        }
        engine.beginDogfight();
        return engine;
    }
}
