package utala.ai.simulation;

import java.util.List;
import java.util.Random;

import utala.game.GameEngine;
import utala.game.Phase;
import utala.game.Player;

/**
 * Plays a game to the end with uniformly random legal moves for both sides.
 */
public final class RandomPlayout {

    private RandomPlayout() {
    }

    /**
     * @return the winner, or null on a draw
     */
    public static Player playToEnd(GameEngine engine, Random rng) {
        while (!engine.isGameOver()) {
            if (engine.getPhase() == Phase.PLACEMENT) {
                List<Integer> legal = engine.getLegalActions();
                engine.applyAction(legal.get(rng.nextInt(legal.size())));
                continue;
            }
            if (engine.getDogfightActor() == null && !engine.isDogfightComplete()) {
                engine.beginDogfight();
            }
            while (!engine.isDogfightComplete()) {
                Player actor = engine.getDogfightActor();
                List<Integer> legal = engine.getDogfightLegalActions(actor);
                engine.applyDogfightTurnAction(actor, legal.get(rng.nextInt(legal.size())));
            }
            engine.finishDogfight();
        }
        return engine.getWinner();
    }
}
