package utala.game.replay;

import org.apache.commons.lang3.tuple.Pair;

import utala.game.GameEngine;
import utala.game.Phase;
import utala.game.Player;

/**
 * Plays a replay back on a fresh engine built from its seed.
 */
public final class ReplayPlayer {

    private ReplayPlayer() {
    }

    /**
     * @return the engine after every recorded action has been applied
     * @throws ReplayException if an action is out of turn or rejected by the engine
     */
    public static GameEngine play(Replay replay) throws ReplayException {
        GameEngine engine = new GameEngine(replay.getSeed());
        int step = 0;
        for (Pair<Player, Integer> entry : replay.getActions()) {
            Player player = entry.getLeft();
            int index = entry.getRight();

            if (engine.getPhase() == Phase.PLACEMENT) {
                if (player != engine.getCurrentPlayer()) {
                    throw new ReplayException("Action " + step + ": expected " + engine.getCurrentPlayer()
                            + ", got " + player);
                }
                if (!engine.applyAction(index)) {
                    throw new ReplayException("Action " + step + ": placement " + index + " rejected");
                }
            } else if (engine.getPhase() == Phase.DOGFIGHTS) {
                if (engine.getDogfightActor() == null) {
                    engine.beginDogfight();
                }
                Player actor = engine.getDogfightActor();
                if (player != actor) {
                    throw new ReplayException("Action " + step + ": expected " + actor + ", got " + player);
                }
                if (!engine.applyDogfightTurnAction(player, index)) {
                    throw new ReplayException("Action " + step + ": dogfight action " + index + " rejected");
                }
                if (engine.isDogfightComplete()) {
                    engine.finishDogfight();
                }
            } else {
                throw new ReplayException("Action " + step + " recorded after the game ended");
            }
            step++;
        }
        return engine;
    }
}
