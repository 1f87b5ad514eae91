package utala.ai;

import java.util.List;

import utala.game.GameOutcome;
import utala.game.GameState;
import utala.game.Player;

/**
 * Something that picks moves. Agents only propose action indices; the engine validates and
 * applies them. The state handed in is a private copy and may be read freely.
 */
public interface Agent {

    String getName();

    /**
     * @param state  snapshot of the game at decision time
     * @param legalActions  legal action indices, never empty
     * @param player  the seat this agent is playing
     * @return one of {@code legalActions}
     */
    int selectAction(GameState state, List<Integer> legalActions, Player player);

    default void onGameStart(Player player, long seed) {
    }

    default void onGameEnd(GameState finalState, GameOutcome outcome) {
    }
}
