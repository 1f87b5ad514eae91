package utala.game.replay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import utala.game.GameEngine;
import utala.game.Player;

/**
 * A recorded game: the engine seed plus every action in the order it was applied. Seed and
 * actions are enough to rebuild the game exactly; see {@link ReplayPlayer}.
 */
public class Replay {
    public static final String FORMAT_VERSION = "v1";

    private String formatVersion = FORMAT_VERSION;
    private long seed;
    private List<int[]> actions = new ArrayList<>();
    private ReplayMetadata metadata = new ReplayMetadata();
    private Integer winner;

    /** For Gson. */
    Replay() {
    }

    public Replay(long seed, List<Pair<Player, Integer>> history, ReplayMetadata metadata, Player winner) {
        this.seed = seed;
        for (Pair<Player, Integer> entry : history) {
            actions.add(new int[] {entry.getLeft().getId(), entry.getRight()});
        }
        this.metadata = metadata != null ? metadata : new ReplayMetadata();
        this.winner = winner == null ? null : winner.getId();
    }

    /**
     * Captures a game played on the given engine. The game does not have to be finished.
     */
    public static Replay fromGame(GameEngine engine, ReplayMetadata metadata) {
        return new Replay(engine.getSeed(), engine.getActionHistory(), metadata, engine.getWinner());
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return the recorded (player, action index) pairs, in order
     */
    public List<Pair<Player, Integer>> getActions() {
        List<Pair<Player, Integer>> result = new ArrayList<>(actions.size());
        for (int[] a : actions) {
            result.add(ImmutablePair.of(Player.fromId(a[0]), a[1]));
        }
        return Collections.unmodifiableList(result);
    }

    int getActionCount() {
        return actions == null ? 0 : actions.size();
    }

    List<int[]> rawActions() {
        return actions;
    }

    Integer rawWinner() {
        return winner;
    }

    public ReplayMetadata getMetadata() {
        return metadata;
    }

    /**
     * @return the stored winner, or null for a draw or an unfinished game
     */
    public Player getWinner() {
        return winner == null ? null : Player.fromId(winner);
    }
}
