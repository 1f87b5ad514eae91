package utala.game;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of one resolved dogfight.
 */
public final class DogfightResult {
    private final Position position;
    private final Player winner;
    private final Set<Player> eliminated;
    private final Map<Player, List<Integer>> draws;
    private final boolean undefendedHit;

    DogfightResult(Position position, Player winner, Set<Player> eliminated,
                   Map<Player, List<Integer>> draws, boolean undefendedHit) {
        this.position = position;
        this.winner = winner;
        this.eliminated = eliminated.isEmpty()
                ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(eliminated));
        EnumMap<Player, List<Integer>> copy = new EnumMap<>(Player.class);
        for (Player p : Player.values()) {
            List<Integer> d = draws.get(p);
            copy.put(p, d == null ? ImmutableList.of() : ImmutableList.copyOf(d));
        }
        this.draws = Collections.unmodifiableMap(copy);
        this.undefendedHit = undefendedHit;
    }

    public Position getPosition() {
        return position;
    }

    /**
     * @return the player left holding the square, or null on a double elimination
     */
    public Player getWinner() {
        return winner;
    }

    public Set<Player> getEliminated() {
        return eliminated;
    }

    public boolean isDoubleElimination() {
        return eliminated.size() == 2;
    }

    public List<Integer> getDraws(Player player) {
        return draws.get(player);
    }

    public int getTotalDraws() {
        return draws.get(Player.ONE).size() + draws.get(Player.TWO).size();
    }

    /** True if an unanswered offensive weapon hit and ended the dogfight on its own. */
    public boolean isUndefendedHit() {
        return undefendedHit;
    }

    @Override
    public String toString() {
        return "Dogfight " + position + ": "
                + (winner != null ? winner + " wins" : "both eliminated")
                + " draws=" + draws + (undefendedHit ? " (hit)" : "");
    }
}
