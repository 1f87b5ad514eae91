package utala.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Authoritative game state. Everything public here is read-only; only code in this package
 * (the engine and the hidden-information sampler) can change it. Agents receive copies.
 */
public final class GameState {
    private final Square[][] grid = new Square[Position.SIZE][Position.SIZE];
    private final Map<Player, PlayerResources> resources = new EnumMap<>(Player.class);
    private final List<Position> dogfightOrder = new ArrayList<>();

    private Phase phase = Phase.PLACEMENT;
    private Player currentPlayer = Player.ONE;
    private int turnNumber;
    private int currentDogfightIndex;
    private DogfightTurnState dogfightTurn;
    private Player priorityHolder = Player.TWO;
    private GameOutcome outcome;
    private final long rngSeed;

    GameState(long rngSeed) {
        this.rngSeed = rngSeed;
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                grid[r][c] = new Square();
            }
        }
        for (Player p : Player.values()) {
            resources.put(p, new PlayerResources());
        }
    }

    private GameState(GameState other) {
        this.rngSeed = other.rngSeed;
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                grid[r][c] = other.grid[r][c].copy();
            }
        }
        for (Player p : Player.values()) {
            resources.put(p, other.resources.get(p).copy());
        }
        dogfightOrder.addAll(other.dogfightOrder);
        phase = other.phase;
        currentPlayer = other.currentPlayer;
        turnNumber = other.turnNumber;
        currentDogfightIndex = other.currentDogfightIndex;
        dogfightTurn = other.dogfightTurn == null ? null : other.dogfightTurn.copy();
        priorityHolder = other.priorityHolder;
        outcome = other.outcome;
    }

    /**
     * @return a deep copy sharing no mutable structure with this state
     */
    public GameState copy() {
        return new GameState(this);
    }

    public Square getSquare(Position position) {
        return grid[position.getRow()][position.getCol()];
    }

    public Square getSquare(int row, int col) {
        return getSquare(Position.of(row, col));
    }

    public PlayerResources getResources(Player player) {
        return resources.get(player);
    }

    public Phase getPhase() {
        return phase;
    }

    /** Whose placement turn it is. Meaningless once placement is over. */
    public Player getCurrentPlayer() {
        return currentPlayer;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public List<Position> getDogfightOrder() {
        return Collections.unmodifiableList(dogfightOrder);
    }

    public int getCurrentDogfightIndex() {
        return currentDogfightIndex;
    }

    public boolean hasRemainingDogfights() {
        return currentDogfightIndex < dogfightOrder.size();
    }

    /**
     * @return the contested square being (or about to be) resolved, or null
     */
    public Position getCurrentDogfightPosition() {
        return phase == Phase.DOGFIGHTS && hasRemainingDogfights() ? dogfightOrder.get(currentDogfightIndex) : null;
    }

    /**
     * @return the active dogfight's turn state, or null between dogfights
     */
    public DogfightTurnState getDogfightTurn() {
        return dogfightTurn;
    }

    /**
     * @return what an agent may see about the active dogfight, or null
     */
    public DogfightContext getDogfightContext() {
        return dogfightTurn == null || dogfightTurn.isComplete() ? null : dogfightTurn.toContext();
    }

    public Player getPriorityHolder() {
        return priorityHolder;
    }

    public GameOutcome getOutcome() {
        return outcome;
    }

    public boolean isGameOver() {
        return phase == Phase.ENDED;
    }

    /**
     * @return the winner, or null while the game runs or when it ended in a draw
     */
    public Player getWinner() {
        return outcome == null ? null : outcome.getWinner();
    }

    public long getRngSeed() {
        return rngSeed;
    }

    public int countControlledSquares(Player player) {
        int count = 0;
        for (Position pos : Position.all()) {
            if (getSquare(pos).getController() == player) {
                count++;
            }
        }
        return count;
    }

    /**
     * True if the player controls all three squares of some row, column or diagonal.
     * Contested squares count for nobody.
     */
    public boolean hasThreeInRow(Player player) {
        for (ImmutableList<Position> line : Position.LINES) {
            boolean owned = true;
            for (Position pos : line) {
                if (getSquare(pos).getController() != player) {
                    owned = false;
                    break;
                }
            }
            if (owned) {
                return true;
            }
        }
        return false;
    }

    // mutators, engine and sampler only

    Square square(Position position) {
        return getSquare(position);
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    void setCurrentPlayer(Player player) {
        this.currentPlayer = player;
    }

    void incrementTurnNumber() {
        turnNumber++;
    }

    void setDogfightOrder(List<Position> order) {
        dogfightOrder.clear();
        dogfightOrder.addAll(order);
        currentDogfightIndex = 0;
    }

    void advanceDogfightIndex() {
        currentDogfightIndex++;
    }

    void setDogfightTurn(DogfightTurnState turn) {
        this.dogfightTurn = turn;
    }

    void flipPriority() {
        priorityHolder = priorityHolder.opponent();
    }

    void setPriorityHolder(Player player) {
        this.priorityHolder = player;
    }

    void setOutcome(GameOutcome outcome) {
        this.outcome = outcome;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState)) return false;
        GameState s = (GameState) o;
        if (rngSeed != s.rngSeed || phase != s.phase || currentPlayer != s.currentPlayer
                || turnNumber != s.turnNumber || currentDogfightIndex != s.currentDogfightIndex
                || priorityHolder != s.priorityHolder || outcome != s.outcome) {
            return false;
        }
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                if (!grid[r][c].equals(s.grid[r][c])) {
                    return false;
                }
            }
        }
        return resources.equals(s.resources)
                && dogfightOrder.equals(s.dogfightOrder)
                && Objects.equals(dogfightTurn, s.dogfightTurn);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(phase, currentPlayer, turnNumber, currentDogfightIndex,
                priorityHolder, outcome, rngSeed, resources, dogfightOrder, dogfightTurn);
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                result = 31 * result + grid[r][c].hashCode();
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Phase: ").append(phase).append("  Turn: ").append(turnNumber);
        if (phase == Phase.PLACEMENT) {
            sb.append("  To move: ").append(currentPlayer);
        }
        sb.append('\n');
        for (int r = 0; r < Position.SIZE; r++) {
            for (int c = 0; c < Position.SIZE; c++) {
                String cell = grid[r][c].toString();
                sb.append(cell);
                for (int pad = cell.length(); pad < 16; pad++) {
                    sb.append(' ');
                }
            }
            sb.append('\n');
        }
        for (Player p : Player.values()) {
            sb.append(p).append(": ").append(resources.get(p)).append('\n');
        }
        if (outcome != null) {
            sb.append("Outcome: ").append(outcome).append('\n');
        }
        return sb.toString();
    }
}
