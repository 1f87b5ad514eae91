package utala.ai.evaluation;

import utala.game.GameOutcome;
import utala.game.Player;
import utala.game.replay.Replay;

/**
 * Result of one game played by the harness.
 */
public class GameRecord {
    private final GameOutcome outcome;
    private final int turns;
    private final long seed;
    private final String playerOneAgent;
    private final String playerTwoAgent;
    private final int dogfightsResolved;
    private final long durationMs;
    private final Replay replay;

    public GameRecord(GameOutcome outcome, int turns, long seed, String playerOneAgent, String playerTwoAgent,
                      int dogfightsResolved, long durationMs, Replay replay) {
        this.outcome = outcome;
        this.turns = turns;
        this.seed = seed;
        this.playerOneAgent = playerOneAgent;
        this.playerTwoAgent = playerTwoAgent;
        this.dogfightsResolved = dogfightsResolved;
        this.durationMs = durationMs;
        this.replay = replay;
    }

    public GameOutcome getOutcome() {
        return outcome;
    }

    /** Null on a draw. */
    public Player getWinner() {
        return outcome.getWinner();
    }

    public String getWinnerName() {
        Player winner = getWinner();
        if (winner == null) {
            return null;
        }
        return winner == Player.ONE ? playerOneAgent : playerTwoAgent;
    }

    /** Placements made; always 18 for a finished game. */
    public int getTurns() {
        return turns;
    }

    public long getSeed() {
        return seed;
    }

    public String getPlayerOneAgent() {
        return playerOneAgent;
    }

    public String getPlayerTwoAgent() {
        return playerTwoAgent;
    }

    public int getDogfightsResolved() {
        return dogfightsResolved;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Replay getReplay() {
        return replay;
    }

    @Override
    public String toString() {
        return "Game(seed=" + seed + ") " + playerOneAgent + " vs " + playerTwoAgent + ": "
                + (outcome.isDraw() ? "draw" : getWinnerName() + " (" + getWinner() + ") wins")
                + " after " + dogfightsResolved + " dogfights";
    }
}
