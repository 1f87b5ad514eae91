package utala.ai.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated results of a series of games. "One" and "two" are the agents in the order the
 * match was started with; in a balanced match they are not tied to a seat.
 */
public class MatchResult {
    private final String agentOne;
    private final String agentTwo;
    private int agentOneWins;
    private int agentTwoWins;
    private int draws;
    private final List<GameRecord> games = new ArrayList<>();

    public MatchResult(String agentOne, String agentTwo) {
        this.agentOne = agentOne;
        this.agentTwo = agentTwo;
    }

    void addWinForOne(GameRecord record) {
        agentOneWins++;
        games.add(record);
    }

    void addWinForTwo(GameRecord record) {
        agentTwoWins++;
        games.add(record);
    }

    void addDraw(GameRecord record) {
        draws++;
        games.add(record);
    }

    public String getAgentOne() {
        return agentOne;
    }

    public String getAgentTwo() {
        return agentTwo;
    }

    public int getAgentOneWins() {
        return agentOneWins;
    }

    public int getAgentTwoWins() {
        return agentTwoWins;
    }

    public int getDraws() {
        return draws;
    }

    public int getGameCount() {
        return games.size();
    }

    public List<GameRecord> getGames() {
        return Collections.unmodifiableList(games);
    }

    public double getAgentOneWinRate() {
        return rate(agentOneWins);
    }

    public double getAgentTwoWinRate() {
        return rate(agentTwoWins);
    }

    public double getDrawRate() {
        return rate(draws);
    }

    private double rate(int count) {
        return games.isEmpty() ? 0.0 : (double) count / games.size();
    }

    @Override
    public String toString() {
        return String.format("Match: %s vs %s%nGames: %d%n%s wins: %d (%.1f%%)%n%s wins: %d (%.1f%%)%nDraws: %d (%.1f%%)",
                agentOne, agentTwo, getGameCount(),
                agentOne, agentOneWins, getAgentOneWinRate() * 100,
                agentTwo, agentTwoWins, getAgentTwoWinRate() * 100,
                draws, getDrawRate() * 100);
    }
}
