package utala.cli.json;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape of the {@code sim --json} output. Plain fields, written with Gson.
 */
public class SimulationResult {
    public String version;
    public SimulationConfig config;
    public SimulationSummary summary;
    public List<GameResult> games = new ArrayList<>();

    public static class SimulationConfig {
        public int gamesRequested;
        public long startingSeed;
        public boolean balanced;
        public List<AgentConfig> agents = new ArrayList<>();
    }

    public static class AgentConfig {
        public String name;
        public String type;
        /** null unless the agent reads an AI profile */
        public String aiProfile;
    }

    public static class SimulationSummary {
        public int totalGames;
        public int draws;
        public double drawRate;
        public long totalTimeMs;
        public double averageGameTimeMs;
        public double averageDogfights;
        public List<AgentSummary> agents = new ArrayList<>();
    }

    public static class AgentSummary {
        public String name;
        public int wins;
        public int losses;
        public double winRate;
        public double winRateCiLower;
        public double winRateCiUpper;
    }

    public static class GameResult {
        public int gameNumber;
        public long seed;
        public String playerOne;
        public String playerTwo;
        public boolean isDraw;
        public String winner;
        /** 1 or 2; null on a draw */
        public Integer winnerSeat;
        public int dogfights;
        public long durationMs;
    }
}
