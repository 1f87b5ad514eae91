package utala.cli;

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import utala.ai.AgentFactory;
import utala.view.SimulateMatch;

/**
 * Simulation subcommand: agent vs agent matches.
 */
@Command(
    name = "sim",
    description = "Run agent vs agent game simulations",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class SimCommand implements Callable<Integer> {
    public static final int SEATS = 2;

    // === Agents ===

    @Option(
        names = {"-A", "--agent"},
        description = "Agent for a seat as N:TYPE, e.g. -A 1:rollout -A 2:heuristic. Types: random, heuristic, rollout. Default: random",
        paramLabel = "N:TYPE"
    )
    private List<String> agentAssignments = new ArrayList<>();

    @Option(
        names = {"-P", "--profile"},
        description = "AI profile for a rollout agent as N:PROFILE, e.g. -P 1:Fast",
        paramLabel = "N:PROFILE"
    )
    private List<String> profileAssignments = new ArrayList<>();

    // === Games ===

    @Option(
        names = {"-n", "--games"},
        description = "Number of games to simulate. Default: ${DEFAULT-VALUE}",
        defaultValue = "1",
        paramLabel = "N"
    )
    private int numGames;

    @Option(
        names = {"-s", "--seed"},
        description = "Seed of the first game; each further game adds one. Default: ${DEFAULT-VALUE}",
        defaultValue = "0",
        paramLabel = "SEED"
    )
    private long seed;

    @Option(
        names = {"-b", "--balanced"},
        description = "Swap seats for the second half of the games (needs an even game count)."
    )
    private boolean balanced;

    // === Output ===

    @Option(
        names = {"-q", "--quiet"},
        description = "Only show the summary and a progress bar."
    )
    private boolean quiet;

    @Option(
        names = {"-v", "--verbose"},
        description = "Print every move and dogfight."
    )
    private boolean verbose;

    @Option(
        names = {"--json"},
        description = "Output results as JSON on stdout."
    )
    private boolean jsonOutput;

    @Option(
        names = {"--csv"},
        description = "Output results as CSV on stdout."
    )
    private boolean csvOutput;

    @Option(
        names = {"--save-replays"},
        description = "Directory to write one replay file per game into.",
        paramLabel = "DIR"
    )
    private File replayDir;

    @Option(
        names = {"--list-profiles"},
        description = "List the available AI profiles and exit."
    )
    private boolean listProfiles;

    public int getNumGames() {
        return numGames;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isBalanced() {
        return balanced;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    public boolean isCsvOutput() {
        return csvOutput;
    }

    public File getReplayDir() {
        return replayDir;
    }

    public boolean isListProfiles() {
        return listProfiles;
    }

    /**
     * @param seat 1 or 2
     * @return the agent type for the seat, random when not given
     * @throws IllegalArgumentException on a malformed assignment or seat number
     */
    public String getAgentType(int seat) {
        String type = parseAssignments(agentAssignments, "-A", "N:TYPE").get(seat);
        return type == null ? AgentFactory.RANDOM : type;
    }

    /**
     * @param seat 1 or 2
     * @return the AI profile for the seat, or null
     */
    public String getProfile(int seat) {
        return parseAssignments(profileAssignments, "-P", "N:PROFILE").get(seat);
    }

    private static Map<Integer, String> parseAssignments(List<String> assignments, String flag, String form) {
        Map<Integer, String> result = new HashMap<>();
        for (String assignment : assignments) {
            int colon = assignment.indexOf(':');
            if (colon <= 0 || colon == assignment.length() - 1) {
                throw new IllegalArgumentException("Invalid " + flag + " value '" + assignment + "' (expected " + form + ")");
            }
            int seat;
            try {
                seat = Integer.parseInt(assignment.substring(0, colon));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid seat in " + flag + " value '" + assignment + "'", e);
            }
            if (seat < 1 || seat > SEATS) {
                throw new IllegalArgumentException("Seat must be 1 or 2 in " + flag + " value '" + assignment + "'");
            }
            result.put(seat, assignment.substring(colon + 1));
        }
        return result;
    }

    @Override
    public Integer call() {
        if (listProfiles) {
            return SimulateMatch.listProfiles();
        }
        return SimulateMatch.simulate(this);
    }
}
