package utala.view;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.time.StopWatch;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import utala.ai.Agent;
import utala.ai.AgentFactory;
import utala.ai.AiProfileUtil;
import utala.ai.AiProps;
import utala.ai.evaluation.GameRecord;
import utala.ai.evaluation.Harness;
import utala.ai.evaluation.MatchResult;
import utala.cli.ExitCode;
import utala.cli.ProgressBar;
import utala.cli.SimCommand;
import utala.cli.UtalaCli;
import utala.cli.json.SimulationResult;
import utala.cli.stats.WilsonInterval;
import utala.game.Player;
import utala.game.replay.ReplaySerializer;

/**
 * Runs {@code utala sim}. Results go to stdout; progress, warnings and errors to stderr.
 */
public class SimulateMatch {
    private static final PrintStream ORIGINAL_OUT = System.out;
    private static final PrintStream ORIGINAL_ERR = System.err;

    private static final long AGENT_SEED_STRIDE = 7919L;

    private static class AgentSetup {
        final int seat;
        final String type;
        final String profile;
        final Agent agent;

        AgentSetup(int seat, String type, String profile, Agent agent) {
            this.seat = seat;
            this.type = type;
            this.profile = profile;
            this.agent = agent;
        }

        String name() {
            return agent.getName();
        }
    }

    public static int listProfiles() {
        return listProfiles(ORIGINAL_OUT);
    }

    static int listProfiles(PrintStream out) {
        out.println("Available AI profiles:");
        out.println();
        for (String name : AiProfileUtil.getAvailableProfiles()) {
            out.printf("  %-12s  trials=%-3d  info-sets=%-5s  dogfights=%s%n", name,
                    AiProfileUtil.getIntProperty(name, AiProps.ROLLOUT_TRIALS),
                    AiProfileUtil.getBoolProperty(name, AiProps.USE_INFORMATION_SETS),
                    AiProfileUtil.getBoolProperty(name, AiProps.EVALUATE_DOGFIGHTS));
        }
        out.println();
        out.println("Usage: -A 1:rollout -P 1:Strong");
        return ExitCode.SUCCESS;
    }

    public static int simulate(SimCommand cmd) {
        return simulate(cmd, ORIGINAL_OUT, ORIGINAL_ERR);
    }

    static int simulate(SimCommand cmd, PrintStream out, PrintStream err) {
        int nGames = cmd.getNumGames();
        if (nGames < 1) {
            err.println("Error: --games must be at least 1");
            return ExitCode.ARGS_ERROR;
        }
        if (cmd.isBalanced() && nGames % 2 != 0) {
            err.println("Error: --balanced needs an even number of games, got " + nGames);
            return ExitCode.ARGS_ERROR;
        }
        if (cmd.isJsonOutput() && cmd.isCsvOutput()) {
            err.println("Error: Cannot use both --json and --csv");
            return ExitCode.ARGS_ERROR;
        }

        List<AgentSetup> setups = new ArrayList<>();
        try {
            for (int seat = 1; seat <= SimCommand.SEATS; seat++) {
                String type = cmd.getAgentType(seat);
                String profile = cmd.getProfile(seat);
                if (profile != null && !AgentFactory.ROLLOUT.equalsIgnoreCase(type)) {
                    throw new IllegalArgumentException("-P " + seat + ":" + profile
                            + " only applies to a rollout agent, seat " + seat + " is " + type);
                }
                String name = seat + ":" + type + (profile != null ? "(" + profile + ")" : "");
                Agent agent = AgentFactory.create(type, name, profile, cmd.getSeed() + AGENT_SEED_STRIDE * seat);
                setups.add(new AgentSetup(seat, type, profile, agent));
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return ExitCode.ARGS_ERROR;
        }
        AgentSetup first = setups.get(0);
        AgentSetup second = setups.get(1);

        boolean structuredOutput = cmd.isJsonOutput() || cmd.isCsvOutput();
        // game logs must not mix with structured output on stdout
        PrintStream gameLog = cmd.isVerbose() ? (structuredOutput ? err : out) : null;
        boolean perGameLines = !cmd.isQuiet() && !structuredOutput && !cmd.isVerbose();
        ProgressBar progress = (cmd.isQuiet() || structuredOutput) && !cmd.isVerbose() && nGames > 1
                ? new ProgressBar(err, nGames) : null;

        err.println("Simulation: " + first.name() + " vs " + second.name() + ", " + nGames
                + " game(s) from seed " + cmd.getSeed() + (cmd.isBalanced() ? ", balanced seats" : ""));

        int[] gameNumber = {0};
        Harness harness = new Harness(gameLog).setGameListener(game -> {
            gameNumber[0]++;
            if (progress != null) {
                progress.increment();
            } else if (perGameLines) {
                out.println("Game " + gameNumber[0] + ": " + describe(game));
            }
        });

        StopWatch sw = StopWatch.createStarted();
        MatchResult result = cmd.isBalanced()
                ? harness.runBalancedMatch(first.agent, second.agent, nGames, cmd.getSeed())
                : harness.runMatch(first.agent, second.agent, nGames, cmd.getSeed());
        sw.stop();
        if (progress != null) {
            progress.finish();
        }

        if (cmd.getReplayDir() != null) {
            try {
                saveReplays(result, cmd.getReplayDir());
                err.println("Replays written to " + cmd.getReplayDir().getPath());
            } catch (IOException e) {
                err.println("Error: Could not write replays - " + e.getMessage());
                return ExitCode.REPLAY_ERROR;
            }
        }

        if (cmd.isJsonOutput()) {
            outputJsonResult(out, cmd, setups, result, sw.getTime());
        } else if (cmd.isCsvOutput()) {
            outputCsvResult(out, setups, result);
        } else {
            outputSummary(out, result, sw.getTime());
        }
        return ExitCode.SUCCESS;
    }

    private static String describe(GameRecord game) {
        String winner = game.getOutcome().isDraw() ? "draw"
                : game.getWinnerName() + " wins as " + game.getWinner();
        return String.format("seed %d, %s vs %s: %s after %d dogfight(s) [%d ms]",
                game.getSeed(), game.getPlayerOneAgent(), game.getPlayerTwoAgent(), winner,
                game.getDogfightsResolved(), game.getDurationMs());
    }

    static void saveReplays(MatchResult result, File dir) throws IOException {
        List<GameRecord> games = result.getGames();
        for (int i = 0; i < games.size(); i++) {
            GameRecord game = games.get(i);
            Path file = dir.toPath().resolve(String.format("game_%04d_seed_%d.json", i + 1, game.getSeed()));
            ReplaySerializer.write(game.getReplay(), file);
        }
    }

    private static double averageDogfights(MatchResult result) {
        if (result.getGameCount() == 0) {
            return 0;
        }
        int total = 0;
        for (GameRecord game : result.getGames()) {
            total += game.getDogfightsResolved();
        }
        return (double) total / result.getGameCount();
    }

    private static void outputSummary(PrintStream out, MatchResult result, long totalTime) {
        int n = result.getGameCount();
        out.println("=== Simulation Summary ===");
        out.printf("Total games: %d%n", n);
        out.printf("%s wins: %d (%s)%n", result.getAgentOne(), result.getAgentOneWins(),
                WilsonInterval.format(100.0 * result.getAgentOneWinRate(), WilsonInterval.calculate95(result.getAgentOneWins(), n)));
        out.printf("%s wins: %d (%s)%n", result.getAgentTwo(), result.getAgentTwoWins(),
                WilsonInterval.format(100.0 * result.getAgentTwoWinRate(), WilsonInterval.calculate95(result.getAgentTwoWins(), n)));
        out.printf("Draws: %d (%.1f%%)%n", result.getDraws(), 100.0 * result.getDrawRate());
        out.printf("Average dogfights per game: %.2f%n", averageDogfights(result));
        out.printf("Total time: %d ms (%.1f ms/game avg)%n", totalTime, (double) totalTime / n);
    }

    private static void outputJsonResult(PrintStream out, SimCommand cmd, List<AgentSetup> setups,
                                         MatchResult result, long totalTime) {
        SimulationResult json = new SimulationResult();
        json.version = UtalaCli.getVersionString();

        json.config = new SimulationResult.SimulationConfig();
        json.config.gamesRequested = cmd.getNumGames();
        json.config.startingSeed = cmd.getSeed();
        json.config.balanced = cmd.isBalanced();
        for (AgentSetup setup : setups) {
            SimulationResult.AgentConfig ac = new SimulationResult.AgentConfig();
            ac.name = setup.name();
            ac.type = setup.type;
            ac.aiProfile = AgentFactory.ROLLOUT.equalsIgnoreCase(setup.type)
                    ? (setup.profile == null ? AiProfileUtil.DEFAULT_PROFILE : setup.profile) : null;
            json.config.agents.add(ac);
        }

        int n = result.getGameCount();
        json.summary = new SimulationResult.SimulationSummary();
        json.summary.totalGames = n;
        json.summary.draws = result.getDraws();
        json.summary.drawRate = 100.0 * result.getDrawRate();
        json.summary.totalTimeMs = totalTime;
        json.summary.averageGameTimeMs = n == 0 ? 0 : (double) totalTime / n;
        json.summary.averageDogfights = averageDogfights(result);
        json.summary.agents.add(agentSummary(result.getAgentOne(), result.getAgentOneWins(), result.getAgentTwoWins(), n));
        json.summary.agents.add(agentSummary(result.getAgentTwo(), result.getAgentTwoWins(), result.getAgentOneWins(), n));

        int gameNum = 1;
        for (GameRecord game : result.getGames()) {
            SimulationResult.GameResult gr = new SimulationResult.GameResult();
            gr.gameNumber = gameNum++;
            gr.seed = game.getSeed();
            gr.playerOne = game.getPlayerOneAgent();
            gr.playerTwo = game.getPlayerTwoAgent();
            gr.isDraw = game.getOutcome().isDraw();
            gr.winner = game.getWinnerName();
            gr.winnerSeat = gr.isDraw ? null : game.getWinner() == Player.ONE ? 1 : 2;
            gr.dogfights = game.getDogfightsResolved();
            gr.durationMs = game.getDurationMs();
            json.games.add(gr);
        }

        Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();
        out.println(gson.toJson(json));
    }

    private static SimulationResult.AgentSummary agentSummary(String name, int wins, int losses, int games) {
        SimulationResult.AgentSummary summary = new SimulationResult.AgentSummary();
        summary.name = name;
        summary.wins = wins;
        summary.losses = losses;
        summary.winRate = games == 0 ? 0 : 100.0 * wins / games;
        double[] ci = WilsonInterval.calculate95(wins, games);
        summary.winRateCiLower = ci[0];
        summary.winRateCiUpper = ci[1];
        return summary;
    }

    /**
     * One row per game, a blank line, then one row per agent.
     */
    private static void outputCsvResult(PrintStream out, List<AgentSetup> setups, MatchResult result) {
        out.println("game,seed,player_one,player_two,winner,winner_seat,is_draw,dogfights,duration_ms");
        int gameNum = 1;
        for (GameRecord game : result.getGames()) {
            boolean draw = game.getOutcome().isDraw();
            out.printf("%d,%d,%s,%s,%s,%s,%s,%d,%d%n",
                    gameNum++,
                    game.getSeed(),
                    csvEscape(game.getPlayerOneAgent()),
                    csvEscape(game.getPlayerTwoAgent()),
                    draw ? "" : csvEscape(game.getWinnerName()),
                    draw ? "" : game.getWinner() == Player.ONE ? "1" : "2",
                    draw,
                    game.getDogfightsResolved(),
                    game.getDurationMs());
        }

        out.println();
        out.println("agent,type,ai_profile,wins,losses,win_rate,ci_lower_95,ci_upper_95");
        int n = result.getGameCount();
        int[] wins = {result.getAgentOneWins(), result.getAgentTwoWins()};
        for (int i = 0; i < setups.size(); i++) {
            AgentSetup setup = setups.get(i);
            double[] ci = WilsonInterval.calculate95(wins[i], n);
            out.printf("%s,%s,%s,%d,%d,%.1f,%.1f,%.1f%n",
                    csvEscape(setup.name()),
                    setup.type,
                    setup.profile == null ? "" : csvEscape(setup.profile),
                    wins[i],
                    wins[1 - i],
                    n == 0 ? 0 : 100.0 * wins[i] / n,
                    ci[0], ci[1]);
        }
    }

    static String csvEscape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private SimulateMatch() {
    }
}
