package utala.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import utala.ai.AgentFactory;
import utala.view.PlayMatch;

/**
 * Play a game at the terminal against one of the agents.
 */
@Command(
    name = "play",
    description = "Play a game against an agent",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class PlayCommand implements Callable<Integer> {

    @Option(
        names = {"-o", "--opponent"},
        description = "Opponent type: random, heuristic or rollout. Default: ${DEFAULT-VALUE}",
        defaultValue = AgentFactory.HEURISTIC,
        paramLabel = "TYPE"
    )
    private String opponent;

    @Option(
        names = {"-p", "--profile"},
        description = "AI profile for a rollout opponent.",
        paramLabel = "PROFILE"
    )
    private String profile;

    @Option(
        names = {"-s", "--seed"},
        description = "Game seed. Random when not given.",
        paramLabel = "SEED"
    )
    private Long seed;

    @Option(
        names = {"--second"},
        description = "Take the second seat (the opponent places first)."
    )
    private boolean second;

    public String getOpponent() {
        return opponent;
    }

    public String getProfile() {
        return profile;
    }

    public Long getSeed() {
        return seed;
    }

    public boolean isSecond() {
        return second;
    }

    @Override
    public Integer call() {
        return PlayMatch.play(this);
    }
}
