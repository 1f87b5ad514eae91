package utala.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import utala.view.SimulateMatch;

/**
 * Lists the AI profiles bundled with the rollout agent. Same as {@code sim --list-profiles}.
 */
@Command(
    name = "profiles",
    description = "List available AI profiles",
    mixinStandardHelpOptions = true
)
public class ProfilesCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        return SimulateMatch.listProfiles();
    }
}
