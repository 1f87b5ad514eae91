package utala.cli;

import java.io.File;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import utala.view.ReplayView;

/**
 * Re-runs a saved game and checks that it ends the way the file says.
 */
@Command(
    name = "replay",
    description = "Replay a saved game",
    mixinStandardHelpOptions = true
)
public class ReplayCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Replay file written by sim --save-replays.", paramLabel = "FILE")
    private File file;

    @Option(
        names = {"-m", "--moves"},
        description = "List every recorded action."
    )
    private boolean showMoves;

    public File getFile() {
        return file;
    }

    public boolean isShowMoves() {
        return showMoves;
    }

    @Override
    public Integer call() {
        return ReplayView.show(this);
    }
}
