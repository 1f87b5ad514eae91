package utala.view;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;

import utala.cli.ExitCode;
import utala.cli.ReplayCommand;
import utala.game.GameEngine;
import utala.game.Player;
import utala.game.action.ActionCatalog;
import utala.game.replay.Replay;
import utala.game.replay.ReplayException;
import utala.game.replay.ReplayMetadata;
import utala.game.replay.ReplayPlayer;
import utala.game.replay.ReplaySerializer;

/**
 * Runs {@code utala replay}: rebuilds a saved game from its seed and actions.
 */
public final class ReplayView {

    public static int show(ReplayCommand cmd) {
        return show(cmd, System.out, System.err);
    }

    static int show(ReplayCommand cmd, PrintStream out, PrintStream err) {
        Replay replay;
        GameEngine engine;
        try {
            replay = ReplaySerializer.read(cmd.getFile().toPath());
            engine = ReplayPlayer.play(replay);
        } catch (IOException e) {
            err.println("Error: Could not read replay - " + e.getMessage());
            return ExitCode.REPLAY_ERROR;
        } catch (ReplayException e) {
            err.println("Error: Invalid replay - " + e.getMessage());
            return ExitCode.REPLAY_ERROR;
        }

        ReplayMetadata meta = replay.getMetadata();
        out.println("Replay " + cmd.getFile().getName() + " (seed " + replay.getSeed() + ")");
        if (meta != null) {
            out.println(meta.getPlayerOneName() + " vs " + meta.getPlayerTwoName()
                    + ", rules " + meta.getRulesVersion() + ", recorded " + meta.getTimestamp());
        }
        if (cmd.isShowMoves()) {
            int n = 1;
            for (Pair<Player, Integer> step : replay.getActions()) {
                out.printf("%3d. %s %s%n", n++, step.getLeft(), ActionCatalog.get().get(step.getRight()));
            }
        }
        out.println();
        out.print(engine.getStateSnapshot());

        if (!engine.isGameOver()) {
            out.println("Replay stops before the end of the game (" + replay.getActions().size() + " actions)");
            return ExitCode.SUCCESS;
        }
        if (!Objects.equals(engine.getWinner(), replay.getWinner())) {
            err.println("Error: Replay ends with " + engine.getOutcome()
                    + " but the file records winner " + replay.getWinner());
            return ExitCode.REPLAY_ERROR;
        }
        out.println("Replay verified: " + engine.getOutcome());
        return ExitCode.SUCCESS;
    }

    private ReplayView() {
    }
}
