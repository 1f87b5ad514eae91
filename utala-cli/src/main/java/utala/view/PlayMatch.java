package utala.view;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;

import utala.ai.Agent;
import utala.ai.AgentFactory;
import utala.ai.evaluation.GameRecord;
import utala.ai.evaluation.Harness;
import utala.cli.ExitCode;
import utala.cli.PlayCommand;
import utala.game.Player;
import utala.player.HumanAgent;

/**
 * Runs {@code utala play}: one game between the terminal user and an agent.
 */
public final class PlayMatch {

    public static int play(PlayCommand cmd) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return play(cmd, in, System.out);
    }

    static int play(PlayCommand cmd, BufferedReader in, PrintStream out) {
        long seed = cmd.getSeed() != null ? cmd.getSeed() : ThreadLocalRandom.current().nextLong();
        HumanAgent human = new HumanAgent("You", in, out);
        Agent opponent;
        try {
            opponent = AgentFactory.create(cmd.getOpponent(), "Opponent (" + cmd.getOpponent() + ")", cmd.getProfile(), seed + 1);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return ExitCode.ARGS_ERROR;
        }

        out.println("utala: kaos 9 - you vs " + opponent.getName() + " (seed " + seed + ")");
        Harness harness = new Harness(out);
        GameRecord game = cmd.isSecond()
                ? harness.runGame(opponent, human, seed)
                : harness.runGame(human, opponent, seed);

        Player you = cmd.isSecond() ? Player.TWO : Player.ONE;
        out.println();
        if (game.getOutcome().isDraw()) {
            out.println("The game is a draw.");
        } else if (game.getOutcome().isWinner(you)) {
            out.println("You win!");
        } else {
            out.println(opponent.getName() + " wins.");
        }
        return ExitCode.SUCCESS;
    }

    private PlayMatch() {
    }
}
