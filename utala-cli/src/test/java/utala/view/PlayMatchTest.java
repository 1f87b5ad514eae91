package utala.view;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.testng.Assert;
import org.testng.annotations.Test;

import picocli.CommandLine;
import utala.cli.ExitCode;
import utala.cli.PlayCommand;

public class PlayMatchTest {

    private static String alwaysFirst() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            sb.append("0\n");
        }
        return sb.toString();
    }

    private static int play(ByteArrayOutputStream out, String... args) {
        PlayCommand cmd = new PlayCommand();
        new CommandLine(cmd).parseArgs(args);
        return PlayMatch.play(cmd, new BufferedReader(new StringReader(alwaysFirst())),
                new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @Test
    public void testFullGameAgainstHeuristic() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Assert.assertEquals(play(out, "--seed", "4"), ExitCode.SUCCESS);
        String text = out.toString(StandardCharsets.UTF_8);
        Assert.assertTrue(text.contains("you vs Opponent (heuristic) (seed 4)"));
        Assert.assertTrue(text.contains("=== Game over"));
        Assert.assertTrue(text.contains("You win!") || text.contains("wins.") || text.contains("draw"));
    }

    @Test
    public void testSecondSeat() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Assert.assertEquals(play(out, "--seed", "5", "--second", "--opponent", "random"), ExitCode.SUCCESS);
        Assert.assertTrue(out.toString(StandardCharsets.UTF_8).contains("you are P2"));
    }

    @Test
    public void testUnknownOpponent() {
        Assert.assertEquals(play(new ByteArrayOutputStream(), "--opponent", "oracle"), ExitCode.ARGS_ERROR);
    }
}
