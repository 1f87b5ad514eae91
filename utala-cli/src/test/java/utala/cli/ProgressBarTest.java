package utala.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ProgressBarTest {

    @Test
    public void testBarFillsUp() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        ProgressBar bar = new ProgressBar(new PrintStream(buf, true, StandardCharsets.UTF_8), 4, 8);
        Assert.assertEquals(bar.bar(), "[>       ]");
        bar.increment();
        bar.increment();
        Assert.assertEquals(bar.bar(), "[####>   ]");
        bar.finish();
        Assert.assertEquals(bar.getDone(), 4);
        Assert.assertEquals(bar.bar(), "[########]");
        String text = buf.toString(StandardCharsets.UTF_8);
        Assert.assertTrue(text.contains("4/4 games"), text);
        Assert.assertTrue(text.endsWith(System.lineSeparator()));
    }

    @Test
    public void testDurationFormat() {
        Assert.assertEquals(ProgressBar.formatDuration(5_000), "0:05");
        Assert.assertEquals(ProgressBar.formatDuration(125_000), "2:05");
        Assert.assertEquals(ProgressBar.formatDuration(3_725_000), "1:02:05");
    }
}
