package utala.cli;

import java.io.PrintStream;

/**
 * One-line progress display for long simulations. Redraws in place with a carriage return,
 * so it belongs on stderr.
 */
public class ProgressBar {
    private static final int DEFAULT_WIDTH = 30;

    private final PrintStream out;
    private final int total;
    private final int width;
    private final long startTime;
    private int done;

    public ProgressBar(PrintStream out, int total) {
        this(out, total, DEFAULT_WIDTH);
    }

    public ProgressBar(PrintStream out, int total, int width) {
        this.out = out;
        this.total = total;
        this.width = width;
        this.startTime = System.currentTimeMillis();
    }

    public synchronized void increment() {
        done++;
        render();
    }

    /** Draws the completed bar with the elapsed time and ends the line. */
    public synchronized void finish() {
        done = total;
        render();
        out.printf("  [%s]%n", formatDuration(System.currentTimeMillis() - startTime));
        out.flush();
    }

    int getDone() {
        return done;
    }

    String bar() {
        double fraction = total > 0 ? Math.min(1.0, (double) done / total) : 0;
        int filled = (int) (fraction * width);
        StringBuilder sb = new StringBuilder(width + 2).append('[');
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? '#' : i == filled ? '>' : ' ');
        }
        return sb.append(']').toString();
    }

    private void render() {
        double pct = total > 0 ? 100.0 * done / total : 0;
        String eta = "--:--";
        if (done > 0) {
            long elapsed = System.currentTimeMillis() - startTime;
            eta = formatDuration((long) (elapsed * (total - done) / (double) done));
        }
        out.printf("\r%s %3.0f%% %d/%d games  ETA: %s", bar(), pct, done, total, eta);
        out.flush();
    }

    static String formatDuration(long ms) {
        long secs = ms / 1000;
        if (secs < 3600) {
            return String.format("%d:%02d", secs / 60, secs % 60);
        }
        return String.format("%d:%02d:%02d", secs / 3600, (secs % 3600) / 60, secs % 60);
    }
}
