package utala.cli.stats;

/**
 * Wilson score interval for a win rate. Behaves at 0 and 100 percent and on short matches,
 * where the normal approximation does not.
 */
public final class WilsonInterval {
    /** z-score for a two-sided 95% interval */
    public static final double Z_95 = 1.96;

    private WilsonInterval() {
    }

    /**
     * @param wins  games won
     * @param games games played
     * @param z     z-score of the confidence level
     * @return {lower, upper} in percent; the whole range when no games were played
     */
    public static double[] calculate(int wins, int games, double z) {
        if (games == 0) {
            return new double[] {0.0, 100.0};
        }
        double n = games;
        double p = wins / n;
        double z2 = z * z;

        double denominator = 1.0 + z2 / n;
        double center = (p + z2 / (2.0 * n)) / denominator;
        double halfWidth = (z / denominator) * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * n));

        return new double[] {
            Math.max(0.0, center - halfWidth) * 100.0,
            Math.min(1.0, center + halfWidth) * 100.0
        };
    }

    public static double[] calculate95(int wins, int games) {
        return calculate(wins, games, Z_95);
    }

    /** e.g. "52.3% [45.1%, 59.4%]" */
    public static String format(double winRatePercent, double[] ci) {
        return String.format("%.1f%% [%.1f%%, %.1f%%]", winRatePercent, ci[0], ci[1]);
    }
}
