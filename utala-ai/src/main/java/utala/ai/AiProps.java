package utala.ai;

/**
 * Keys understood in AI profile files, with the value used when a profile leaves one out.
 */
public enum AiProps {
    /** Playouts per candidate action. */
    ROLLOUT_TRIALS("RolloutTrials", "50"),
    /** Determinize the opponent's hidden units and draw pile before each playout. */
    USE_INFORMATION_SETS("UseInformationSets", "false"),
    INFO_SET_SAMPLES_PER_TRIAL("InfoSetSamplesPerTrial", "1"),
    /** Score the first move of a fresh dogfight by playouts instead of choosing at random. */
    EVALUATE_DOGFIGHTS("EvaluateDogfights", "false"),
    ROLLOUT_DEBUG("RolloutDebug", "false");

    private final String key;
    private final String defaultValue;

    AiProps(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public String getDefault() {
        return defaultValue;
    }
}
