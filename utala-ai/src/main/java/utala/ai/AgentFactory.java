package utala.ai;

import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableList;

/**
 * Builds agents by type name, as used on the command line.
 */
public final class AgentFactory {
    public static final String RANDOM = "random";
    public static final String HEURISTIC = "heuristic";
    public static final String ROLLOUT = "rollout";

    public static final List<String> TYPES = ImmutableList.of(RANDOM, HEURISTIC, ROLLOUT);

    private AgentFactory() {
    }

    /**
     * @param profile  AI profile, only used by rollout agents; null means the default profile
     * @throws IllegalArgumentException for an unknown type or profile
     */
    public static Agent create(String type, String name, String profile, long seed) {
        switch (type.toLowerCase(Locale.ROOT)) {
            case RANDOM:
                return new RandomAgent(name, seed);
            case HEURISTIC:
                return new HeuristicAgent(name, seed);
            case ROLLOUT:
                return new RolloutAgent(name, profile == null ? AiProfileUtil.DEFAULT_PROFILE : profile, seed);
            default:
                throw new IllegalArgumentException("Unknown agent type: " + type
                        + " (expected one of " + String.join(", ", TYPES) + ")");
        }
    }
}
