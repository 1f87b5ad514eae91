package utala.game.replay;

import java.time.Instant;

/**
 * Descriptive fields stored alongside a replay. None of them affect playback.
 */
public class ReplayMetadata {
    public static final String RULES_VERSION = "1.8";
    public static final String DEFAULT_VARIANT = "level1";

    private String formatVersion = Replay.FORMAT_VERSION;
    private String rulesVersion = RULES_VERSION;
    private String gameVariant = DEFAULT_VARIANT;
    private String playerOneName = "Player 1";
    private String playerTwoName = "Player 2";
    private String timestamp;

    public ReplayMetadata() {
    }

    public ReplayMetadata(String playerOneName, String playerTwoName) {
        this.playerOneName = playerOneName;
        this.playerTwoName = playerTwoName;
        this.timestamp = Instant.now().toString();
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public String getRulesVersion() {
        return rulesVersion;
    }

    public String getGameVariant() {
        return gameVariant;
    }

    public void setGameVariant(String gameVariant) {
        this.gameVariant = gameVariant;
    }

    public String getPlayerOneName() {
        return playerOneName;
    }

    public String getPlayerTwoName() {
        return playerTwoName;
    }

    /** ISO-8601 instant, or null if unknown. */
    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }
}
