package utala.game.replay;

/**
 * A replay that cannot be read or does not play back on the engine.
 */
public class ReplayException extends Exception {
    private static final long serialVersionUID = 1L;

    public ReplayException(String message) {
        super(message);
    }

    public ReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
