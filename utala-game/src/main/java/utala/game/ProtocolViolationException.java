package utala.game;

/**
 * Thrown when a caller breaks the engine's calling contract: acting out of turn, using a
 * phase's API in another phase, or driving a dogfight out of order. These indicate a broken
 * caller rather than a bad move, so they are never reported as a plain rejection.
 */
public class ProtocolViolationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public ProtocolViolationException(String message) {
        super(message);
    }
}
