package utala.game;

/**
 * Game phases. A game only ever moves forward through these.
 */
public enum Phase {
    PLACEMENT,
    DOGFIGHTS,
    ENDED
}
