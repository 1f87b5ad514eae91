package utala.game;

/**
 * What an agent may know about the dogfight it is asked to act in.
 * If an offensive weapon is pending, any weapon played now is a defensive response.
 */
public final class DogfightContext {
    private final Position position;
    private final Player underdog;
    private final Player other;
    private final Player offensivePlayer;

    DogfightContext(Position position, Player underdog, Player other, Player offensivePlayer) {
        this.position = position;
        this.underdog = underdog;
        this.other = other;
        this.offensivePlayer = offensivePlayer;
    }

    public Position getPosition() {
        return position;
    }

    public Player getUnderdog() {
        return underdog;
    }

    public Player getOther() {
        return other;
    }

    /**
     * @return the player whose offensive weapon awaits a response, or null
     */
    public Player getOffensivePlayer() {
        return offensivePlayer;
    }

    public boolean isOffensivePending() {
        return offensivePlayer != null;
    }

    @Override
    public String toString() {
        return "Dogfight @ " + position + " underdog=" + underdog
                + (offensivePlayer != null ? " offense by " + offensivePlayer : "");
    }
}
