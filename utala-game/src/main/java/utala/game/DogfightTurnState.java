package utala.game;

import java.util.Objects;

import utala.game.action.Action;

/**
 * Turn-by-turn negotiation of a single dogfight.
 *
 * The underdog moves first. A weapon played with nothing pending is offensive; a weapon
 * played against a pending offensive weapon is defensive. If the underdog passes and the
 * other player attacks, the underdog gets one final response. So a dogfight takes two or
 * three turn actions.
 */
public final class DogfightTurnState {
    private final Position position;
    private final Player underdog;
    private final Player other;

    private Player currentActor;
    private Action underdogFirst;
    private Action otherReply;
    private Action underdogResponse;
    private Commitment offense;
    private Commitment defense;
    private boolean complete;

    DogfightTurnState(Position position, Player underdog) {
        this.position = position;
        this.underdog = underdog;
        this.other = underdog.opponent();
        this.currentActor = underdog;
    }

    private DogfightTurnState(DogfightTurnState o) {
        this.position = o.position;
        this.underdog = o.underdog;
        this.other = o.other;
        this.currentActor = o.currentActor;
        this.underdogFirst = o.underdogFirst;
        this.otherReply = o.otherReply;
        this.underdogResponse = o.underdogResponse;
        this.offense = o.offense;
        this.defense = o.defense;
        this.complete = o.complete;
    }

    /**
     * Records the current actor's move and advances the negotiation.
     * Legality and actor checks are the engine's job.
     */
    void record(Action action) {
        if (complete) {
            throw new ProtocolViolationException("Dogfight at " + position + " is already complete");
        }
        if (action.isPlacement()) {
            throw new IllegalArgumentException("Placement action in a dogfight: " + action);
        }

        if (underdogFirst == null) {
            underdogFirst = action;
            if (action.isWeapon()) {
                offense = new Commitment(underdog, action.getWeaponSlot(), WeaponRole.OFFENSIVE);
            }
            currentActor = other;
        } else if (otherReply == null) {
            otherReply = action;
            if (offense != null) {
                // answering the underdog's attack; a pass leaves it undefended
                if (action.isWeapon()) {
                    defense = new Commitment(other, action.getWeaponSlot(), WeaponRole.DEFENSIVE);
                }
                finish();
            } else if (action.isWeapon()) {
                offense = new Commitment(other, action.getWeaponSlot(), WeaponRole.OFFENSIVE);
                currentActor = underdog;
            } else {
                finish();
            }
        } else {
            underdogResponse = action;
            if (action.isWeapon()) {
                defense = new Commitment(underdog, action.getWeaponSlot(), WeaponRole.DEFENSIVE);
            }
            finish();
        }
    }

    private void finish() {
        complete = true;
        currentActor = null;
    }

    DogfightContext toContext() {
        return new DogfightContext(position, underdog, other, getOffensivePending());
    }

    DogfightTurnState copy() {
        return new DogfightTurnState(this);
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
     * @return whose turn it is, or null once complete
     */
    public Player getCurrentActor() {
        return currentActor;
    }

    public Action getUnderdogFirst() {
        return underdogFirst;
    }

    public Action getOtherReply() {
        return otherReply;
    }

    public Action getUnderdogResponse() {
        return underdogResponse;
    }

    public Commitment getOffense() {
        return offense;
    }

    public Commitment getDefense() {
        return defense;
    }

    /**
     * @return the player whose offensive weapon still waits for an answer, or null
     */
    public Player getOffensivePending() {
        return offense != null && defense == null && !complete ? offense.getPlayer() : null;
    }

    public boolean isComplete() {
        return complete;
    }

    public int getTurnsTaken() {
        return (underdogFirst != null ? 1 : 0) + (otherReply != null ? 1 : 0) + (underdogResponse != null ? 1 : 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DogfightTurnState)) return false;
        DogfightTurnState s = (DogfightTurnState) o;
        return position == s.position && underdog == s.underdog && currentActor == s.currentActor
                && complete == s.complete
                && Objects.equals(underdogFirst, s.underdogFirst)
                && Objects.equals(otherReply, s.otherReply)
                && Objects.equals(underdogResponse, s.underdogResponse)
                && Objects.equals(offense, s.offense)
                && Objects.equals(defense, s.defense);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, underdog, currentActor, underdogFirst, otherReply,
                underdogResponse, offense, defense, complete);
    }
}
