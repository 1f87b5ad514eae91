package utala.game.action;

import utala.game.Position;

/**
 * One entry of the fixed action space. Weapon actions carry no role: whether a weapon is
 * offensive or defensive is decided by the dogfight turn in which it is played.
 */
public final class Action {
    private final ActionType type;
    private final int power;
    private final Position position;
    private final int weaponSlot;

    private Action(ActionType type, int power, Position position, int weaponSlot) {
        this.type = type;
        this.power = power;
        this.position = position;
        this.weaponSlot = weaponSlot;
    }

    static Action place(int power, Position position) {
        return new Action(ActionType.PLACE_UNIT, power, position, -1);
    }

    static Action weapon(int slot) {
        return new Action(ActionType.PLAY_WEAPON, 0, null, slot);
    }

    static Action pass() {
        return new Action(ActionType.PASS, 0, null, -1);
    }

    public ActionType getType() {
        return type;
    }

    public boolean isPlacement() {
        return type == ActionType.PLACE_UNIT;
    }

    public boolean isWeapon() {
        return type == ActionType.PLAY_WEAPON;
    }

    public boolean isPass() {
        return type == ActionType.PASS;
    }

    /** Unit power for placements, 0 otherwise. */
    public int getPower() {
        return power;
    }

    /** Target square for placements, null otherwise. */
    public Position getPosition() {
        return position;
    }

    /** Weapon slot for weapon plays, -1 otherwise. */
    public int getWeaponSlot() {
        return weaponSlot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Action)) return false;
        Action other = (Action) o;
        return type == other.type && power == other.power
                && position == other.position && weaponSlot == other.weaponSlot;
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + power;
        result = 31 * result + (position != null ? position.hashCode() : 0);
        return 31 * result + weaponSlot;
    }

    @Override
    public String toString() {
        switch (type) {
            case PLACE_UNIT:
                return "PLACE(" + power + " @ " + position + ")";
            case PLAY_WEAPON:
                return "WEAPON[" + weaponSlot + "]";
            default:
                return "PASS";
        }
    }
}
