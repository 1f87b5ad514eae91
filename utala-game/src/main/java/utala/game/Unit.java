package utala.game;

import com.google.common.collect.ImmutableSet;

/**
 * A unit placed on the grid. Owner and power never change; the hidden flag can only be
 * cleared (showdown), never set again.
 */
public final class Unit {
    public static final int MIN_POWER = 2;
    public static final int MAX_POWER = 10;

    /** Powers that are placed face-down. */
    public static final ImmutableSet<Integer> HIDDEN_POWERS = ImmutableSet.of(2, 3, 9, 10);

    private final Player owner;
    private final int power;
    private boolean hidden;

    Unit(Player owner, int power, boolean hidden) {
        if (power < MIN_POWER || power > MAX_POWER) {
            throw new IllegalArgumentException("Unit power out of range: " + power);
        }
        this.owner = owner;
        this.power = power;
        this.hidden = hidden;
    }

    /**
     * Creates a freshly placed unit, hidden iff its power is one of {@link #HIDDEN_POWERS}.
     */
    static Unit place(Player owner, int power) {
        return new Unit(owner, power, HIDDEN_POWERS.contains(power));
    }

    public Player getOwner() {
        return owner;
    }

    public int getPower() {
        return power;
    }

    public boolean isHidden() {
        return hidden;
    }

    void reveal() {
        hidden = false;
    }

    Unit copy() {
        return new Unit(owner, power, hidden);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Unit)) return false;
        Unit other = (Unit) o;
        return owner == other.owner && power == other.power && hidden == other.hidden;
    }

    @Override
    public int hashCode() {
        return (owner.ordinal() * 31 + power) * 2 + (hidden ? 1 : 0);
    }

    @Override
    public String toString() {
        return hidden ? owner + ":??" : owner + ":" + power;
    }
}
