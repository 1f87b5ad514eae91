package utala.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One grid square. Holds at most two units: empty, controlled (one unit) or contested (two).
 */
public final class Square {
    public static final int CAPACITY = 2;

    private final List<Unit> units = new ArrayList<>(CAPACITY);

    public List<Unit> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public boolean isControlled() {
        return units.size() == 1;
    }

    public boolean isContested() {
        return units.size() == CAPACITY;
    }

    /**
     * @return the controlling player, or null if the square is empty or contested
     */
    public Player getController() {
        return isControlled() ? units.get(0).getOwner() : null;
    }

    public boolean hasUnitOf(Player player) {
        return getUnit(player) != null;
    }

    /**
     * @return the unit owned by the given player, or null
     */
    public Unit getUnit(Player player) {
        for (Unit unit : units) {
            if (unit.getOwner() == player) {
                return unit;
            }
        }
        return null;
    }

    void add(Unit unit) {
        if (units.size() >= CAPACITY) {
            throw new IllegalStateException("Square already holds " + CAPACITY + " units");
        }
        units.add(unit);
    }

    void removeUnitOf(Player player) {
        units.removeIf(u -> u.getOwner() == player);
    }

    void replace(Unit oldUnit, Unit newUnit) {
        int idx = units.indexOf(oldUnit);
        if (idx < 0) {
            throw new IllegalArgumentException("Unit not on this square: " + oldUnit);
        }
        units.set(idx, newUnit);
    }

    Square copy() {
        Square copy = new Square();
        for (Unit unit : units) {
            copy.units.add(unit.copy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Square)) return false;
        return units.equals(((Square) o).units);
    }

    @Override
    public int hashCode() {
        return units.hashCode();
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "[ ]";
        }
        if (isControlled()) {
            return "[" + units.get(0) + "]";
        }
        return "[" + units.get(0) + " vs " + units.get(1) + "]";
    }
}
