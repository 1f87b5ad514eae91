package utala.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import com.google.common.collect.TreeMultiset;

/**
 * Everything a player holds off the board: unplaced units, weapon tokens and the
 * resolution card piles.
 */
public final class PlayerResources {
    public static final int DECK_SIZE = 13;
    public static final ImmutableList<String> STARTING_WEAPONS = ImmutableList.of("A", "K", "Q", "J");

    private final TreeMultiset<Integer> unplaced = TreeMultiset.create();
    private final List<String> weapons = new ArrayList<>(STARTING_WEAPONS);
    private final List<Integer> drawPile = new ArrayList<>(DECK_SIZE);
    private final List<Integer> discardPile = new ArrayList<>(DECK_SIZE);

    PlayerResources() {
        for (int power = Unit.MIN_POWER; power <= Unit.MAX_POWER; power++) {
            unplaced.add(power);
        }
        for (int card = 1; card <= DECK_SIZE; card++) {
            drawPile.add(card);
        }
    }

    private PlayerResources(PlayerResources other) {
        unplaced.addAll(other.unplaced);
        weapons.clear();
        weapons.addAll(other.weapons);
        drawPile.addAll(other.drawPile);
        discardPile.addAll(other.discardPile);
    }

    public Multiset<Integer> getUnplaced() {
        return Multisets.unmodifiableMultiset(unplaced);
    }

    public boolean hasUnplaced(int power) {
        return unplaced.contains(power);
    }

    public boolean hasUnplacedUnits() {
        return !unplaced.isEmpty();
    }

    public List<String> getWeapons() {
        return Collections.unmodifiableList(weapons);
    }

    public int getWeaponCount() {
        return weapons.size();
    }

    public boolean hasWeapon() {
        return !weapons.isEmpty();
    }

    public List<Integer> getDrawPile() {
        return Collections.unmodifiableList(drawPile);
    }

    public List<Integer> getDiscardPile() {
        return Collections.unmodifiableList(discardPile);
    }

    void removeUnplaced(int power) {
        if (!unplaced.remove(power)) {
            throw new IllegalStateException("No unplaced unit of power " + power);
        }
    }

    String removeWeapon(int slot) {
        return weapons.remove(slot);
    }

    void shuffleDrawPile(Random rng) {
        Collections.shuffle(drawPile, rng);
    }

    /**
     * Draws the top card into the discard pile. An empty draw pile is first refilled from the
     * discard pile and shuffled with the given RNG.
     */
    int draw(Random rng) {
        if (drawPile.isEmpty()) {
            drawPile.addAll(discardPile);
            discardPile.clear();
            Collections.shuffle(drawPile, rng);
        }
        int card = drawPile.remove(0);
        discardPile.add(card);
        return card;
    }

    void setDrawPile(List<Integer> cards) {
        drawPile.clear();
        drawPile.addAll(cards);
    }

    void setDiscardPile(List<Integer> cards) {
        discardPile.clear();
        discardPile.addAll(cards);
    }

    PlayerResources copy() {
        return new PlayerResources(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlayerResources)) return false;
        PlayerResources other = (PlayerResources) o;
        return unplaced.equals(other.unplaced)
                && weapons.equals(other.weapons)
                && drawPile.equals(other.drawPile)
                && discardPile.equals(other.discardPile);
    }

    @Override
    public int hashCode() {
        int result = unplaced.hashCode();
        result = 31 * result + weapons.hashCode();
        result = 31 * result + drawPile.hashCode();
        return 31 * result + discardPile.hashCode();
    }

    @Override
    public String toString() {
        return "units=" + unplaced + " weapons=" + weapons
                + " pile=" + drawPile.size() + " discard=" + discardPile;
    }
}
