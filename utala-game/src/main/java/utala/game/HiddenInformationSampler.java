package utala.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Produces one determinization of a state from an observer's point of view: the opponent's
 * face-down units get plausible powers and the opponent's draw pile gets a plausible order.
 * The observer's own information is never touched.
 */
public final class HiddenInformationSampler {

    private HiddenInformationSampler() {
    }

    /**
     * @return a new state consistent with what {@code observer} can see in {@code state}
     */
    public static GameState sample(GameState state, Player observer, Random rng) {
        GameState sampled = state.copy();
        Player opponent = observer.opponent();
        PlayerResources opp = sampled.getResources(opponent);

        // powers the observer can rule out: still in hand, or face up on the board
        Set<Integer> known = new TreeSet<>(opp.getUnplaced().elementSet());
        List<Unit> hiddenUnits = new ArrayList<>();
        List<Square> hiddenSquares = new ArrayList<>();
        for (Position pos : Position.all()) {
            Square square = sampled.square(pos);
            Unit unit = square.getUnit(opponent);
            if (unit == null) {
                continue;
            }
            if (unit.isHidden()) {
                hiddenUnits.add(unit);
                hiddenSquares.add(square);
            } else {
                known.add(unit.getPower());
            }
        }

        List<Integer> options = new ArrayList<>();
        for (int power : Unit.HIDDEN_POWERS) {
            if (!known.contains(power)) {
                options.add(power);
            }
        }
        if (options.isEmpty()) {
            options.addAll(Unit.HIDDEN_POWERS);
        }

        for (int i = 0; i < hiddenUnits.size(); i++) {
            int power;
            if (options.isEmpty()) {
                power = Unit.HIDDEN_POWERS.asList().get(rng.nextInt(Unit.HIDDEN_POWERS.size()));
            } else {
                power = options.remove(rng.nextInt(options.size()));
            }
            hiddenSquares.get(i).replace(hiddenUnits.get(i), new Unit(opponent, power, true));
        }

        // the discard pile is public; the rest of the deck is in unknown order
        List<Integer> unseen = new ArrayList<>();
        for (int card = 1; card <= PlayerResources.DECK_SIZE; card++) {
            if (!opp.getDiscardPile().contains(card)) {
                unseen.add(card);
            }
        }
        Collections.shuffle(unseen, rng);
        int pileSize = Math.min(opp.getDrawPile().size(), unseen.size());
        opp.setDrawPile(unseen.subList(0, pileSize));

        return sampled;
    }
}
