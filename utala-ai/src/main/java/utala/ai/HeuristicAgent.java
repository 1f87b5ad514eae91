package utala.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.google.common.collect.ImmutableList;

import utala.game.DogfightContext;
import utala.game.GameState;
import utala.game.Phase;
import utala.game.Player;
import utala.game.Position;
import utala.game.Square;
import utala.game.Unit;
import utala.game.action.Action;
import utala.game.action.ActionCatalog;

/**
 * Fixed weighted rules, no search.
 *
 * Placement prefers the center, then edges, then corners, puts strong units on valuable
 * squares, likes contesting the opponent and cares about lines. It only looks at who controls
 * a square, never at an opponent's face-down power.
 *
 * In a dogfight it weighs how much the square matters for lines against the power gap and
 * the weapons it has left.
 */
public class HeuristicAgent implements Agent {
    private static final double CENTER_VALUE = 10.0;
    private static final double EDGE_VALUE = 7.0;
    private static final double CORNER_VALUE = 4.0;
    private static final double CONTEST_BONUS = 3.0;

    // line bonuses for placement
    private static final double COMPLETE_OWN_LINE = 50.0;
    private static final double BLOCK_OPPONENT_LINE = 30.0;
    private static final double EXTEND_OWN_LINE = 5.0;
    private static final double DISRUPT_OPPONENT_LINE = 3.0;

    // line importance for dogfights
    private static final double WIN_THE_GAME = 100.0;
    private static final double PREVENT_LOSS = 80.0;
    private static final double ADVANCE_LINE = 10.0;
    private static final double CONTEST_LINE = 8.0;
    private static final double CRITICAL = 80.0;
    private static final double IMPORTANT = 20.0;

    private final String name;
    private final Random rng;
    private final ActionCatalog catalog = ActionCatalog.get();

    public HeuristicAgent(String name, long seed) {
        this.name = name;
        this.rng = new Random(seed);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int selectAction(GameState state, List<Integer> legalActions, Player player) {
        if (state.getPhase() == Phase.PLACEMENT) {
            return selectPlacement(state, legalActions, player);
        }
        if (state.getPhase() == Phase.DOGFIGHTS) {
            return selectDogfight(state, legalActions, player);
        }
        return pick(legalActions);
    }

    private int selectPlacement(GameState state, List<Integer> legalActions, Player player) {
        double bestScore = Double.NEGATIVE_INFINITY;
        List<Integer> best = new ArrayList<>();
        for (int index : legalActions) {
            Action action = catalog.get(index);
            if (!action.isPlacement()) {
                continue;
            }
            double score = placementScore(state, action, player);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(index);
            } else if (score == bestScore) {
                best.add(index);
            }
        }
        return best.isEmpty() ? pick(legalActions) : pick(best);
    }

    double placementScore(GameState state, Action action, Player player) {
        Position pos = action.getPosition();
        double value = positionValue(pos);
        double strength = (action.getPower() - Unit.MIN_POWER) / (double) (Unit.MAX_POWER - Unit.MIN_POWER);
        double score = value + strength * value * 0.5;
        if (state.getSquare(pos).getController() == player.opponent()) {
            score += CONTEST_BONUS;
        }

        for (ImmutableList<Position> line : pos.getLines()) {
            int ours = 0;
            int theirs = 0;
            for (Position p : line) {
                Player controller = state.getSquare(p).getController();
                if (controller == player) {
                    ours++;
                } else if (controller != null) {
                    theirs++;
                }
            }
            if (ours == 2 && theirs == 0) {
                score += COMPLETE_OWN_LINE;
            } else if (theirs == 2 && ours == 0) {
                score += BLOCK_OPPONENT_LINE;
            } else if (ours == 1 && theirs == 0) {
                score += EXTEND_OWN_LINE;
            } else if (theirs == 1 && ours == 0) {
                score += DISRUPT_OPPONENT_LINE;
            }
        }
        return score;
    }

    static double positionValue(Position pos) {
        if (pos.equals(Position.CENTER)) {
            return CENTER_VALUE;
        }
        boolean corner = pos.getRow() != 1 && pos.getCol() != 1;
        return corner ? CORNER_VALUE : EDGE_VALUE;
    }

    private int selectDogfight(GameState state, List<Integer> legalActions, Player player) {
        List<Integer> weapons = new ArrayList<>();
        int pass = -1;
        for (int index : legalActions) {
            Action action = catalog.get(index);
            if (action.isWeapon()) {
                weapons.add(index);
            } else if (action.isPass()) {
                pass = index;
            }
        }
        DogfightContext ctx = state.getDogfightContext();
        if (weapons.isEmpty() || ctx == null) {
            return pass >= 0 ? pass : pick(legalActions);
        }

        Square square = state.getSquare(ctx.getPosition());
        Unit mine = square.getUnit(player);
        Unit theirs = square.getUnit(player.opponent());
        if (mine == null || theirs == null) {
            return pass >= 0 ? pass : pick(legalActions);
        }

        int powerDiff = mine.getPower() - theirs.getPower();
        double importance = dogfightImportance(state, ctx.getPosition(), player);
        int weaponCount = state.getResources(player).getWeaponCount();

        boolean fire;
        if (importance >= CRITICAL) {
            fire = true;
        } else if (ctx.isOffensivePending()) {
            // answering an attack
            fire = (importance >= IMPORTANT && weaponCount >= 2)
                    || powerDiff >= -1
                    || (powerDiff == -2 && weaponCount >= 3);
        } else {
            fire = importance >= IMPORTANT || powerDiff <= 0 || weaponCount >= 3;
        }
        if (fire || pass < 0) {
            return pick(weapons);
        }
        return pass;
    }

    double dogfightImportance(GameState state, Position pos, Player player) {
        double importance = 0.0;
        for (ImmutableList<Position> line : pos.getLines()) {
            int ours = 0;
            int theirs = 0;
            for (Position p : line) {
                if (p.equals(pos)) {
                    continue;
                }
                Player controller = state.getSquare(p).getController();
                if (controller == player) {
                    ours++;
                } else if (controller != null) {
                    theirs++;
                }
            }
            if (ours == 2 && theirs == 0) {
                importance += WIN_THE_GAME;
            } else if (theirs == 2 && ours == 0) {
                importance += PREVENT_LOSS;
            } else if (ours == 1 && theirs == 0) {
                importance += ADVANCE_LINE;
            } else if (theirs == 1 && ours == 0) {
                importance += CONTEST_LINE;
            }
        }
        return importance;
    }

    private int pick(List<Integer> options) {
        return options.get(rng.nextInt(options.size()));
    }

    @Override
    public String toString() {
        return "HeuristicAgent(" + name + ")";
    }
}
