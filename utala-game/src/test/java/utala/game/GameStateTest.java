package utala.game;

import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Copy semantics, equality and the board queries.
 */
public class GameStateTest {

    @Test
    public void testCopyIsDeep() {
        GameEngine engine = GameScenarios.placed(5,
                new int[][] {{2, 3, 4}, {5, 6, 7}, {8, 9, 10}},
                new int[][] {{10, 9, 8}, {7, 6, 5}, {4, 3, 2}});
        engine.beginDogfight();
        GameState original = engine.state();
        Player holder = original.getPriorityHolder();
        GameState copy = original.copy();
        Assert.assertEquals(copy, original);
        Assert.assertEquals(copy.hashCode(), original.hashCode());

        copy.square(Position.of(0, 0)).removeUnitOf(Player.ONE);
        copy.getResources(Player.ONE).removeWeapon(0);
        copy.getDogfightTurn().record(GameScenarios.CATALOG.get(GameScenarios.CATALOG.passIndex()));
        copy.flipPriority();

        Assert.assertTrue(original.getSquare(0, 0).isContested());
        Assert.assertEquals(original.getResources(Player.ONE).getWeaponCount(), 4);
        Assert.assertEquals(original.getDogfightTurn().getTurnsTaken(), 0);
        Assert.assertEquals(original.getPriorityHolder(), holder);
        Assert.assertNotEquals(copy, original);
    }

    @Test
    public void testCopiedUnitsRevealIndependently() {
        GameEngine engine = new GameEngine(5);
        engine.applyAction(GameScenarios.CATALOG.placementIndex(10, 1, 1));
        GameState copy = engine.state().copy();
        copy.getSquare(Position.CENTER).getUnit(Player.ONE).reveal();
        Assert.assertTrue(engine.state().getSquare(Position.CENTER).getUnit(Player.ONE).isHidden());
    }

    @Test
    public void testThreeInRowOnlyCountsControlledSquares() {
        GameState state = new GameState(1);
        state.square(Position.of(0, 0)).add(Unit.place(Player.ONE, 4));
        state.square(Position.of(1, 1)).add(Unit.place(Player.ONE, 5));
        state.square(Position.of(2, 2)).add(Unit.place(Player.ONE, 6));
        Assert.assertTrue(state.hasThreeInRow(Player.ONE), "Diagonal");
        Assert.assertFalse(state.hasThreeInRow(Player.TWO));

        state.square(Position.CENTER).add(Unit.place(Player.TWO, 7));
        Assert.assertFalse(state.hasThreeInRow(Player.ONE), "A contested square breaks the line");
        Assert.assertEquals(state.countControlledSquares(Player.ONE), 2);
        Assert.assertEquals(state.countControlledSquares(Player.TWO), 0);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testSquareNeverHoldsThreeUnits() {
        Square square = new Square();
        square.add(Unit.place(Player.ONE, 4));
        square.add(Unit.place(Player.TWO, 5));
        square.add(Unit.place(Player.ONE, 6));
    }

    @Test
    public void testOnlyExtremePowersAreHidden() {
        for (int power = Unit.MIN_POWER; power <= Unit.MAX_POWER; power++) {
            boolean expected = power == 2 || power == 3 || power == 9 || power == 10;
            Assert.assertEquals(Unit.place(Player.ONE, power).isHidden(), expected, "power " + power);
        }
    }

    @Test
    public void testHiddenFlagOnlyEverClears() {
        Random rng = new Random(2);
        for (int game = 0; game < 20; game++) {
            GameEngine engine = new GameEngine(game);
            GameState previous = engine.getStateSnapshot();
            while (!engine.isGameOver()) {
                GameScenarios.step(engine, rng);
                GameState current = engine.getStateSnapshot();
                for (Position pos : Position.all()) {
                    for (Player p : Player.values()) {
                        Unit before = previous.getSquare(pos).getUnit(p);
                        Unit after = current.getSquare(pos).getUnit(p);
                        if (after != null && after.getPower() >= 4 && after.getPower() <= 8) {
                            Assert.assertFalse(after.isHidden(), "Middle powers are never hidden");
                        }
                        if (before != null && after != null && !before.isHidden()) {
                            Assert.assertFalse(after.isHidden(), "A revealed unit was hidden again at " + pos);
                        }
                    }
                    Assert.assertTrue(current.getSquare(pos).getUnits().size() <= Square.CAPACITY);
                }
                previous = current;
            }
        }
    }

    @Test
    public void testToStringHidesHiddenPowers() {
        GameState state = new GameState(1);
        state.square(Position.CENTER).add(Unit.place(Player.ONE, 9));
        state.square(Position.CENTER).add(Unit.place(Player.TWO, 6));
        String board = state.toString();
        Assert.assertTrue(board.contains("[P1:?? vs P2:6]"), board);
        Assert.assertEquals(state.getSquare(Position.CENTER).toString(), "[P1:?? vs P2:6]");
        Assert.assertEquals(state.getSquare(0, 0).toString(), "[ ]");
    }

    @Test
    public void testPositionLines() {
        Assert.assertEquals(Position.LINES.size(), 8);
        Assert.assertEquals(Position.CENTER.getLines().size(), 4);
        Assert.assertEquals(Position.of(0, 0).getLines().size(), 3);
        Assert.assertEquals(Position.of(0, 1).getLines().size(), 2);
        Assert.assertSame(Position.of(2, 1), Position.of(2, 1));
        Assert.assertEquals(Position.all().size(), 9);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPositionOutOfGrid() {
        Position.of(3, 0);
    }
}
