package utala.game;

import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Three-in-a-row after every dogfight, simultaneous lines and the square-count finish.
 */
public class GameEndTest {

    @Test
    public void testThreeInRowEndsGameImmediately() {
        // column 1 for P1: center, [0,1] and [2,1]; the [1,0] and [1,2] fights end in ties
        int[][] p1 = {{4, 9, 5}, {2, 10, 3}, {6, 8, 7}};
        int[][] p2 = {{5, 3, 6}, {10, 2, 9}, {7, 4, 8}};
        GameEngine engine = GameScenarios.placed(31, p1, p2);
        GameScenarios.rigDescendingVsAscending(engine);

        for (int i = 0; i < 4; i++) {
            GameScenarios.resolveWithPasses(engine);
            Assert.assertFalse(engine.isGameOver(), "No line after dogfight " + i);
        }
        GameState mid = engine.getStateSnapshot();
        Assert.assertTrue(mid.getSquare(1, 0).isEmpty(), "2 + 11 ties 10 + 3");
        Assert.assertTrue(mid.getSquare(1, 2).isEmpty(), "3 + 10 ties 9 + 4");

        DogfightResult last = GameScenarios.resolveWithPasses(engine);
        Assert.assertEquals(last.getPosition(), Position.of(2, 1));
        Assert.assertTrue(engine.isGameOver());
        Assert.assertEquals(engine.getOutcome(), GameOutcome.PLAYER_ONE);
        Assert.assertEquals(engine.getWinner(), Player.ONE);

        GameState end = engine.getStateSnapshot();
        Assert.assertEquals(end.getPhase(), Phase.ENDED);
        Assert.assertEquals(end.getCurrentDogfightIndex(), 5);
        Assert.assertTrue(end.getSquare(0, 0).isContested(), "Corners are never resolved");
        Assert.assertTrue(end.getSquare(2, 2).isContested());
        Assert.assertNull(end.getCurrentDogfightPosition());
    }

    @Test(expectedExceptions = ProtocolViolationException.class)
    public void testNoDogfightAfterEarlyWin() {
        int[][] p1 = {{4, 9, 5}, {2, 10, 3}, {6, 8, 7}};
        int[][] p2 = {{5, 3, 6}, {10, 2, 9}, {7, 4, 8}};
        GameEngine engine = GameScenarios.placed(31, p1, p2);
        GameScenarios.rigDescendingVsAscending(engine);
        for (int i = 0; i < 5; i++) {
            GameScenarios.resolveWithPasses(engine);
        }
        engine.beginDogfight();
    }

    @Test
    public void testSimultaneousLinesGoToPriorityHolder() {
        // P1 holds the top row, P2 the bottom row; P1 then also wins the center
        int[][] p1 = {{2, 3, 4}, {0, 6, 0}, {0, 0, 0}};
        int[][] p2 = {{0, 0, 0}, {0, 4, 0}, {5, 7, 8}};
        GameEngine engine = GameScenarios.dogfightsFrom(41, p1, p2, Position.CENTER);
        GameScenarios.rigDescendingVsAscending(engine);

        DogfightResult result = GameScenarios.resolveWithPasses(engine);
        Assert.assertEquals(result.getWinner(), Player.ONE, "6 + 13 beats 4 + 1");

        GameState end = engine.getStateSnapshot();
        Assert.assertTrue(end.hasThreeInRow(Player.ONE));
        Assert.assertTrue(end.hasThreeInRow(Player.TWO));
        Assert.assertEquals(end.getPriorityHolder(), Player.TWO, "Unequal powers leave the token with P2");
        Assert.assertEquals(engine.getOutcome(), GameOutcome.PLAYER_TWO);
    }

    @Test
    public void testSimultaneousLinesAfterTokenFlip() {
        int[][] p1 = {{2, 3, 4}, {0, 5, 0}, {0, 0, 0}};
        int[][] p2 = {{0, 0, 0}, {0, 5, 0}, {6, 7, 8}};
        GameEngine engine = GameScenarios.dogfightsFrom(42, p1, p2, Position.CENTER);
        GameScenarios.rigDrawPile(engine, Player.ONE, 1);
        GameScenarios.rigDrawPile(engine, Player.TWO, 1);

        GameScenarios.resolveWithPasses(engine);

        // 5 + 1 ties 5 + 1: center emptied, both lines already stand
        GameState end = engine.getStateSnapshot();
        Assert.assertEquals(end.getPriorityHolder(), Player.ONE, "Equal powers moved the token to P1");
        Assert.assertEquals(engine.getOutcome(), GameOutcome.PLAYER_ONE);
    }

    @Test
    public void testMoreControlledSquaresWins() {
        int[][] p1 = {{3, 0, 0}, {0, 6, 0}, {0, 0, 7}};
        int[][] p2 = {{0, 0, 5}, {0, 4, 0}, {0, 0, 0}};
        GameEngine engine = GameScenarios.dogfightsFrom(43, p1, p2, Position.CENTER);
        GameScenarios.rigDrawPile(engine, Player.ONE, 1);
        GameScenarios.rigDrawPile(engine, Player.TWO, 3);

        DogfightResult result = GameScenarios.resolveWithPasses(engine);
        Assert.assertTrue(result.isDoubleElimination(), "6 + 1 ties 4 + 3");
        Assert.assertTrue(engine.isGameOver());
        Assert.assertEquals(engine.getOutcome(), GameOutcome.PLAYER_ONE, "Two squares against one");
    }

    @Test
    public void testEqualSquaresIsDraw() {
        int[][] p1 = {{3, 0, 0}, {0, 6, 0}, {0, 0, 0}};
        int[][] p2 = {{0, 0, 5}, {0, 4, 0}, {0, 0, 0}};
        GameEngine engine = GameScenarios.dogfightsFrom(44, p1, p2, Position.CENTER);
        GameScenarios.rigDrawPile(engine, Player.ONE, 1);
        GameScenarios.rigDrawPile(engine, Player.TWO, 3);

        GameScenarios.resolveWithPasses(engine);
        Assert.assertEquals(engine.getOutcome(), GameOutcome.DRAW);
        Assert.assertNull(engine.getWinner());
        Assert.assertTrue(engine.getOutcome().isDraw());
    }

    @Test
    public void testRandomGamesAlwaysReachAnOutcome() {
        Random rng = new Random(12);
        for (int seed = 0; seed < 50; seed++) {
            GameEngine engine = new GameEngine(seed);
            GameScenarios.playRandomly(engine, rng);
            GameState end = engine.getStateSnapshot();
            Assert.assertEquals(end.getPhase(), Phase.ENDED);
            Assert.assertNotNull(end.getOutcome());
            Assert.assertNull(end.getDogfightTurn());
            Assert.assertTrue(end.getCurrentDogfightIndex() <= 9);
            if (!end.hasThreeInRow(Player.ONE) && !end.hasThreeInRow(Player.TWO)) {
                int one = end.countControlledSquares(Player.ONE);
                int two = end.countControlledSquares(Player.TWO);
                GameOutcome expected = one > two ? GameOutcome.PLAYER_ONE
                        : two > one ? GameOutcome.PLAYER_TWO : GameOutcome.DRAW;
                Assert.assertEquals(end.getOutcome(), expected, "seed " + seed);
                Assert.assertEquals(end.getCurrentDogfightIndex(), 9, "No early finish without a line");
            }
        }
    }
}
