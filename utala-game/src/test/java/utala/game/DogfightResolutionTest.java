package utala.game;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import utala.game.action.ActionCatalog;

/**
 * Resolution arithmetic with rigged draw piles. The center dogfight is P1's 9 against P2's 2,
 * so P2 is the underdog.
 */
public class DogfightResolutionTest {
    private static final ActionCatalog CATALOG = ActionCatalog.get();
    private static final int PASS = CATALOG.passIndex();
    private static final int WEAPON = CATALOG.weaponIndex(0);

    private static final int[][] P1 = {{2, 3, 4}, {5, 9, 6}, {7, 8, 10}};
    private static final int[][] P2 = {{3, 4, 5}, {6, 2, 7}, {8, 9, 10}};

    private GameEngine engine;

    @BeforeMethod
    public void setUp() {
        engine = GameScenarios.placed(21, P1, P2);
    }

    private DogfightResult fight(int underdogAction, int otherAction) {
        engine.beginDogfight();
        engine.applyDogfightTurnAction(Player.TWO, underdogAction);
        engine.applyDogfightTurnAction(Player.ONE, otherAction);
        return engine.finishDogfight();
    }

    @Test
    public void testUndefendedHitEndsDogfightWithOneDraw() {
        GameScenarios.rigDrawPile(engine, Player.TWO, 7, 1, 2);
        DogfightResult result = fight(WEAPON, PASS);

        Assert.assertTrue(result.isUndefendedHit());
        Assert.assertEquals(result.getTotalDraws(), 1);
        Assert.assertEquals(result.getDraws(Player.TWO), Collections.singletonList(7));
        Assert.assertTrue(result.getDraws(Player.ONE).isEmpty());
        Assert.assertEquals(result.getWinner(), Player.TWO, "A hit beats the 9 regardless of power");
        Assert.assertEquals(result.getEliminated(), EnumSet.of(Player.ONE));

        GameState state = engine.getStateSnapshot();
        Assert.assertEquals(state.getSquare(Position.CENTER).getController(), Player.TWO);
        Assert.assertEquals(state.getResources(Player.TWO).getWeaponCount(), 3);
        Assert.assertEquals(state.getResources(Player.ONE).getWeaponCount(), 4);
        Assert.assertNull(state.getDogfightTurn());
    }

    @Test
    public void testUndefendedMissFallsThroughToBaseStep() {
        GameScenarios.rigDrawPile(engine, Player.TWO, 6, 13);
        GameScenarios.rigDrawPile(engine, Player.ONE, 1);
        DogfightResult result = fight(WEAPON, PASS);

        Assert.assertFalse(result.isUndefendedHit());
        Assert.assertEquals(result.getTotalDraws(), 3, "Miss plus one card each");
        Assert.assertEquals(result.getDraws(Player.TWO), Arrays.asList(6, 13));
        // 2 + 13 = 15 against 9 + 1 = 10
        Assert.assertEquals(result.getWinner(), Player.TWO);
        Assert.assertEquals(result.getEliminated(), EnumSet.of(Player.ONE));
    }

    @Test
    public void testOffenseAndDefenseCancel() {
        GameScenarios.rigDrawPile(engine, Player.TWO, 13, 1);
        GameScenarios.rigDrawPile(engine, Player.ONE, 1, 2);
        DogfightResult result = fight(WEAPON, WEAPON);

        Assert.assertFalse(result.isUndefendedHit());
        Assert.assertEquals(result.getTotalDraws(), 2, "No attack roll when the offense is answered");
        Assert.assertEquals(result.getDraws(Player.TWO), Collections.singletonList(13));
        Assert.assertEquals(result.getWinner(), Player.TWO);
        GameState state = engine.getStateSnapshot();
        Assert.assertEquals(state.getResources(Player.ONE).getWeaponCount(), 3);
        Assert.assertEquals(state.getResources(Player.TWO).getWeaponCount(), 3);
    }

    @Test
    public void testNoWeaponsHigherTotalWins() {
        GameScenarios.rigDrawPile(engine, Player.ONE, 5);
        GameScenarios.rigDrawPile(engine, Player.TWO, 11);
        DogfightResult result = fight(PASS, PASS);

        // 9 + 5 = 14 against 2 + 11 = 13
        Assert.assertEquals(result.getWinner(), Player.ONE);
        Assert.assertEquals(result.getTotalDraws(), 2);
        Assert.assertEquals(engine.getStateSnapshot().getSquare(Position.CENTER).getController(), Player.ONE);
    }

    @Test
    public void testExactTieEliminatesBoth() {
        GameScenarios.rigDrawPile(engine, Player.ONE, 1);
        GameScenarios.rigDrawPile(engine, Player.TWO, 8);
        DogfightResult result = fight(PASS, PASS);

        Assert.assertNull(result.getWinner());
        Assert.assertTrue(result.isDoubleElimination());
        Assert.assertTrue(engine.getStateSnapshot().getSquare(Position.CENTER).isEmpty());
    }

    @Test
    public void testEmptyPileReshufflesDiscard() {
        GameScenarios.rigDrawPile(engine, Player.ONE);
        GameScenarios.rigDrawPile(engine, Player.TWO);
        fight(PASS, PASS);

        for (Player p : Player.values()) {
            PlayerResources res = engine.getStateSnapshot().getResources(p);
            Assert.assertEquals(res.getDiscardPile().size(), 1);
            Assert.assertEquals(res.getDrawPile().size(), 12);
        }
    }

    @Test
    public void testPileSizesAlwaysAddUpToDeck() {
        Random rng = new Random(3);
        for (int game = 0; game < 30; game++) {
            GameEngine e = new GameEngine(game);
            while (!e.isGameOver()) {
                GameScenarios.step(e, rng);
                GameState state = e.getStateSnapshot();
                for (Player p : Player.values()) {
                    PlayerResources res = state.getResources(p);
                    Assert.assertEquals(res.getDrawPile().size() + res.getDiscardPile().size(),
                            PlayerResources.DECK_SIZE, "Game " + game + " " + p);
                }
            }
        }
    }

    @Test
    public void testDrawCountsPerDogfight() {
        Random rng = new Random(8);
        for (int game = 0; game < 30; game++) {
            GameEngine e = new GameEngine(100 + game);
            while (!e.isGameOver()) {
                if (e.isDogfightComplete()) {
                    DogfightResult result = e.finishDogfight();
                    int total = result.getTotalDraws();
                    Assert.assertTrue(total >= 1 && total <= 3, "Draws per dogfight: " + total);
                    Assert.assertEquals(total == 1, result.isUndefendedHit());
                    Assert.assertTrue(result.getDraws(Player.ONE).size() <= 2);
                    Assert.assertTrue(result.getDraws(Player.TWO).size() <= 2);
                } else {
                    GameScenarios.step(e, rng);
                }
            }
        }
    }
}
