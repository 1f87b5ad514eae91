package utala.ai;

import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import utala.game.GameEngine;
import utala.game.Player;
import utala.game.Position;
import utala.game.action.ActionCatalog;
import utala.game.action.ActionType;

public class HeuristicAgentTest {
    private static final ActionCatalog CATALOG = ActionCatalog.get();

    @Test
    public void testPositionValues() {
        Assert.assertEquals(HeuristicAgent.positionValue(Position.CENTER), 10.0);
        Assert.assertEquals(HeuristicAgent.positionValue(Position.of(0, 1)), 7.0);
        Assert.assertEquals(HeuristicAgent.positionValue(Position.of(2, 2)), 4.0);
    }

    @Test
    public void testOpensWithStrongestUnitInCenter() {
        GameEngine engine = new GameEngine(5);
        HeuristicAgent agent = new HeuristicAgent("h", 5);
        int choice = agent.selectAction(engine.getStateSnapshot(), engine.getLegalActions(), Player.ONE);
        Assert.assertEquals(choice, CATALOG.placementIndex(10, Position.CENTER));
    }

    @Test
    public void testContestsOpponentTwoInARow() {
        GameEngine engine = new GameEngine(5);
        Assert.assertTrue(engine.applyAction(CATALOG.placementIndex(5, 0, 0)));
        Assert.assertTrue(engine.applyAction(CATALOG.placementIndex(5, 2, 2)));
        Assert.assertTrue(engine.applyAction(CATALOG.placementIndex(6, 0, 1)));

        HeuristicAgent agent = new HeuristicAgent("h", 5);
        int choice = agent.selectAction(engine.getStateSnapshot(), engine.getLegalActions(), Player.TWO);
        // contesting the edge square of the threatened row outscores every other placement
        Assert.assertEquals(choice, CATALOG.placementIndex(10, 0, 1));
    }

    @Test
    public void testBlockingScoresAboveQuietSquares() {
        GameEngine engine = new GameEngine(8);
        engine.applyAction(CATALOG.placementIndex(5, 0, 0));
        engine.applyAction(CATALOG.placementIndex(5, 2, 2));
        engine.applyAction(CATALOG.placementIndex(6, 0, 1));

        HeuristicAgent agent = new HeuristicAgent("h", 8);
        double block = agent.placementScore(engine.getStateSnapshot(), CATALOG.get(CATALOG.placementIndex(4, 0, 2)), Player.TWO);
        double quiet = agent.placementScore(engine.getStateSnapshot(), CATALOG.get(CATALOG.placementIndex(4, 1, 0)), Player.TWO);
        Assert.assertTrue(block > quiet + 25, block + " vs " + quiet);
    }

    @Test
    public void testDogfightChoicesAreLegalWeaponsOrPass() {
        for (long seed = 0; seed < 10; seed++) {
            GameEngine engine = AgentTestSupport.atFirstDogfight(seed);
            HeuristicAgent agent = new HeuristicAgent("h", seed);
            while (!engine.isDogfightComplete()) {
                Player actor = engine.getDogfightActor();
                List<Integer> legal = engine.getDogfightLegalActions(actor);
                int choice = agent.selectAction(engine.getStateSnapshot(), legal, actor);
                Assert.assertTrue(legal.contains(choice));
                ActionType type = CATALOG.get(choice).getType();
                Assert.assertNotEquals(type, ActionType.PLACE_UNIT);
                Assert.assertTrue(engine.applyDogfightTurnAction(actor, choice));
            }
        }
    }

    @Test
    public void testCriticalSquareIsWorthAWeapon() {
        GameEngine engine = new GameEngine(1);
        engine.applyAction(CATALOG.placementIndex(5, 0, 0));
        engine.applyAction(CATALOG.placementIndex(5, 2, 0));
        engine.applyAction(CATALOG.placementIndex(6, 0, 2));
        HeuristicAgent agent = new HeuristicAgent("h", 1);
        // P1 holds both ends of the top row: the middle of it decides the line
        Assert.assertTrue(agent.dogfightImportance(engine.getStateSnapshot(), Position.of(0, 1), Player.ONE) >= 100.0);
        Assert.assertTrue(agent.dogfightImportance(engine.getStateSnapshot(), Position.of(0, 1), Player.TWO) >= 80.0);
    }
}
