package utala.player;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

import utala.ai.Agent;
import utala.game.DogfightContext;
import utala.game.GameState;
import utala.game.Phase;
import utala.game.Player;
import utala.game.PlayerResources;
import utala.game.Position;
import utala.game.Square;
import utala.game.Unit;
import utala.game.action.Action;
import utala.game.action.ActionCatalog;

/**
 * Asks a person at the terminal for each move. Shows only what that seat may know: its own
 * face-down powers are marked with a star, the opponent's read "??".
 */
public class HumanAgent implements Agent {
    private final String name;
    private final BufferedReader in;
    private final PrintStream out;
    private final ActionCatalog catalog = ActionCatalog.get();

    public HumanAgent(String name, BufferedReader in, PrintStream out) {
        this.name = name;
        this.in = in;
        this.out = out;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @throws IllegalStateException if the input ends before a valid choice is made
     */
    @Override
    public int selectAction(GameState state, List<Integer> legalActions, Player player) {
        display(state, player);
        out.println();
        out.println("Legal actions:");
        DogfightContext ctx = state.getDogfightContext();
        for (int i = 0; i < legalActions.size(); i++) {
            out.printf("  %2d: %s%n", i, describe(catalog.get(legalActions.get(i)), ctx));
        }

        while (true) {
            out.printf("%s, select action [0-%d]: ", name, legalActions.size() - 1);
            out.flush();
            String line = readLine();
            if (line == null) {
                throw new IllegalStateException("Input closed before " + name + " chose an action");
            }
            int choice;
            try {
                choice = Integer.parseInt(line.trim());
            } catch (NumberFormatException e) {
                out.println("Not a number: '" + line.trim() + "'");
                continue;
            }
            if (choice >= 0 && choice < legalActions.size()) {
                return legalActions.get(choice);
            }
            out.println("Please enter a number between 0 and " + (legalActions.size() - 1));
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String describe(Action action, DogfightContext ctx) {
        if (action.isPlacement()) {
            return "place " + action.getPower() + " on " + action.getPosition()
                    + (Unit.HIDDEN_POWERS.contains(action.getPower()) ? " (face down)" : "");
        }
        if (action.isWeapon()) {
            String role = ctx != null && ctx.isOffensivePending() ? "defend" : "attack";
            return role + " with weapon " + PlayerResources.STARTING_WEAPONS.get(action.getWeaponSlot());
        }
        return "pass";
    }

    private void display(GameState state, Player player) {
        out.println();
        out.println("============================================================");
        out.println("Turn " + state.getTurnNumber() + " - " + state.getPhase() + " - you are " + player);
        out.println("Priority token: " + (state.getPriorityHolder() == player ? "you" : "opponent"));
        out.println("============================================================");
        for (int r = 0; r < Position.SIZE; r++) {
            StringBuilder row = new StringBuilder("  ");
            for (int c = 0; c < Position.SIZE; c++) {
                row.append(String.format("%-14s", cell(state.getSquare(r, c), player)));
            }
            out.println(row);
        }

        PlayerResources mine = state.getResources(player);
        PlayerResources theirs = state.getResources(player.opponent());
        out.println();
        out.println("Your units: " + mine.getUnplaced() + "  weapons: " + mine.getWeapons()
                + "  pile: " + mine.getDrawPile().size() + " discard: " + mine.getDiscardPile());
        out.println("Opponent weapons: " + theirs.getWeaponCount()
                + "  pile: " + theirs.getDrawPile().size() + " discard: " + theirs.getDiscardPile());

        DogfightContext ctx = state.getDogfightContext();
        if (state.getPhase() == Phase.DOGFIGHTS && ctx != null) {
            out.println();
            out.println("Dogfight at " + ctx.getPosition() + ", underdog: "
                    + (ctx.getUnderdog() == player ? "you" : "opponent"));
            if (ctx.isOffensivePending()) {
                out.println("  " + (ctx.getOffensivePlayer() == player ? "You attacked" : "Opponent attacked") + ", waiting for the answer");
            }
        }
    }

    private static String cell(Square square, Player viewer) {
        if (square.isEmpty()) {
            return "[ . ]";
        }
        StringBuilder sb = new StringBuilder("[");
        for (Player p : Player.values()) {
            Unit unit = square.getUnit(p);
            if (unit == null) {
                continue;
            }
            if (sb.length() > 1) {
                sb.append(' ');
            }
            sb.append(p).append(':');
            if (!unit.isHidden()) {
                sb.append(unit.getPower());
            } else if (p == viewer) {
                sb.append(unit.getPower()).append('*');
            } else {
                sb.append("??");
            }
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return "HumanAgent(" + name + ")";
    }
}
