/*
 * utala: kaos 9
 * Copyright (C) 2026  utala developers
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package utala.game.action;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import utala.game.GameState;
import utala.game.Phase;
import utala.game.Player;
import utala.game.PlayerResources;
import utala.game.Position;
import utala.game.Square;
import utala.game.Unit;

/**
 * The fixed, fully enumerated action space.
 *
 * Index layout never changes for the lifetime of the process:
 * 81 placements (power 2..10, then row, then column), 4 weapon slots, 1 pass.
 * Illegal actions are masked, never removed. The mask computed here is the only
 * legality check in the game; the engine validates against it.
 */
public final class ActionCatalog {
    public static final int WEAPON_SLOTS = 4;
    public static final int PLACEMENT_ACTIONS =
            (Unit.MAX_POWER - Unit.MIN_POWER + 1) * Position.SIZE * Position.SIZE;
    public static final int SIZE = PLACEMENT_ACTIONS + WEAPON_SLOTS + 1;

    private static final class Holder {
        static final ActionCatalog INSTANCE = new ActionCatalog();
    }

    private final ImmutableList<Action> actions;

    private ActionCatalog() {
        ImmutableList.Builder<Action> builder = ImmutableList.builderWithExpectedSize(SIZE);
        for (int power = Unit.MIN_POWER; power <= Unit.MAX_POWER; power++) {
            for (int row = 0; row < Position.SIZE; row++) {
                for (int col = 0; col < Position.SIZE; col++) {
                    builder.add(Action.place(power, Position.of(row, col)));
                }
            }
        }
        for (int slot = 0; slot < WEAPON_SLOTS; slot++) {
            builder.add(Action.weapon(slot));
        }
        builder.add(Action.pass());
        actions = builder.build();
    }

    public static ActionCatalog get() {
        return Holder.INSTANCE;
    }

    public int size() {
        return actions.size();
    }

    /**
     * @throws IndexOutOfBoundsException if index is outside [0, size())
     */
    public Action get(int index) {
        Preconditions.checkElementIndex(index, actions.size(), "action index");
        return actions.get(index);
    }

    public ImmutableList<Action> getActions() {
        return actions;
    }

    /**
     * @return the index of the action, or -1 if it is not part of the catalog
     */
    public int indexOf(Action action) {
        return actions.indexOf(action);
    }

    public int placementIndex(int power, int row, int col) {
        Preconditions.checkArgument(power >= Unit.MIN_POWER && power <= Unit.MAX_POWER, "power %s", power);
        Position.of(row, col);
        return (power - Unit.MIN_POWER) * Position.SIZE * Position.SIZE + row * Position.SIZE + col;
    }

    public int placementIndex(int power, Position position) {
        return placementIndex(power, position.getRow(), position.getCol());
    }

    public int weaponIndex(int slot) {
        Preconditions.checkElementIndex(slot, WEAPON_SLOTS, "weapon slot");
        return PLACEMENT_ACTIONS + slot;
    }

    public int passIndex() {
        return SIZE - 1;
    }

    /**
     * Legality mask for a player against a state; always {@link #SIZE} entries long.
     */
    public boolean[] legalMask(GameState state, Player player) {
        boolean[] mask = new boolean[actions.size()];
        PlayerResources resources = state.getResources(player);

        if (state.getPhase() == Phase.PLACEMENT) {
            for (int i = 0; i < PLACEMENT_ACTIONS; i++) {
                Action action = actions.get(i);
                if (!resources.hasUnplaced(action.getPower())) {
                    continue;
                }
                // contesting an opponent's square is fine, re-occupying your own is not
                Square square = state.getSquare(action.getPosition());
                mask[i] = !square.hasUnitOf(player);
            }
        } else if (state.getPhase() == Phase.DOGFIGHTS) {
            for (int slot = 0; slot < WEAPON_SLOTS; slot++) {
                mask[PLACEMENT_ACTIONS + slot] = slot < resources.getWeaponCount();
            }
            mask[passIndex()] = true;
        }
        return mask;
    }

    public List<Integer> legalIndices(GameState state, Player player) {
        boolean[] mask = legalMask(state, player);
        List<Integer> legal = new ArrayList<>();
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                legal.add(i);
            }
        }
        return legal;
    }

    public boolean isLegal(GameState state, Player player, int index) {
        return index >= 0 && index < actions.size() && legalMask(state, player)[index];
    }
}
