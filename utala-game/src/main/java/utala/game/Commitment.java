package utala.game;

/**
 * A weapon committed during a dogfight: who played it, from which slot, and the role the
 * turn order gave it.
 */
public final class Commitment {
    private final Player player;
    private final int weaponSlot;
    private final WeaponRole role;

    Commitment(Player player, int weaponSlot, WeaponRole role) {
        this.player = player;
        this.weaponSlot = weaponSlot;
        this.role = role;
    }

    public Player getPlayer() {
        return player;
    }

    public int getWeaponSlot() {
        return weaponSlot;
    }

    public WeaponRole getRole() {
        return role;
    }

    public boolean isOffensive() {
        return role == WeaponRole.OFFENSIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Commitment)) return false;
        Commitment other = (Commitment) o;
        return player == other.player && weaponSlot == other.weaponSlot && role == other.role;
    }

    @Override
    public int hashCode() {
        return (player.hashCode() * 31 + weaponSlot) * 31 + role.hashCode();
    }

    @Override
    public String toString() {
        return player + " " + role + " weapon[" + weaponSlot + "]";
    }
}
