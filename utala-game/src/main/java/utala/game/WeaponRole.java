package utala.game;

/**
 * Role a weapon token takes in a dogfight. Decided by who plays it and when, never by the
 * token itself.
 */
public enum WeaponRole {
    OFFENSIVE,
    DEFENSIVE
}
