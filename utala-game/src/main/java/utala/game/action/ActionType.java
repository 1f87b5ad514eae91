package utala.game.action;

public enum ActionType {
    PLACE_UNIT,     // placement phase: put a unit of a given power on a square
    PLAY_WEAPON,    // dogfight: commit a weapon token, role decided by turn order
    PASS            // dogfight: commit nothing
}
