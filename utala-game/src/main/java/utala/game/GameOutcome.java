package utala.game;

/**
 * Final result of a game.
 */
public enum GameOutcome {
    PLAYER_ONE(Player.ONE),
    PLAYER_TWO(Player.TWO),
    DRAW(null);

    private final Player winner;

    GameOutcome(Player winner) {
        this.winner = winner;
    }

    /**
     * @return the winning player, or null for a draw
     */
    public Player getWinner() {
        return winner;
    }

    public boolean isDraw() {
        return winner == null;
    }

    public boolean isWinner(Player player) {
        return winner != null && winner == player;
    }

    public static GameOutcome winFor(Player player) {
        return player == Player.ONE ? PLAYER_ONE : PLAYER_TWO;
    }
}
