package utala.game;

/**
 * The two seats at the table. Player ONE places first; player TWO starts with the priority token.
 */
public enum Player {
    ONE,
    TWO;

    public Player opponent() {
        return this == ONE ? TWO : ONE;
    }

    /** 0 for ONE, 1 for TWO. This is the id written to replays. */
    public int getId() {
        return ordinal();
    }

    public static Player fromId(int id) {
        switch (id) {
            case 0: return ONE;
            case 1: return TWO;
            default: throw new IllegalArgumentException("Unknown player id " + id);
        }
    }

    @Override
    public String toString() {
        return "P" + (ordinal() + 1);
    }
}
