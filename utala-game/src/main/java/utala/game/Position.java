package utala.game;

import com.google.common.collect.ImmutableList;

/**
 * A square coordinate on the 3x3 grid, 0-indexed. Instances are interned, so == works.
 */
public final class Position {
    public static final int SIZE = 3;

    private static final Position[][] ALL = new Position[SIZE][SIZE];
    static {
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                ALL[row][col] = new Position(row, col);
            }
        }
    }

    public static final Position CENTER = of(1, 1);

    private static final ImmutableList<Position> ROW_MAJOR;
    static {
        ImmutableList.Builder<Position> all = ImmutableList.builder();
        for (Position[] row : ALL) {
            all.add(row);
        }
        ROW_MAJOR = all.build();
    }

    /** Dogfight resolution order: center, then edges, then corners. */
    public static final ImmutableList<Position> RESOLUTION_ORDER = ImmutableList.of(
            CENTER,
            of(0, 1), of(1, 0), of(1, 2), of(2, 1),
            of(0, 0), of(0, 2), of(2, 0), of(2, 2));

    /** Every row, column and both diagonals. */
    public static final ImmutableList<ImmutableList<Position>> LINES;
    static {
        ImmutableList.Builder<ImmutableList<Position>> lines = ImmutableList.builder();
        for (int i = 0; i < SIZE; i++) {
            lines.add(ImmutableList.of(of(i, 0), of(i, 1), of(i, 2)));
            lines.add(ImmutableList.of(of(0, i), of(1, i), of(2, i)));
        }
        lines.add(ImmutableList.of(of(0, 0), of(1, 1), of(2, 2)));
        lines.add(ImmutableList.of(of(0, 2), of(1, 1), of(2, 0)));
        LINES = lines.build();
    }

    private final int row;
    private final int col;

    private Position(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static Position of(int row, int col) {
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
            throw new IllegalArgumentException("Position out of grid: [" + row + "," + col + "]");
        }
        return ALL[row][col];
    }

    /**
     * @return all nine squares in row-major order
     */
    public static ImmutableList<Position> all() {
        return ROW_MAJOR;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * All lines (row, column, diagonals) passing through this square.
     */
    public ImmutableList<ImmutableList<Position>> getLines() {
        ImmutableList.Builder<ImmutableList<Position>> result = ImmutableList.builder();
        for (ImmutableList<Position> line : LINES) {
            if (line.contains(this)) {
                result.add(line);
            }
        }
        return result.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return row * SIZE + col;
    }

    @Override
    public String toString() {
        return "[" + row + "," + col + "]";
    }
}
