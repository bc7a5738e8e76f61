package net.littleredcomputer.crossword.csp;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * A slot in the crossword grid: a run of cells starting at (i, j) and
 * extending across or down. Two slots are the same variable if they start
 * in the same cell and run in the same direction.
 */
public final class Variable implements Comparable<Variable> {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int i;
    private final int j;
    private final Direction direction;
    private final int length;
    private final ImmutableList<Cell> cells;

    public Variable(int i, int j, Direction direction, int length) {
        Preconditions.checkArgument(i >= 0 && j >= 0, "negative start (%s, %s)", i, j);
        Preconditions.checkArgument(length > 0, "length must be positive: %s", length);
        this.i = i;
        this.j = j;
        this.direction = Preconditions.checkNotNull(direction);
        this.length = length;
        ImmutableList.Builder<Cell> b = ImmutableList.builderWithExpectedSize(length);
        for (int k = 0; k < length; ++k) {
            b.add(direction == Direction.ACROSS ? new Cell(i, j + k) : new Cell(i + k, j));
        }
        cells = b.build();
    }

    public static Variable across(int i, int j, int length) { return new Variable(i, j, Direction.ACROSS, length); }
    public static Variable down(int i, int j, int length) { return new Variable(i, j, Direction.DOWN, length); }

    public int row() { return i; }
    public int column() { return j; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return the cells covered by this slot, in the order its letters are written */
    public ImmutableList<Cell> cells() { return cells; }

    @Override
    public int compareTo(Variable o) {
        return ComparisonChain.start()
                .compare(i, o.i)
                .compare(j, o.j)
                .compare(direction, o.direction)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return i == v.i && j == v.j && direction == v.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(i, j, direction);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", i, j, direction.name().toLowerCase(), length);
    }

    /** A grid position. */
    public static final class Cell {
        public final int i;
        public final int j;

        public Cell(int i, int j) { this.i = i; this.j = j; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Cell)) return false;
            Cell c = (Cell) o;
            return i == c.i && j == c.j;
        }

        @Override
        public int hashCode() { return 31 * i + j; }

        @Override
        public String toString() { return i + "," + j; }
    }
}
