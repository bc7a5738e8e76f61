package net.littleredcomputer.crossword.csp;

import java.util.Objects;

/**
 * A directed constraint: every word left in the domain of {@code x} needs a
 * word in the domain of {@code y} that agrees with it where they cross.
 */
public final class Arc {
    public final Variable x;
    public final Variable y;

    public Arc(Variable x, Variable y) {
        this.x = Objects.requireNonNull(x);
        this.y = Objects.requireNonNull(y);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Arc)) return false;
        Arc a = (Arc) o;
        return x.equals(a.x) && y.equals(a.y);
    }

    @Override
    public int hashCode() { return Objects.hash(x, y); }

    @Override
    public String toString() { return x + " -> " + y; }
}
