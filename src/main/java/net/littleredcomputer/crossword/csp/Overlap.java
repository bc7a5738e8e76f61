package net.littleredcomputer.crossword.csp;

import java.util.Objects;

/**
 * Where two slots cross: the word for the first variable must have at index
 * {@code first} the same letter the word for the second has at index {@code second}.
 */
public final class Overlap {
    public final int first;
    public final int second;

    public Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /** @return the same crossing seen from the other variable */
    public Overlap reversed() { return new Overlap(second, first); }

    /** @return true if the two words agree at the crossing */
    public boolean agrees(String x, String y) {
        return x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Overlap)) return false;
        Overlap p = (Overlap) o;
        return first == p.first && second == p.second;
    }

    @Override
    public int hashCode() { return Objects.hash(first, second); }

    @Override
    public String toString() { return "(" + first + ", " + second + ")"; }
}
