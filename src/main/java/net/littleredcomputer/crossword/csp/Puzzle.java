package net.littleredcomputer.crossword.csp;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Ordering;

import java.util.*;

/**
 * An immutable crossword constraint problem: the slots to fill, the words
 * that may fill them, and where the slots cross. Variables are kept in
 * their natural order and words in the order they were first added; every
 * traversal the solver makes follows these orders, so solving is
 * reproducible.
 */
public final class Puzzle {
    private final ImmutableList<Variable> variables;
    private final ImmutableMap<Variable, Integer> variableIndex;  // inverse of above
    private final ImmutableList<String> words;
    private final ImmutableTable<Variable, Variable, Overlap> overlaps;
    private final ImmutableSetMultimap<Variable, Variable> neighbors;
    private final ImmutableList<Arc> arcs;

    private Puzzle(List<Variable> variables, List<String> words) {
        this.variables = ImmutableList.sortedCopyOf(variables);
        ImmutableMap.Builder<Variable, Integer> ib = ImmutableMap.builder();
        for (int k = 0; k < this.variables.size(); ++k) ib.put(this.variables.get(k), k);
        variableIndex = ib.build();
        this.words = ImmutableList.copyOf(words);

        ImmutableTable.Builder<Variable, Variable, Overlap> ob = ImmutableTable.builder();
        ImmutableSetMultimap.Builder<Variable, Variable> nb =
                ImmutableSetMultimap.<Variable, Variable>builder().orderValuesBy(Ordering.natural());
        ImmutableList.Builder<Arc> ab = ImmutableList.builder();
        for (Variable v1 : this.variables) {
            for (Variable v2 : this.variables) {
                if (v1.equals(v2)) continue;
                Set<Variable.Cell> shared = new HashSet<>(v1.cells());
                shared.retainAll(v2.cells());
                if (shared.isEmpty()) continue;
                if (shared.size() > 1) {
                    throw new IllegalArgumentException("slots " + v1 + " and " + v2 + " share more than one cell");
                }
                Variable.Cell c = shared.iterator().next();
                ob.put(v1, v2, new Overlap(v1.cells().indexOf(c), v2.cells().indexOf(c)));
                nb.put(v1, v2);
                ab.add(new Arc(v1, v2));
            }
        }
        overlaps = ob.build();
        neighbors = nb.build();
        arcs = ab.build();
    }

    public static Builder builder() { return new Builder(); }

    /** @return the slots of the puzzle, in natural order */
    public ImmutableList<Variable> variables() { return variables; }

    /** @return the candidate words, in the order they were supplied */
    public ImmutableList<String> words() { return words; }

    /** @return the position of v in {@link #variables()} */
    int indexOf(Variable v) {
        Integer ix = variableIndex.get(v);
        if (ix == null) throw new IllegalArgumentException("unknown variable: " + v);
        return ix;
    }

    public boolean contains(Variable v) { return variableIndex.containsKey(v); }

    /**
     * @return the crossing of x and y, with {@link Overlap#first} indexing x's
     * word; empty if the slots do not cross
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        return Optional.ofNullable(overlaps.get(x, y));
    }

    /** @return the slots crossing v, in natural order */
    public ImmutableSet<Variable> neighbors(Variable v) {
        return neighbors.get(v);
    }

    public int degree(Variable v) { return neighbors.get(v).size(); }

    /** @return every ordered pair of crossing slots */
    public ImmutableList<Arc> arcs() { return arcs; }

    @Override
    public String toString() {
        return String.format("Puzzle[%d variables, %d words, %d arcs]", variables.size(), words.size(), arcs.size());
    }

    public static final class Builder {
        private final Set<Variable> variables = new LinkedHashSet<>();
        private final Set<String> words = new LinkedHashSet<>();

        private Builder() {}

        public Builder addVariable(Variable v) {
            Preconditions.checkNotNull(v);
            if (!variables.add(v)) throw new IllegalArgumentException("duplicate variable: " + v);
            return this;
        }

        public Builder addVariables(Iterable<Variable> vs) {
            vs.forEach(this::addVariable);
            return this;
        }

        /** Adds a candidate word. Repeated words are ignored; empty ones are rejected. */
        public Builder addWord(String w) {
            Preconditions.checkArgument(w != null && !w.isEmpty(), "empty word");
            words.add(w);
            return this;
        }

        public Builder addWords(Iterable<String> ws) {
            ws.forEach(this::addWord);
            return this;
        }

        public Builder addWords(String... ws) {
            return addWords(Arrays.asList(ws));
        }

        public Puzzle build() {
            return new Puzzle(new ArrayList<>(variables), new ArrayList<>(words));
        }
    }
}
