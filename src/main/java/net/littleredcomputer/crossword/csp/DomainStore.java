package net.littleredcomputer.crossword.csp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gnu.trove.list.array.TIntArrayList;

import java.util.BitSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * The working domains of a solve: for each variable, the words still
 * possible for it. A domain is a bit set over the puzzle's word list, so
 * candidates are always visited in word-list order.
 *
 * <p>Every removal is pushed onto a trail. {@link #checkpoint()} marks the
 * trail and {@link #rollback(int)} restores every word removed since the
 * mark, which is how search undoes the effect of inference when it abandons
 * a candidate. Not thread safe: a store belongs to one solve.
 */
public class DomainStore {
    private final Puzzle puzzle;
    private final ImmutableList<String> words;
    private final ImmutableMap<String, Integer> wordIndex;  // inverse of above
    private final BitSet[] domains;
    private final int[] sizes;
    // The trail: entry k records that word trailWord[k] left the domain of variable trailVar[k].
    private final TIntArrayList trailVar = new TIntArrayList();
    private final TIntArrayList trailWord = new TIntArrayList();

    /** Creates a store in which every word is a candidate for every variable. */
    public DomainStore(Puzzle puzzle) {
        this.puzzle = puzzle;
        this.words = puzzle.words();
        ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
        for (int k = 0; k < words.size(); ++k) b.put(words.get(k), k);
        wordIndex = b.build();
        final int nVariables = puzzle.variables().size();
        domains = new BitSet[nVariables];
        sizes = new int[nVariables];
        for (int v = 0; v < nVariables; ++v) {
            domains[v] = new BitSet(words.size());
            domains[v].set(0, words.size());
            sizes[v] = words.size();
        }
    }

    public Puzzle puzzle() { return puzzle; }

    public int size(Variable v) { return sizes[puzzle.indexOf(v)]; }

    public boolean isEmpty(Variable v) { return size(v) == 0; }

    public boolean contains(Variable v, String word) {
        Integer w = wordIndex.get(word);
        return w != null && domains[puzzle.indexOf(v)].get(w);
    }

    /** @return the candidates for v, in word-list order */
    public List<String> candidates(Variable v) {
        BitSet d = domains[puzzle.indexOf(v)];
        ImmutableList.Builder<String> b = ImmutableList.builderWithExpectedSize(d.cardinality());
        for (int w = d.nextSetBit(0); w >= 0; w = d.nextSetBit(w + 1)) b.add(words.get(w));
        return b.build();
    }

    /**
     * Removes from the domain of v every candidate satisfying the predicate.
     * @return true if anything was removed
     */
    public boolean removeIf(Variable v, Predicate<String> p) {
        final int vi = puzzle.indexOf(v);
        BitSet d = domains[vi];
        boolean changed = false;
        for (int w = d.nextSetBit(0); w >= 0; w = d.nextSetBit(w + 1)) {
            if (p.test(words.get(w))) {
                erase(vi, w);
                changed = true;
            }
        }
        return changed;
    }

    /** @return true if word was a candidate for v (and now isn't) */
    public boolean remove(Variable v, String word) {
        Integer w = wordIndex.get(word);
        final int vi = puzzle.indexOf(v);
        if (w == null || !domains[vi].get(w)) return false;
        erase(vi, w);
        return true;
    }

    /** Reduces the domain of v to the single word given (or to nothing, if word is not a candidate). */
    public boolean restrict(Variable v, String word) {
        return removeIf(v, w -> !w.equals(word));
    }

    private void erase(int vi, int w) {
        domains[vi].clear(w);
        --sizes[vi];
        trailVar.add(vi);
        trailWord.add(w);
    }

    /** @return a mark which may later be handed to {@link #rollback(int)} */
    public int checkpoint() { return trailVar.size(); }

    /** Restores every candidate removed since the mark was taken. */
    public void rollback(int mark) {
        final int top = trailVar.size();
        if (mark < 0 || mark > top) {
            throw new IllegalStateException("rollback mark " + mark + " is not live (trail size " + top + ")");
        }
        for (int k = top - 1; k >= mark; --k) {
            final int vi = trailVar.get(k);
            domains[vi].set(trailWord.get(k));
            ++sizes[vi];
        }
        trailVar.remove(mark, top - mark);
        trailWord.remove(mark, top - mark);
    }

    /** @return a copy of the current domains, keyed in variable order */
    public ImmutableMap<Variable, List<String>> asMap() {
        ImmutableMap.Builder<Variable, List<String>> b = ImmutableMap.builder();
        for (Variable v : puzzle.variables()) b.put(v, candidates(v));
        return b.build();
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (Variable v : puzzle.variables()) s.append(v).append(" -> ").append(size(v)).append('\n');
        return s.toString();
    }
}
