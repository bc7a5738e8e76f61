package net.littleredcomputer.crossword.csp;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Domain filtering for the crossword CSP: node consistency (a word must fit
 * its slot) and arc consistency by Mackworth's AC-3.
 */
public class ConsistencyEnforcer {
    private static final Logger log = LogManager.getFormatterLogger();
    private final Puzzle puzzle;
    private long revisions;

    public ConsistencyEnforcer(Puzzle puzzle) {
        this.puzzle = puzzle;
    }

    /** @return the number of arcs revised so far */
    public long revisions() { return revisions; }

    /** Removes from each domain the words whose length differs from the length of the slot. */
    public void enforceNodeConsistency(DomainStore domains) {
        for (Variable v : puzzle.variables()) {
            final int length = v.length();
            domains.removeIf(v, w -> w.length() != length);
        }
        log.debug(() -> "node consistent domains:\n" + domains);
    }

    /**
     * Makes x arc consistent with y: removes from the domain of x each word
     * that no word in the domain of y agrees with at the crossing.
     * @return true if the domain of x changed. If x and y do not cross there
     * is nothing to do and the result is false.
     */
    @CheckReturnValue
    public boolean revise(DomainStore domains, Variable x, Variable y) {
        Optional<Overlap> o = puzzle.overlap(x, y);
        if (!o.isPresent()) return false;
        ++revisions;
        final int xi = o.get().first;
        final int yi = o.get().second;
        // The letters available at the crossing from y's side.
        BitSet supported = new BitSet();
        for (String w : domains.candidates(y)) supported.set(w.charAt(yi));
        return domains.removeIf(x, w -> !supported.get(w.charAt(xi)));
    }

    /** Runs AC-3 starting from every arc of the puzzle. */
    @CheckReturnValue
    public boolean ac3(DomainStore domains) {
        return ac3(domains, puzzle.arcs());
    }

    /**
     * Runs AC-3 starting from the given arcs. When the domain of x shrinks,
     * each arc (z, x) for z a neighbor of x other than y is put back on the
     * queue, unless it is already waiting there.
     * @return false if some domain became empty; true otherwise, in which
     * case every arc examined is consistent
     */
    @CheckReturnValue
    public boolean ac3(DomainStore domains, Collection<Arc> arcs) {
        ArrayDeque<Arc> queue = new ArrayDeque<>(arcs.size());
        Set<Arc> queued = new HashSet<>();
        for (Arc a : arcs) {
            if (queued.add(a)) queue.add(a);
        }
        while (!queue.isEmpty()) {
            Arc a = queue.remove();
            queued.remove(a);
            if (!revise(domains, a.x, a.y)) continue;
            if (domains.isEmpty(a.x)) {
                log.debug("domain of %s wiped out by %s", a.x, a.y);
                return false;
            }
            for (Variable z : puzzle.neighbors(a.x)) {
                if (z.equals(a.y)) continue;
                Arc b = new Arc(z, a.x);
                if (queued.add(b)) queue.add(b);
            }
        }
        return true;
    }
}
