package net.littleredcomputer.crossword.csp;

import com.google.common.base.Stopwatch;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Backtracking search over assignments, choosing variables by minimum
 * remaining values (then degree) and words by least constraining value, and
 * optionally maintaining arc consistency after each choice.
 *
 * <p>The search keeps its own stack of frames instead of recursing, so its
 * depth is limited by the heap rather than the thread's stack. Each frame
 * remembers the variable being tried, the words not yet tried for it, and a
 * domain checkpoint taken on entry to the level. Whenever a word is given up
 * the domains are rolled back to that checkpoint, so every sibling word sees
 * the domains exactly as they were when the level was entered.
 */
public class SearchEngine {
    private static final Logger log = LogManager.getFormatterLogger();
    private final Puzzle puzzle;
    private final ConsistencyEnforcer enforcer;
    private boolean inference = true;
    private long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public SearchEngine(Puzzle puzzle, ConsistencyEnforcer enforcer) {
        this.puzzle = puzzle;
        this.enforcer = enforcer;
    }

    public SearchEngine setInference(boolean inference) {
        this.inference = inference;
        return this;
    }

    public SearchEngine setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /** @return the number of (variable, word) choices tried so far */
    public long stepCount() { return stepCount; }

    /** @return true if every variable of the puzzle has a word */
    public boolean isComplete(Assignment assignment) {
        for (Variable v : puzzle.variables()) {
            if (!assignment.isAssigned(v)) return false;
        }
        return true;
    }

    /**
     * @return true if the assigned words are all different, each fits its
     * slot, and assigned slots which cross agree on the letter they share.
     * Only the assignment is consulted.
     */
    public boolean isConsistent(Assignment assignment) {
        Set<String> seen = new HashSet<>();
        for (Variable v : assignment.variables()) {
            String w = assignment.get(v);
            if (!seen.add(w)) return false;
            if (w.length() != v.length()) return false;
        }
        for (Variable v : assignment.variables()) {
            String w = assignment.get(v);
            for (Variable n : puzzle.neighbors(v)) {
                if (!assignment.isAssigned(n)) continue;
                Overlap o = puzzle.overlap(v, n).orElseThrow(IllegalStateException::new);
                if (!o.agrees(w, assignment.get(n))) return false;
            }
        }
        return true;
    }

    /**
     * Chooses the unassigned variable with the fewest remaining candidates.
     * Ties go to the variable crossing the most others, and remaining ties to
     * the variable first in natural order.
     */
    public Variable selectUnassignedVariable(Assignment assignment, DomainStore domains) {
        Variable best = null;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;
        for (Variable v : puzzle.variables()) {
            if (assignment.isAssigned(v)) continue;
            final int size = domains.size(v);
            final int degree = puzzle.degree(v);
            if (size < bestSize || (size == bestSize && degree > bestDegree)) {
                best = v;
                bestSize = size;
                bestDegree = degree;
            }
        }
        if (best == null) throw new IllegalStateException("every variable is assigned");
        return best;
    }

    /**
     * Orders the candidates for var by the number of words each would rule out
     * of the domains of var's unassigned neighbors, fewest first. Words ruling
     * out the same number keep their word-list order.
     */
    public List<String> orderDomainValues(Variable var, Assignment assignment, DomainStore domains) {
        List<String> candidates = domains.candidates(var);
        final int[] eliminated = new int[candidates.size()];
        for (Variable n : puzzle.neighbors(var)) {
            if (assignment.isAssigned(n)) continue;
            Overlap o = puzzle.overlap(var, n).orElseThrow(IllegalStateException::new);
            // How many of n's words carry each letter at the crossing?
            Multiset<Character> letters = HashMultiset.create();
            for (String w : domains.candidates(n)) letters.add(w.charAt(o.second));
            final int size = domains.size(n);
            for (int k = 0; k < candidates.size(); ++k) {
                eliminated[k] += size - letters.count(candidates.get(k).charAt(o.first));
            }
        }
        Integer[] order = new Integer[candidates.size()];
        for (int k = 0; k < order.length; ++k) order[k] = k;
        Arrays.sort(order, Comparator.comparingInt(k -> eliminated[k]));  // stable
        ImmutableList.Builder<String> b = ImmutableList.builderWithExpectedSize(order.length);
        for (int k : order) b.add(candidates.get(k));
        return b.build();
    }

    /**
     * Restricts the domain of var to word and propagates that choice to the
     * unassigned neighbors of var.
     * @return false if propagation emptied a domain
     */
    boolean infer(Variable var, String word, Assignment assignment, DomainStore domains) {
        domains.restrict(var, word);
        List<Arc> arcs = new ArrayList<>();
        for (Variable n : puzzle.neighbors(var)) {
            if (!assignment.isAssigned(n)) arcs.add(new Arc(n, var));
        }
        return arcs.isEmpty() || enforcer.ac3(domains, arcs);
    }

    private static class Frame {
        final Variable var;
        final Iterator<String> candidates;
        final int mark;

        Frame(Variable var, List<String> candidates, int mark) {
            this.var = var;
            this.candidates = candidates.iterator();
            this.mark = mark;
        }
    }

    /**
     * Extends the assignment to a complete one if possible. On success the
     * assignment is left complete and the domains hold the state reached by
     * the final choice; on failure both are as they were on entry.
     * @return the completed assignment, or empty if there is none
     */
    public Optional<Assignment> backtrack(Assignment assignment, DomainStore domains) {
        start();
        Deque<Frame> stack = new ArrayDeque<>();
        Frame f = null;
        int step = 2;
        while (true) {
            // Step 1 (seeding and filtering the domains) is done by the caller.
            switch (step) {
                case 2:  // Enter a level. Done?
                    if (isComplete(assignment)) {
                        stopwatch.stop();
                        log.debug("complete after %d steps %s", stepCount, stopwatch);
                        return Optional.of(assignment);
                    }
                    // Choose a variable and order its words.
                    Variable v = selectUnassignedVariable(assignment, domains);
                    f = new Frame(v, orderDomainValues(v, assignment, domains), domains.checkpoint());
                    stack.push(f);
                    // fall through
                case 3:  // Try the next word for f.var.
                    if (!f.candidates.hasNext()) {
                        step = 5;
                        continue;
                    }
                    String word = f.candidates.next();
                    if (++stepCount % 1000 == 0) maybeReportProgress(stack.size());
                    assignment.assign(f.var, word);
                    log.trace("level %d: trying %s = %s", stack.size(), f.var, word);
                    if (!isConsistent(assignment)) {
                        assignment.unassign(f.var);
                        step = 3;
                        continue;
                    }
                    if (inference && !infer(f.var, word, assignment, domains)) {
                        log.trace("level %d: inference refutes %s", stack.size(), word);
                        step = 4;
                        continue;
                    }
                    step = 2;
                    continue;
                case 4:  // Give up the current word for f.var.
                    assignment.unassign(f.var);
                    domains.rollback(f.mark);
                    step = 3;
                    continue;
                case 5:  // Backtrack: leave the level.
                    stack.pop();
                    if (stack.isEmpty()) {
                        stopwatch.stop();
                        log.debug("exhausted after %d steps %s", stepCount, stopwatch);
                        return Optional.empty();
                    }
                    f = stack.peek();
                    step = 4;
                    continue;
                default:
                    throw new IllegalStateException("bad step " + step);
            }
        }
    }

    private void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private void maybeReportProgress(int depth) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec depth %d/%d revisions %d",
                stepCount, stopwatch, perSec, depth, puzzle.variables().size(), enforcer.revisions()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
