package net.littleredcomputer.crossword.csp;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Fills a crossword: makes the domains node and arc consistent, then
 * searches for an assignment of a word to every slot.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    private boolean inference = true;
    private Duration logInterval = Duration.ofMillis(1000);

    /** Whether search maintains arc consistency after each choice. The answer is the same either way. */
    public CrosswordSolver setInference(boolean inference) {
        this.inference = inference;
        return this;
    }

    public CrosswordSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * @return a word for every variable of the puzzle, keyed in variable
     * order; empty if the puzzle has no solution
     */
    public Optional<ImmutableMap<Variable, String>> solve(Puzzle puzzle) {
        Stopwatch sw = Stopwatch.createStarted();
        DomainStore domains = new DomainStore(puzzle);
        ConsistencyEnforcer enforcer = new ConsistencyEnforcer(puzzle);
        enforcer.enforceNodeConsistency(domains);
        if (!enforcer.ac3(domains)) {
            log.info("%s is not arc consistent; no solution %s", puzzle, sw);
            return Optional.empty();
        }
        SearchEngine search = new SearchEngine(puzzle, enforcer)
                .setInference(inference)
                .setLogInterval(logInterval);
        Optional<ImmutableMap<Variable, String>> result =
                search.backtrack(new Assignment(), domains).map(Assignment::asMap);
        log.info("%s %s after %d steps, %d revisions %s", puzzle, result.isPresent() ? "solved" : "has no solution",
                search.stepCount(), enforcer.revisions(), sw);
        return result;
    }
}
