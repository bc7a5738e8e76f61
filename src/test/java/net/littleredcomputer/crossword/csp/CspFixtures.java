package net.littleredcomputer.crossword.csp;

/** Small puzzles shared by the csp tests. */
class CspFixtures {
    // Three-letter slots across row 0 and down column 1, crossing at V1[1] / V2[0].
    static final Variable V1 = Variable.across(0, 0, 3);
    static final Variable V2 = Variable.down(0, 1, 3);
    // A second down slot, crossing V1 at V1[2] / V3[0].
    static final Variable V3 = Variable.down(0, 2, 3);

    static Puzzle crossing(String... words) {
        return Puzzle.builder().addVariable(V1).addVariable(V2).addWords(words).build();
    }

    static Puzzle comb(String... words) {
        return Puzzle.builder().addVariable(V1).addVariable(V2).addVariable(V3).addWords(words).build();
    }

    static DomainStore nodeConsistent(Puzzle p) {
        DomainStore d = new DomainStore(p);
        new ConsistencyEnforcer(p).enforceNodeConsistency(d);
        return d;
    }
}
