package net.littleredcomputer.crossword.csp;

import org.junit.Test;

import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.littleredcomputer.crossword.csp.CspFixtures.*;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class PuzzleTest {
    @Test
    public void variablesInNaturalOrder() {
        Puzzle p = Puzzle.builder().addVariable(V3).addVariable(V2).addVariable(V1)
                .addVariable(Variable.down(0, 0, 2)).build();
        assertThat(p.variables(), contains(V1, Variable.down(0, 0, 2), V2, V3));
    }

    @Test
    public void overlapsFromCells() {
        Puzzle p = comb("cat");
        assertThat(p.overlap(V1, V2), isPresentAndIs(new Overlap(1, 0)));
        assertThat(p.overlap(V2, V1), isPresentAndIs(new Overlap(0, 1)));
        assertThat(p.overlap(V1, V3), isPresentAndIs(new Overlap(2, 0)));
        assertThat(p.overlap(V2, V3), isEmpty());
        assertThat(p.overlap(V1, V1), is(Optional.<Overlap>empty()));
        assertThat(p.overlap(V3, V1).get().reversed(), is(p.overlap(V1, V3).get()));
    }

    @Test
    public void neighborsAndArcs() {
        Puzzle p = comb("cat");
        assertThat(p.neighbors(V1), contains(V2, V3));
        assertThat(p.neighbors(V2), contains(V1));
        assertThat(p.degree(V1), is(2));
        assertThat(p.arcs(), containsInAnyOrder(
                new Arc(V1, V2), new Arc(V2, V1), new Arc(V1, V3), new Arc(V3, V1)));
    }

    @Test
    public void repeatedWordsAreDropped() {
        assertThat(crossing("car", "ace", "car", "dog").words(), contains("car", "ace", "dog"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateVariable() {
        // Equal start and direction make the same slot, whatever the length.
        Puzzle.builder().addVariable(V1).addVariable(Variable.across(0, 0, 4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void slotsMayShareOnlyOneCell() {
        Puzzle.builder().addVariable(V1).addVariable(Variable.across(0, 1, 3)).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyWord() {
        Puzzle.builder().addWord("");
    }

    @Test
    public void variableToString() {
        assertThat(V1.toString(), is("(0, 0) across : 3"));
        assertThat(V2.cells().get(2).toString(), is("2,1"));
    }
}
