package net.littleredcomputer.crossword.csp;

import org.junit.Test;

import static net.littleredcomputer.crossword.csp.CspFixtures.*;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class DomainStoreTest {
    @Test
    public void seededWithEveryWord() {
        DomainStore d = new DomainStore(crossing("car", "ace", "dogs"));
        assertThat(d.candidates(V1), contains("car", "ace", "dogs"));
        assertThat(d.size(V2), is(3));
        assertThat(d.contains(V2, "dogs"), is(true));
        assertThat(d.contains(V2, "cat"), is(false));
    }

    @Test
    public void removeAndRestrict() {
        DomainStore d = new DomainStore(crossing("car", "ace", "dog"));
        assertThat(d.remove(V1, "ace"), is(true));
        assertThat(d.remove(V1, "ace"), is(false));
        assertThat(d.remove(V1, "emu"), is(false));
        assertThat(d.candidates(V1), contains("car", "dog"));
        assertThat(d.restrict(V2, "dog"), is(true));
        assertThat(d.candidates(V2), contains("dog"));
        assertThat(d.restrict(V2, "dog"), is(false));
        assertThat(d.restrict(V2, "ace"), is(true));
        assertThat(d.isEmpty(V2), is(true));
    }

    @Test
    public void rollbackRestoresWordOrder() {
        DomainStore d = new DomainStore(crossing("car", "ace", "dog", "emu"));
        int outer = d.checkpoint();
        d.remove(V1, "ace");
        int inner = d.checkpoint();
        d.restrict(V1, "emu");
        d.remove(V2, "car");
        assertThat(d.candidates(V1), contains("emu"));
        d.rollback(inner);
        assertThat(d.candidates(V1), contains("car", "dog", "emu"));
        assertThat(d.candidates(V2), contains("car", "ace", "dog", "emu"));
        d.rollback(outer);
        assertThat(d.candidates(V1), contains("car", "ace", "dog", "emu"));
        assertThat(d.size(V1), is(4));
    }

    @Test(expected = IllegalStateException.class)
    public void rollbackToADeadMark() {
        DomainStore d = new DomainStore(crossing("car", "ace"));
        int outer = d.checkpoint();
        d.remove(V1, "car");
        int inner = d.checkpoint();
        d.rollback(outer);
        d.rollback(inner);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownVariable() {
        new DomainStore(crossing("car")).size(V3);
    }
}
