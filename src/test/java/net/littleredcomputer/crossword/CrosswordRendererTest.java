package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.crossword.csp.Variable;
import org.junit.Test;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.util.Collections;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class CrosswordRendererTest {
    private final Crossword crossword = Crossword.parseFrom("___\n_#_\n___", "cat");
    private final CrosswordRenderer renderer = new CrosswordRenderer(crossword);

    @Test
    public void letterGrid() {
        Character[][] g = renderer.letterGrid(ImmutableMap.of(Variable.down(0, 2, 3), "TOE"));
        assertThat(g[0][2], is('T'));
        assertThat(g[1][2], is('O'));
        assertThat(g[2][2], is('E'));
        assertThat(g[0][0], is(nullValue()));
    }

    @Test
    public void partialFillLeavesOpenCellsBlank() {
        assertThat(renderer.toText(ImmutableMap.of(Variable.across(0, 0, 3), "CAT")), is(
                "CAT\n" +
                " █ \n" +
                "   \n"));
    }

    @Test
    public void imageCells() {
        BufferedImage img = renderer.toImage(Collections.emptyMap());
        assertThat(img.getWidth(), is(3 * CrosswordRenderer.CELL_SIZE));
        assertThat(img.getHeight(), is(3 * CrosswordRenderer.CELL_SIZE));
        final int half = CrosswordRenderer.CELL_SIZE / 2;
        assertThat(img.getRGB(half, half), is(Color.WHITE.getRGB()));
        // The blocked cell in the middle, and the border of an open cell.
        assertThat(img.getRGB(CrosswordRenderer.CELL_SIZE + half, CrosswordRenderer.CELL_SIZE + half),
                is(Color.BLACK.getRGB()));
        assertThat(img.getRGB(0, 0), is(Color.BLACK.getRGB()));
    }
}
