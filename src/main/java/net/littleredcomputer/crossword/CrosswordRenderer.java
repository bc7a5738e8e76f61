package net.littleredcomputer.crossword;

import net.littleredcomputer.crossword.csp.Variable;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Draws a filled (or partly filled) crossword as text or as an image.
 */
public class CrosswordRenderer {
    static final char BLOCK = '█';
    static final int CELL_SIZE = 100;
    static final int CELL_BORDER = 2;
    private static final int FONT_SIZE = 80;

    private final Crossword crossword;

    public CrosswordRenderer(Crossword crossword) {
        this.crossword = crossword;
    }

    /** @return the letter placed in each cell, or null where there is none */
    public Character[][] letterGrid(Map<Variable, String> assignment) {
        Character[][] letters = new Character[crossword.height()][crossword.width()];
        assignment.forEach((v, word) -> {
            for (int k = 0; k < word.length(); ++k) {
                Variable.Cell c = v.cells().get(k);
                letters[c.i][c.j] = word.charAt(k);
            }
        });
        return letters;
    }

    /** @return the grid with blocked cells drawn as solid blocks, one line per row */
    public String toText(Map<Variable, String> assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (crossword.isOpen(i, j)) {
                    s.append(letters[i][j] != null ? letters[i][j] : ' ');
                } else {
                    s.append(BLOCK);
                }
            }
            s.append('\n');
        }
        return s.toString();
    }

    public BufferedImage toImage(Map<Variable, String> assignment) {
        final int interior = CELL_SIZE - 2 * CELL_BORDER;
        Character[][] letters = letterGrid(assignment);
        BufferedImage img = new BufferedImage(crossword.width() * CELL_SIZE, crossword.height() * CELL_SIZE,
                BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            FontMetrics fm = null;  // fonts are loaded only if there is a letter to draw
            for (int i = 0; i < crossword.height(); ++i) {
                for (int j = 0; j < crossword.width(); ++j) {
                    if (!crossword.isOpen(i, j)) continue;
                    final int x = j * CELL_SIZE + CELL_BORDER;
                    final int y = i * CELL_SIZE + CELL_BORDER;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interior, interior);
                    if (letters[i][j] == null) continue;
                    String letter = String.valueOf(letters[i][j]);
                    if (fm == null) {
                        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, FONT_SIZE));
                        fm = g.getFontMetrics();
                    }
                    g.setColor(Color.BLACK);
                    g.drawString(letter,
                            x + (interior - fm.stringWidth(letter)) / 2,
                            y + (interior - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    public void save(Map<Variable, String> assignment, Path file) throws IOException {
        if (!ImageIO.write(toImage(assignment), "png", file.toFile())) {
            throw new IOException("no PNG writer available");
        }
    }
}
