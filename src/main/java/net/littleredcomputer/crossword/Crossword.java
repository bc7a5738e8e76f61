package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.io.CharStreams;
import net.littleredcomputer.crossword.csp.Puzzle;
import net.littleredcomputer.crossword.csp.Variable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * A crossword grid together with its word list.
 *
 * <p>The structure is given one grid row per line: {@code _} is a cell to
 * be filled, anything else (by convention {@code #}) is blocked. Short lines
 * are padded with blocked cells. Each maximal horizontal or vertical run of
 * two or more open cells is a slot to fill. The word list has one word per
 * line; words are upper-cased, and blank lines and repeats are dropped.
 */
public class Crossword {
    private static final char OPEN = '_';

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final Puzzle puzzle;

    private Crossword(List<String> rows, List<String> words) {
        height = rows.size();
        width = rows.stream().mapToInt(String::length).max().orElse(0);
        if (height == 0 || width == 0) throw new IllegalArgumentException("empty structure");
        structure = new boolean[height][width];
        for (int i = 0; i < height; ++i) {
            String row = rows.get(i);
            for (int j = 0; j < width; ++j) {
                structure[i][j] = j < row.length() && row.charAt(j) == OPEN;
            }
        }
        Puzzle.Builder b = Puzzle.builder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                // A slot starts wherever an open cell has no open cell before it.
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 1;
                    while (i + length < height && structure[i + length][j]) ++length;
                    if (length > 1) b.addVariable(Variable.down(i, j, length));
                }
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 1;
                    while (j + length < width && structure[i][j + length]) ++length;
                    if (length > 1) b.addVariable(Variable.across(i, j, length));
                }
            }
        }
        for (String w : words) {
            String word = CharMatcher.whitespace().trimFrom(w).toUpperCase(Locale.ROOT);
            if (!word.isEmpty()) b.addWord(word);
        }
        puzzle = b.build();
        if (puzzle.variables().isEmpty()) throw new IllegalArgumentException("structure has no slots to fill");
    }

    public int height() { return height; }
    public int width() { return width; }

    /** @return true if cell (i, j) is to be filled */
    public boolean isOpen(int i, int j) { return structure[i][j]; }

    public Puzzle puzzle() { return puzzle; }

    public static Crossword parse(Reader structure, Reader words) throws IOException {
        return new Crossword(CharStreams.readLines(structure), CharStreams.readLines(words));
    }

    public static Crossword parse(Path structure, Path words) throws IOException {
        try (Reader s = Files.newBufferedReader(structure, StandardCharsets.UTF_8);
             Reader w = Files.newBufferedReader(words, StandardCharsets.UTF_8)) {
            return parse(s, w);
        }
    }

    /**
     * @param structure grid rows separated by newlines
     * @param words words separated by newlines
     */
    public static Crossword parseFrom(String structure, String words) {
        try {
            return parse(new StringReader(structure), new StringReader(words));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
