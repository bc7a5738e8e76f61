package net.littleredcomputer.crossword;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MainTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream saved;

    @Before
    public void captureOutput() throws UnsupportedEncodingException {
        saved = System.out;
        System.setOut(new PrintStream(out, true, "UTF-8"));
    }

    @After
    public void restoreOutput() {
        System.setOut(saved);
    }

    private static String resource(String name) throws URISyntaxException {
        return Paths.get(MainTest.class.getClassLoader().getResource(name).toURI()).toString();
    }

    private String output() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void printsTheFill() throws Exception {
        Main.main(new String[]{"-structure", resource("crossword/structure0.txt"),
                "-words", resource("crossword/words0.txt")});
        assertThat(output(), startsWith("█TWO█\n█H██O\n"));
        assertThat(output(), containsString("--- "));
    }

    @Test
    public void reportsNoSolution() throws Exception {
        Main.main(new String[]{"-structure", resource("crossword/structure1.txt"),
                "-words", resource("crossword/words0.txt"), "-noinference"});
        assertThat(output(), startsWith("No solution."));
    }

    @Test(expected = IllegalArgumentException.class)
    public void structureIsRequired() throws Exception {
        Main.main(new String[]{"-words", "words.txt"});
    }
}
