package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.crossword.csp.CrosswordSolver;
import net.littleredcomputer.crossword.csp.Variable;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure")
                .addOption("words", true, "filename of word list")
                .addOption("output", true, "filename of PNG image of the solution")
                .addOption("noinference", false, "do not maintain arc consistency during search")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Path file(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return Paths.get(cmd.getOptionValue(option));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword = Crossword.parse(file(cmd, "structure"), file(cmd, "words"));
        Stopwatch sw = Stopwatch.createStarted();
        Optional<ImmutableMap<Variable, String>> assignment = new CrosswordSolver()
                .setInference(!cmd.hasOption("noinference"))
                .setLogInterval(logInterval(cmd))
                .solve(crossword.puzzle());
        sw.stop();
        if (assignment.isPresent()) {
            CrosswordRenderer renderer = new CrosswordRenderer(crossword);
            System.out.print(renderer.toText(assignment.get()));
            if (cmd.hasOption("output")) renderer.save(assignment.get(), Paths.get(cmd.getOptionValue("output")));
        } else {
            System.out.println("No solution.");
        }
        System.out.println("--- " + sw + " ---");
    }
}
