package org.tilecascade.cli.commands;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tilecascade.cli.CommandLineInterface;
import org.tilecascade.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the simulate subcommand in-process through picocli.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class SimulateCommandTest {

    @TempDir
    Path tempDir;

    private static final class Run {
        final int exitCode;
        final String out;
        final String err;

        Run(int exitCode, String out, String err) {
            this.exitCode = exitCode;
            this.out = out;
            this.err = err;
        }
    }

    private static Run execute(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        int exitCode = cmd.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    @Test
    void testPrintsSummary() {
        Run run = execute("simulate", "--seed", "7", "--moves", "5");

        assertThat(run.exitCode).isZero();
        assertThat(run.out)
                .contains("Moves played: 5 of 5")
                .contains("Swaps kept: ")
                .contains("Matches: ")
                .contains("Power-ups spawned: ");
    }

    /**
     * Verifies that the same seed prints the same summary and the same final board.
     */
    @Test
    void testSameSeedSameOutput() {
        Run first = execute("simulate", "-s", "31", "-m", "15", "--show-board");
        Run second = execute("simulate", "-s", "31", "-m", "15", "--show-board");

        assertThat(first.out).isEqualTo(second.out).contains("Initial board:").contains("Final board:");
    }

    @Test
    void testBoardSizeOptions() {
        Run run = execute("simulate", "-s", "3", "-m", "1", "-W", "5", "-H", "4", "-b");

        assertThat(run.exitCode).isZero();
        String initial = run.out.substring(run.out.indexOf("Initial board:") + "Initial board:".length()).trim();
        List<String> rows = initial.lines().limit(4).toList();
        assertThat(rows).hasSize(4).allMatch(row -> row.length() == 5);
    }

    /**
     * Verifies that the trace file holds one JSON event per line.
     */
    @Test
    void testWritesTrace() throws IOException {
        Path trace = tempDir.resolve("trace.jsonl");

        Run run = execute("simulate", "-s", "9", "-m", "10", "--trace", trace.toString());

        assertThat(run.exitCode).isZero();
        List<String> lines = Files.readAllLines(trace, StandardCharsets.UTF_8);
        assertThat(lines).isNotEmpty();
        for (String line : lines) {
            JsonObject event = JsonParser.parseString(line).getAsJsonObject();
            assertThat(event.has("event")).isTrue();
        }
        assertThat(lines).anyMatch(line -> line.contains("\"stateChanged\""));
    }

    @Test
    void testMissingConfigFileFails() {
        Run run = execute("--config", tempDir.resolve("absent.conf").toString(), "simulate");

        assertThat(run.exitCode).isNotZero();
        assertThat(run.err).contains("was not found");
    }
}
