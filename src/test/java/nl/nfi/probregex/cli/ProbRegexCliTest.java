package nl.nfi.probregex.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class ProbRegexCliTest {

    @TempDir
    Path tempWorkDir;

    @Test
    void samplesExpressionToFile() throws IOException {
        final Path output = tempWorkDir.resolve("samples.txt");

        final int exitCode = execute("--expression", "concat(plus('a', 0.5), 'b')", "--limit", "25", "--seed", "1", "--output", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        final List<String> lines = Files.readAllLines(output, UTF_8);
        assertThat(lines).hasSize(25).allMatch(line -> line.matches("a+b"));
    }

    @Test
    void samplingWithThreadsWritesEverySample() throws IOException {
        final Path output = tempWorkDir.resolve("samples.txt");

        final int exitCode = execute("--expression", "choice('x', 'y', 0.5)", "--limit", "40", "--thread_count", "4", "--output", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(Files.readAllLines(output, UTF_8)).hasSize(40).allMatch(line -> line.equals("x") || line.equals("y"));
    }

    @Test
    void scoresGivenStrings() throws IOException {
        final Path output = tempWorkDir.resolve("scores.txt");

        final int exitCode = execute("--expression", "kleene('a', 0.5)", "--score", "aa", "--score", "b", "--output", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(Files.readAllLines(output, UTF_8)).containsExactly("aa\t0.125", "b\t0.0");
    }

    @Test
    void scoresStringsFromModel() throws IOException {
        final Path model = Files.writeString(tempWorkDir.resolve("model.ini"), """
            [EXPRESSION]
            definition = option('a', 0.25)
            [SCORE]
            strings = ["a", ""]
            """);
        final Path output = tempWorkDir.resolve("scores.txt");

        final int exitCode = execute("--model", model.toString(), "--output", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(Files.readAllLines(output, UTF_8)).containsExactly("a\t0.25", "\t0.75");
    }

    @Test
    void seedFromModelMakesSamplingReproducible() throws IOException {
        final Path model = Files.writeString(tempWorkDir.resolve("model.ini"), """
            [EXPRESSION]
            definition = kleene(choice('0', '1', 0.5), 0.1)
            [SAMPLER]
            seed = 99
            """);
        final Path first = tempWorkDir.resolve("first.txt");
        final Path second = tempWorkDir.resolve("second.txt");

        assertThat(execute("--model", model.toString(), "--output", first.toString())).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(execute("--model", model.toString(), "--output", second.toString())).isEqualTo(CommandLine.ExitCode.OK);

        assertThat(Files.readAllLines(first, UTF_8)).hasSize(10).isEqualTo(Files.readAllLines(second, UTF_8));
    }

    @Test
    void requiresExactlyOneSource() {
        assertThat(execute()).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(execute("--expression", "'a'", "--model", "model.ini")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void invalidExpressionIsFatal() {
        assertThat(execute("--expression", "kleene(option('a', 0.5), 0.5)", "--output", tempWorkDir.resolve("out.txt").toString()))
            .isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(execute("--expression", "kleene('a', 1.5)", "--output", tempWorkDir.resolve("out.txt").toString()))
            .isEqualTo(CommandLine.ExitCode.SOFTWARE);
    }

    @Test
    void validationCanBeDisabled() {
        assertThat(execute("--expression", "kleene(plus(option('a', 0.5), 0.5), 0.5)", "--validation", "NONE",
            "--limit", "3", "--seed", "5", "--output", tempWorkDir.resolve("out.txt").toString()))
            .isEqualTo(CommandLine.ExitCode.OK);
    }

    private static int execute(final String... args) {
        return new CommandLine(new ProbRegexCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
    }
}
