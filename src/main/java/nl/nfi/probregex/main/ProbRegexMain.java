package nl.nfi.probregex.main;

import nl.nfi.probregex.cli.ProbRegexCli;
import picocli.CommandLine;

public final class ProbRegexMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new ProbRegexCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
