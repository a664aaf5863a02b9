package nl.nfi.probregex.cli;

import nl.nfi.probregex.regex.ModelFile;
import nl.nfi.probregex.regex.ProbRegex;
import nl.nfi.probregex.regex.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.probregex.common.Timers.time;
import static nl.nfi.probregex.common.logger.LoggerConfigurator.LOG_DIRECTORY_PROPERTY;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "prob_regex", description = "Sample strings from, or score strings against, a probabilistic regular expression")
public class ProbRegexCli implements Callable<Integer> {

    @Option(names = {"--expression"}, description = "The expression, e.g. \"concat(kleene('a', 0.3), 'b')\"")
    private String expressionText;

    @Option(names = {"--model"}, description = "INI model file holding the expression and its settings")
    private String modelPath;

    @Option(names = {"--output"}, description = "The file to write samples or scores to")
    private String outputPath = "-";

    @Option(names = {"--limit"}, description = "Number of strings to sample")
    private long limit = 10;

    @Option(names = {"--seed"}, description = "Seed for the random generator, overrides the model's seed")
    private Long seed;

    @Option(names = {"--max_unrolls"}, description = "Maximum number of repetition steps per sample")
    private Long maxUnrolls;

    @Option(names = {"--thread_count"}, description = "Use <count> threads for sampling")
    private int threadCount = 1;

    @Option(names = {"--validation"}, description = "Valid values: ${COMPLETION-CANDIDATES} (case insensitive), defaults to the model's setting or shallow")
    private Validation validation;

    @Option(names = {"--score"}, description = "Print the probability of the given string instead of sampling (repeatable)")
    private List<String> scoreTargets = new ArrayList<>();

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        if (logPath != null) {
            System.setProperty(LOG_DIRECTORY_PROPERTY, logPath);
        }

        if ((expressionText == null) == (modelPath == null)) {
            System.err.println("Exactly one of --expression and --model must be given");
            return ExitCode.USAGE;
        }

        try {
            final Logger log = LoggerFactory.getLogger(ProbRegexCli.class);

            ProbRegex probRegex;
            List<String> targets = scoreTargets;
            if (modelPath != null) {
                final ModelFile model = ModelFile.loadFrom(Paths.get(modelPath));
                probRegex = ProbRegex.fromModel(validation != null ? model.withValidation(validation) : model);
                if (targets.isEmpty()) {
                    targets = model.scoreTargets();
                }
            } else {
                probRegex = ProbRegex.parse(expressionText)
                    .validate(validation != null ? validation : Validation.SHALLOW);
            }
            if (seed != null) {
                probRegex = probRegex.seed(seed);
            }
            if (maxUnrolls != null) {
                probRegex = probRegex.maxUnrolls(maxUnrolls);
            }
            probRegex = probRegex.threadCount(threadCount);

            final Duration duration;
            if (outputPath.equals("-")) {
                duration = run(probRegex, targets, System.out);
            } else {
                try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                    duration = run(probRegex, targets, output);
                }
            }
            log.info("Finished in {} ms", duration.toMillis());
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(ProbRegexCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private Duration run(final ProbRegex probRegex, final List<String> targets, final PrintStream output) {
        final Duration duration = time(() -> {
            if (targets.isEmpty()) {
                probRegex.writeSamples(limit, output);
            } else {
                probRegex.writeProbabilities(targets, output);
            }
        });
        output.flush();
        return duration;
    }
}
