package nl.nfi.probregex.regex;

import nl.nfi.probregex.common.ini.IniConfig;
import nl.nfi.probregex.common.ini.IniSection;
import nl.nfi.probregex.regex.notation.ExpressionParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

// an expression together with its sampling settings, e.g.:
//      [EXPRESSION]
//      definition = kleene(choice('a', 'b', 0.4), 0.3)
//      validation = recursive
//      [SAMPLER]
//      seed = 42
//      max_unrolls = 10000
//      [SCORE]
//      strings = ["ab", "aab"]
public record ModelFile(Expression expression, Validation validation, OptionalLong seed, OptionalLong maxUnrolls, List<String> scoreTargets) {

    public static ModelFile loadFrom(final Path path) throws IOException {
        final IniConfig iniConfig = IniConfig.loadFrom(path);

        final IniSection expressionSection = iniConfig.getSection("EXPRESSION");
        final Expression expression = ExpressionParser.parse(expressionSection.getString("definition"));
        final Validation validation = expressionSection.hasKey("validation")
            ? parseValidation(expressionSection.getString("validation"))
            : Validation.SHALLOW;

        OptionalLong seed = OptionalLong.empty();
        OptionalLong maxUnrolls = OptionalLong.empty();
        if (iniConfig.hasSection("SAMPLER")) {
            final IniSection sampler = iniConfig.getSection("SAMPLER");
            if (sampler.hasKey("seed")) {
                seed = OptionalLong.of(sampler.getLong("seed"));
            }
            if (sampler.hasKey("max_unrolls")) {
                maxUnrolls = OptionalLong.of(sampler.getLong("max_unrolls"));
            }
        }

        final List<String> scoreTargets = iniConfig.hasKey("SCORE", "strings")
            ? iniConfig.getStringList("SCORE", "strings")
            : List.of();

        return new ModelFile(expression, validation, seed, maxUnrolls, scoreTargets);
    }

    public ModelFile withValidation(final Validation validation) {
        return new ModelFile(expression, validation, seed, maxUnrolls, scoreTargets);
    }

    private static Validation parseValidation(final String value) {
        try {
            return Validation.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown validation mode '%s', expected one of none, shallow, recursive".formatted(value), e);
        }
    }
}
