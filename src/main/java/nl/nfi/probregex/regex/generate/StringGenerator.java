package nl.nfi.probregex.regex.generate;

import java.io.PrintStream;
import java.util.List;

public interface StringGenerator {

    List<String> sampleMany(final int count);

    void writeSamples(final long limit, final PrintStream output);
}
