package nl.nfi.probregex.regex.generate;

import java.util.Random;

// returns the given draws in order, fails when sampling needs more of them
final class ScriptedRandom extends Random {

    private final double[] draws;
    private int index;

    ScriptedRandom(final double... draws) {
        this.draws = draws;
    }

    @Override
    public double nextDouble() {
        if (index >= draws.length) {
            throw new IllegalStateException("Script exhausted after %d draws".formatted(draws.length));
        }
        return draws[index++];
    }

    int consumed() {
        return index;
    }
}
