package nl.nfi.probregex.regex;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProbabilityTest {

    @ParameterizedTest
    @ValueSource(doubles = {Double.MIN_VALUE, 0.001, 0.3, 0.5, 0.999, 0.9999999999999999})
    void acceptsValuesInsideOpenInterval(final double value) {
        final Probability probability = Probability.of(value);

        assertThat(probability.value()).isEqualTo(value);
        assertThat(probability.value()).isStrictlyBetween(0.0, 1.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.0, 1.0, -0.5, 1.5, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    void rejectsValuesOutsideOpenInterval(final double value) {
        assertThatThrownBy(() -> Probability.of(value))
            .isInstanceOf(InvalidProbabilityException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid value for probability");
    }

    @Test
    void constructorEnforcesSameRangeAsFactory() {
        assertThatThrownBy(() -> new Probability(1.0)).isInstanceOf(InvalidProbabilityException.class);
    }

    @Test
    void exceptionCarriesRejectedValue() {
        assertThatThrownBy(() -> Probability.of(2.5))
            .isInstanceOfSatisfying(InvalidProbabilityException.class, e -> assertThat(e.value()).isEqualTo(2.5));
    }

    @Test
    void complement() {
        assertThat(Probability.of(0.3).complement()).isCloseTo(0.7, within(1e-15));
    }
}
