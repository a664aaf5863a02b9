package nl.nfi.probregex.regex;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static nl.nfi.probregex.regex.Expression.character;
import static nl.nfi.probregex.regex.Expression.choice;
import static nl.nfi.probregex.regex.Expression.concat;
import static nl.nfi.probregex.regex.Expression.kleene;
import static nl.nfi.probregex.regex.Expression.option;
import static nl.nfi.probregex.regex.Expression.plus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidityTest {

    @Nested
    class Shallow {

        @Test
        void acceptsKleeneOverNonEmptyBody() {
            final Kleene expression = kleene(character('a'), 0.5);

            assertThat(Validity.checkValid(expression)).isSameAs(expression);
        }

        @Test
        void acceptsKleeneOverPlus() {
            final Kleene expression = kleene(plus(character('a'), 0.3), 0.5);

            assertThat(Validity.checkValid(expression)).isSameAs(expression);
        }

        @Test
        void rejectsKleeneOverOption() {
            final Kleene expression = kleene(option(character('a'), 0.3), 0.5);

            assertThatThrownBy(() -> Validity.checkValid(expression))
                .isInstanceOfSatisfying(InvalidExpressionException.class, e -> assertThat(e.expression()).isSameAs(expression))
                .hasMessageContaining("empty string");
        }

        @Test
        void rejectsKleeneOverKleene() {
            assertThatThrownBy(() -> Validity.checkValid(kleene(kleene(character('a'), 0.5), 0.5)))
                .isInstanceOf(InvalidExpressionException.class);
        }

        @Test
        void rejectsKleeneOverChoiceWithEmptyBranch() {
            assertThatThrownBy(() -> Validity.checkValid(kleene(choice(character('a'), kleene(character('b'), 0.5), 0.9), 0.5)))
                .isInstanceOf(InvalidExpressionException.class);
        }

        @Test
        void doesNotInspectNestedKleene() {
            final Expression expression = concat(kleene(option(character('a'), 0.3), 0.5), character('b'));

            assertThat(Validity.checkValid(expression)).isSameAs(expression);
        }

        @Test
        void returnsOtherVariantsUnchanged() {
            final Expression expression = option(character('a'), 0.3);

            assertThat(Validity.checkValid(expression)).isSameAs(expression);
        }
    }

    @Nested
    class Recursive {

        @Test
        void rejectsNestedKleeneOverOption() {
            final Expression expression = concat(character('b'), choice(character('c'), kleene(option(character('a'), 0.3), 0.5), 0.5));

            assertThatThrownBy(() -> Validity.checkValidRecursively(expression))
                .isInstanceOf(InvalidExpressionException.class);
        }

        @Test
        void acceptsWellFormedTree() {
            final Expression expression = plus(concat(kleene(character('a'), 0.3), option(character('b'), 0.5), character('c')), 0.4);

            assertThat(Validity.checkValidRecursively(expression)).isSameAs(expression);
        }
    }

    @Test
    void validationModes() {
        final Expression nested = concat(kleene(option(character('a'), 0.3), 0.5), character('b'));

        assertThatCode(() -> Validation.NONE.check(kleene(option(character('a'), 0.3), 0.5))).doesNotThrowAnyException();
        assertThatCode(() -> Validation.SHALLOW.check(nested)).doesNotThrowAnyException();
        assertThatThrownBy(() -> Validation.RECURSIVE.check(nested)).isInstanceOf(InvalidExpressionException.class);
    }
}
