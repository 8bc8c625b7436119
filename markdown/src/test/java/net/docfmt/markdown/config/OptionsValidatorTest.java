package net.docfmt.markdown.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OptionsValidatorTest {
    @ParameterizedTest
    @ValueSource(strings = {"never", "NEVER", ":never", "Never"})
    void testEnumSpellings(String spelling) {
        var validated = OptionsValidator.validate(Map.of("text_wrap", spelling));
        assertThat(validated.failures()).isEmpty();
        assertEquals(TextWrap.NEVER, validated.options().textWrap());
    }

    @Test
    void testEnumConstantsAreAccepted() {
        var validated = OptionsValidator.validate(Map.of(
                "emphasis_kind", EmphasisKind.UNDERSCORES,
                "strong_kind", "underscores",
                "new_line_kind", "crlf",
                "unordered_list_kind", ":asterisks"));

        assertThat(validated.failures()).isEmpty();
        assertEquals(new FormatterOptions(80, TextWrap.ALWAYS, EmphasisKind.UNDERSCORES, EmphasisKind.UNDERSCORES,
                NewLineKind.CRLF, UnorderedListKind.ASTERISKS), validated.options());
    }

    @Test
    void testInvalidTextWrapFallsBackToDefault() {
        var validated = OptionsValidator.validate(Map.of("text_wrap", "sometimes"));

        assertEquals(TextWrap.ALWAYS, validated.options().textWrap());
        assertThat(validated.failures()).singleElement().satisfies(failure -> {
            assertEquals("text_wrap", failure.field());
            assertEquals("sometimes", failure.value());
            assertEquals(":always, :never, :maintain", failure.expected());
            assertEquals("Invalid text wrap", failure.message());
        });
    }

    @Test
    void testNonStringEnumValue() {
        var validation = OptionsValidator.validateOption("emphasis_kind", 3);
        assertThat(validation).isInstanceOfSatisfying(Validation.Invalid.class,
                invalid -> assertEquals("Emphasis kind must be a name", invalid.failure().message()));
    }

    @Test
    void testLineWidthAcceptsIntegralDoubles() {
        var validated = OptionsValidator.validate(Map.of("line_width", 100.0));
        assertThat(validated.failures()).isEmpty();
        assertEquals(100, validated.options().lineWidth());
    }

    @Test
    void testValidValueIsNormalized() {
        var validation = OptionsValidator.validateOption("line_width", 100.0);
        assertThat(validation).isInstanceOfSatisfying(Validation.Valid.class, valid -> {
            assertEquals(FormatterOption.LINE_WIDTH, valid.option());
            assertEquals(100, valid.value());
        });
    }

    @Test
    void testLineWidthRejectsFractions() {
        var validation = OptionsValidator.validateOption("line_width", 80.5);
        assertThat(validation).isInstanceOfSatisfying(Validation.Invalid.class,
                invalid -> assertEquals("Line width must be an integer", invalid.failure().message()));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 1001})
    void testLineWidthOutOfRange(int width) {
        var validated = OptionsValidator.validate(Map.of("line_width", width));
        assertEquals(80, validated.options().lineWidth());
        assertThat(validated.failures()).singleElement()
                .extracting(ValidationFailure::message)
                .isEqualTo("Line width must be between 1 and 1000");
    }

    @Test
    void testLineWidthRejectsStrings() {
        assertThat(OptionsValidator.validateOption("line_width", "80")).isInstanceOf(Validation.Invalid.class);
    }

    @Test
    void testUnknownKeysAreIgnored() {
        assertThat(OptionsValidator.validateOption("format_module_attributes", true)).isInstanceOfSatisfying(Validation.Ignored.class,
                ignored -> assertEquals("format_module_attributes", ignored.key()));
        assertThat(OptionsValidator.validate(Map.of("plugins", "x")).hasFailures()).isFalse();
    }

    @Test
    void testColonPrefixedKeys() {
        var validated = OptionsValidator.validate(Map.of(":line_width", 40));
        assertEquals(40, validated.options().lineWidth());
    }

    @Test
    void testEveryInvalidValueIsReported() {
        var input = new LinkedHashMap<String, Object>();
        input.put("line_width", "wide");
        input.put("text_wrap", 1);
        input.put("unordered_list_kind", "plus");

        var validated = OptionsValidator.validate(input);
        assertEquals(FormatterOptions.DEFAULT, validated.options());
        assertThat(validated.failures()).extracting(ValidationFailure::field)
                .containsExactly("line_width", "text_wrap", "unordered_list_kind");
    }

    @Test
    void testFailureDescription() {
        var failure = new ValidationFailure("text_wrap", "sometimes", ":always, :never, :maintain", "Invalid text wrap");
        assertEquals("Invalid text wrap (text_wrap): expected :always, :never, :maintain, got: \"sometimes\"", failure.describe());
    }

    @Test
    void testOptionsRecordRejectsInvalidWidth() {
        assertThatThrownBy(() -> FormatterOptions.DEFAULT.withLineWidth(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
