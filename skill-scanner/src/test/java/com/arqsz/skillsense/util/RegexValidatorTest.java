package com.arqsz.skillsense.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.regex.Pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.arqsz.skillsense.util.RegexValidator.RegexValidationException;

@DisplayName("RegexValidator")
class RegexValidatorTest {

    @ParameterizedTest(name = "Valid pattern: {0}")
    @ValueSource(strings = {
            ".*",
            "^test.*",
            "[a-z]+",
            "\\d{3}-\\d{4}",
            "(foo|bar)",
            "^https?://.*",
            "\\b(eval|exec)\\s*\\(",
            "169\\.254\\.169\\.254",
            "requirements.*\\.txt$",
            "a{2,5}"
    })
    @DisplayName("should accept valid regex patterns")
    void shouldAcceptValidPatterns(String pattern) {
        assertThat(RegexValidator.isValidRegex(pattern)).isTrue();
    }

    @ParameterizedTest(name = "Invalid pattern: {0}")
    @ValueSource(strings = {
            "[",
            "(",
            "*",
            "\\x{gggg}",
            "[z-a]",
            "(?<)",
            "**"
    })
    @DisplayName("should reject invalid regex patterns")
    void shouldRejectInvalidPatterns(String pattern) {
        assertThat(RegexValidator.isValidRegex(pattern)).isFalse();
    }

    @Test
    @DisplayName("should reject null and empty patterns")
    void shouldRejectNullAndEmptyPatterns() {
        assertThat(RegexValidator.isValidRegex(null)).isFalse();
        assertThat(RegexValidator.isValidRegex("")).isFalse();
    }

    @Test
    @DisplayName("should accept escaped special characters")
    void shouldAcceptEscapedSpecialCharacters() {
        assertThat(RegexValidator.isValidRegex("\\[\\]\\(\\)\\{\\}\\.\\*\\+\\?\\^\\$\\|\\\\")).isTrue();
    }

    @Nested
    @DisplayName("ReDoS heuristics")
    class ReDoSHeuristics {

        @Test
        @DisplayName("should reject nested quantifiers")
        void shouldRejectNestedQuantifiers() {
            assertThatThrownBy(() -> RegexValidator.compileSafe("(a+)+b", 0))
                    .isInstanceOf(RegexValidationException.class)
                    .hasMessageContaining("Nested quantifiers");
        }

        @Test
        @DisplayName("should reject quantified alternation with three branches")
        void shouldRejectQuantifiedAlternation() {
            assertThatThrownBy(() -> RegexValidator.compileSafe("(a|b|c)*", 0))
                    .isInstanceOf(RegexValidationException.class)
                    .hasMessageContaining("Alternation");
        }

        @Test
        @DisplayName("should reject excessive repetition bounds")
        void shouldRejectExcessiveRepetition() {
            assertThatThrownBy(() -> RegexValidator.compileSafe("a{1,500}", 0))
                    .isInstanceOf(RegexValidationException.class)
                    .hasMessageContaining("repetition too high");
        }

        @Test
        @DisplayName("should reject too many unbounded quantifiers")
        void shouldRejectTooManyQuantifiers() {
            assertThatThrownBy(() -> RegexValidator.compileSafe("a*b*c*d*e*f*g*h*i*j*k*", 0))
                    .isInstanceOf(RegexValidationException.class)
                    .hasMessageContaining("Too many quantifiers");
        }

        @Test
        @DisplayName("should reject overly long patterns")
        void shouldRejectOverlyLongPatterns() {
            assertThatThrownBy(() -> RegexValidator.compileSafe("a".repeat(501), 0))
                    .isInstanceOf(RegexValidationException.class)
                    .hasMessage("Pattern too long");
        }
    }

    @Test
    @DisplayName("should apply the requested flags")
    void shouldApplyRequestedFlags() throws Exception {
        Pattern pattern = RegexValidator.compileSafe("skill\\.md$", Pattern.CASE_INSENSITIVE);

        assertThat(pattern.matcher("docs/SKILL.md").find()).isTrue();
    }
}
