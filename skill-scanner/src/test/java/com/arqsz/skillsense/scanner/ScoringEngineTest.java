package com.arqsz.skillsense.scanner;

import static com.arqsz.skillsense.testutil.FindingBuilder.aFinding;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.Severity;

@DisplayName("ScoringEngine")
class ScoringEngineTest {

    private ScoringEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ScoringEngine();
    }

    private static List<Finding> findings(Severity severity, int count) {
        return new ArrayList<>(Collections.nCopies(count, aFinding().withSeverity(severity).build()));
    }

    @Nested
    @DisplayName("risk score")
    class RiskScore {

        @ParameterizedTest(name = "{0} weighs {1}")
        @CsvSource({"CRITICAL, 100", "HIGH, 25", "MEDIUM, 5", "LOW, 1"})
        @DisplayName("should weigh each severity")
        void shouldWeighSeverity(Severity severity, int weight) {
            assertThat(engine.riskScore(findings(severity, 1))).isEqualTo(weight);
        }

        @Test
        @DisplayName("should be zero without findings")
        void shouldBeZeroWithoutFindings() {
            assertThat(engine.riskScore(List.of())).isZero();
        }

        @Test
        @DisplayName("should sum mixed severities")
        void shouldSumMixedSeverities() {
            List<Finding> mixed = new ArrayList<>();
            mixed.addAll(findings(Severity.HIGH, 2));
            mixed.addAll(findings(Severity.MEDIUM, 3));
            mixed.addAll(findings(Severity.LOW, 4));

            assertThat(engine.riskScore(mixed)).isEqualTo(69);
        }

        @Test
        @DisplayName("should cap at 200")
        void shouldCapScore() {
            assertThat(engine.riskScore(findings(Severity.CRITICAL, 5))).isEqualTo(200);
            assertThat(engine.riskScore(findings(Severity.LOW, 1000))).isEqualTo(200);
        }

        @Test
        @DisplayName("should never decrease when a HIGH or CRITICAL finding is added")
        void shouldBeMonotonic() {
            List<Finding> current = findings(Severity.MEDIUM, 3);
            int previous = engine.riskScore(current);

            for (int i = 0; i < 12; i++) {
                current.add(aFinding().withSeverity(i % 2 == 0 ? Severity.HIGH : Severity.CRITICAL).build());
                int score = engine.riskScore(current);
                assertThat(score).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
            assertThat(previous).isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("trust badge")
    class Badge {

        @ParameterizedTest(name = "{0} is {1}")
        @CsvSource({
                "0, Verified Safe",
                "4, Verified Safe",
                "5, Generally Safe",
                "19, Generally Safe",
                "20, Review Recommended",
                "49, Review Recommended",
                "50, Use With Caution",
                "99, Use With Caution",
                "100, Not Recommended",
                "200, Not Recommended"
        })
        @DisplayName("should map boundaries exactly")
        void shouldMapBoundaries(int score, String label) {
            assertThat(engine.trustBadge(score)).isEqualTo(label);
        }

        @Test
        @DisplayName("should resolve the enum for a score")
        void shouldResolveEnum() {
            assertThat(TrustBadge.forScore(4)).isEqualTo(TrustBadge.VERIFIED_SAFE);
            assertThat(TrustBadge.forScore(5)).isEqualTo(TrustBadge.GENERALLY_SAFE);
            assertThat(TrustBadge.forScore(150)).isEqualTo(TrustBadge.NOT_RECOMMENDED);
        }
    }

    @ParameterizedTest(name = "risk {0} gives overall {1}")
    @CsvSource({"0, 100.0", "26, 74.0", "100, 0.0", "200, 0.0"})
    @DisplayName("should derive the overall score from the risk score")
    void shouldDeriveOverallScore(int risk, double overall) {
        assertThat(engine.overallScore(risk)).isEqualTo(overall);
    }
}
