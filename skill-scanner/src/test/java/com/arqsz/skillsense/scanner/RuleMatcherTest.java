package com.arqsz.skillsense.scanner;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.arqsz.skillsense.model.Rule;
import com.arqsz.skillsense.model.RuleMatch;
import com.arqsz.skillsense.model.ScannedFile;

@DisplayName("RuleMatcher")
class RuleMatcherTest {

    private RuleMatcher pythonEvalMatcher;

    @BeforeEach
    void setUp() {
        Rule pythonEval = RuleCatalog.findById("SEC_PY_EVAL_001").orElseThrow();
        pythonEvalMatcher = new RuleMatcher(List.of(pythonEval));
    }

    @Nested
    @DisplayName("Evidence window")
    class EvidenceWindow {

        @Test
        @DisplayName("should take 50 characters before and 120 after the match")
        void shouldTakeContextAroundMatch() {
            String text = "a = 1\n".repeat(20) + "eval(data)" + "\nb = 2".repeat(50);

            List<RuleMatch> matches = pythonEvalMatcher.matchFile(new ScannedFile("tool.py", text));

            assertThat(matches).hasSize(1);
            RuleMatch match = matches.get(0);
            assertThat(match.start()).isEqualTo(120);
            assertThat(match.end()).isEqualTo(125);
            assertThat(match.window()).isEqualTo(text.substring(70, 245));
        }

        @Test
        @DisplayName("should clamp the window at the start and end of the text")
        void shouldClampWindow() {
            String text = "eval(x)";

            RuleMatch match = pythonEvalMatcher.matchFile(new ScannedFile("tool.py", text)).get(0);

            assertThat(match.window()).isEqualTo(text);
        }
    }

    @Nested
    @DisplayName("Line numbers")
    class LineNumbers {

        @Test
        @DisplayName("should report the 1-indexed line of the match start")
        void shouldReportLineOfMatch() {
            String text = "import os\n\nresult = eval(expr)\n";

            RuleMatch match = pythonEvalMatcher.matchFile(new ScannedFile("tool.py", text)).get(0);

            assertThat(match.lineNumber()).isEqualTo(3);
        }

        @Test
        @DisplayName("should report every non-overlapping occurrence in discovery order")
        void shouldReportEveryOccurrence() {
            String text = "eval(a)\nexec(b)\neval(c)";

            List<RuleMatch> matches = pythonEvalMatcher.matchFile(new ScannedFile("tool.py", text));

            assertThat(matches).extracting(RuleMatch::lineNumber).containsExactly(1, 2, 3);
        }
    }

    @Test
    @DisplayName("should produce no matches for empty text")
    void shouldSkipEmptyText() {
        assertThat(new RuleMatcher().matchFile(new ScannedFile("tool.py", ""))).isEmpty();
    }

    @Test
    @DisplayName("should skip rules that do not apply to the file")
    void shouldSkipInapplicableRules() {
        assertThat(pythonEvalMatcher.matchFile(new ScannedFile("notes.txt", "eval(x)"))).isEmpty();
    }

    @Test
    @DisplayName("should order matches by file, then by catalog order")
    void shouldOrderByFileThenRule() {
        List<ScannedFile> files = List.of(
                new ScannedFile("b.py", "os.system(cmd)\neval(x)"),
                new ScannedFile("a.sh", "rm -rf /tmp/x"));

        List<RuleMatch> matches = new RuleMatcher().match(files);

        assertThat(matches).extracting(match -> match.filePath() + ":" + match.rule().id())
                .containsExactly(
                        "b.py:SEC_PY_EVAL_001",
                        "b.py:SEC_PY_OS_SYSTEM_001",
                        "a.sh:SEC_FS_RM_RF_001");
    }
}
