package com.arqsz.skillsense.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import com.arqsz.skillsense.constants.ScanConstants;
import com.arqsz.skillsense.model.Rule;
import com.arqsz.skillsense.model.RuleMatch;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.util.TextUtils;

/**
 * Applies catalog rules to scanned files
 */
public class RuleMatcher {

    private final List<Rule> rules;

    public RuleMatcher() {
        this(RuleCatalog.rules());
    }

    public RuleMatcher(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Matches every applicable rule against every file
     * 
     * @param files Files in submission order
     * @return Matches ordered by file, then rule, then position
     */
    public List<RuleMatch> match(List<ScannedFile> files) {
        List<RuleMatch> matches = new ArrayList<>();
        for (ScannedFile file : files) {
            matches.addAll(matchFile(file));
        }
        return matches;
    }

    /**
     * Finds all non-overlapping occurrences of each applicable rule in one file
     * 
     * @param file The file to scan
     * @return Matches in catalog order, then discovery order
     */
    public List<RuleMatch> matchFile(ScannedFile file) {
        List<RuleMatch> matches = new ArrayList<>();
        String text = file.text();
        if (text.isEmpty()) {
            return matches;
        }

        for (Rule rule : rules) {
            if (!rule.isApplicableTo(file.path())) {
                continue;
            }
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                int windowStart = Math.max(0, matcher.start() - ScanConstants.EVIDENCE_CONTEXT_BEFORE);
                int windowEnd = Math.min(text.length(), matcher.end() + ScanConstants.EVIDENCE_CONTEXT_AFTER);
                matches.add(new RuleMatch(
                        rule,
                        file.path(),
                        matcher.start(),
                        matcher.end(),
                        text.substring(windowStart, windowEnd),
                        TextUtils.lineNumber(text, matcher.start())));
            }
        }
        return matches;
    }
}
