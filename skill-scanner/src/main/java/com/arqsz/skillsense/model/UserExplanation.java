package com.arqsz.skillsense.model;

import java.util.List;

public record UserExplanation(
        String headline,
        String summary,
        List<String> topConcerns,
        List<String> recommendedActions,
        List<SafetyCheck> safetyChecks,
        List<String> safetyStatements) {
}
