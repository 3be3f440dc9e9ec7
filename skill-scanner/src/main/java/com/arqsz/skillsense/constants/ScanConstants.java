package com.arqsz.skillsense.constants;

import java.util.Map;

import com.arqsz.skillsense.model.Severity;

/**
 * Constants for rule matching, finding identity and scoring
 */
public final class ScanConstants {

    public static final Map<Severity, Integer> SEVERITY_WEIGHTS = Map.of(
            Severity.CRITICAL, 100,
            Severity.HIGH, 25,
            Severity.MEDIUM, 5,
            Severity.LOW, 1);

    public static final int MAX_RISK_SCORE = 200;

    public static final int EVIDENCE_CONTEXT_BEFORE = 50;
    public static final int EVIDENCE_CONTEXT_AFTER = 120;
    public static final int EVIDENCE_MAX_LENGTH = 240;

    public static final String ID_HASH_ALGORITHM = "SHA-1";
    public static final int ID_HASH_OUTPUT_BYTES = 4;
    public static final String ID_SEPARATOR = ":";
    public static final String ID_PREFIX_SEPARATOR = "_";
    public static final String ID_NO_LINE = "-";

    public static final String RULE_UNPINNED_NPM = "SEC_DEP_UNPINNED_NPM_001";
    public static final String TITLE_UNPINNED_NPM = "Unpinned NPM dependency version detected.";
    public static final String RULE_UNPINNED_PY = "SEC_DEP_UNPINNED_PY_001";
    public static final String TITLE_UNPINNED_PY = "Unpinned Python dependency detected.";

    public static final String PACKAGE_MANIFEST_SUFFIX = "package.json";
    public static final String REQUIREMENTS_MARKER = "requirements";
    public static final String REQUIREMENTS_SUFFIX = ".txt";

    public static final String[] NPM_DEPENDENCY_BLOCKS = {
            "dependencies",
            "devDependencies",
            "optionalDependencies"
    };

    public static final String VERSION_ANY = "*";
    public static final String VERSION_LATEST = "latest";
    public static final String VERSION_CARET = "^";

    public static final String REQUIREMENT_PINNED = "==";
    public static final String REQUIREMENT_COMMENT = "#";
    public static final String REQUIREMENT_EDITABLE = "-e ";
    public static final String REQUIREMENT_VCS = "git+";

    private ScanConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
