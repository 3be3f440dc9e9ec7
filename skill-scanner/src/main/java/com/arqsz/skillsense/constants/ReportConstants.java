package com.arqsz.skillsense.constants;

import java.util.List;

/**
 * User-facing strings and limits of the final analysis record
 */
public final class ReportConstants {

    public static final String SUMMARY_NO_FINDINGS = "No risky execution or exfiltration patterns were detected "
            + "in scanned text artifacts.";
    public static final String SUMMARY_LOW_MEDIUM_ONLY = "Only low-to-medium risk patterns were detected. "
            + "Review findings, but no immediate high-risk behavior was found in this scan.";
    public static final String SUMMARY_HIGH_RISK_FORMAT = "%d high-risk pattern(s) detected. Review command "
            + "execution, file deletion, or network-related findings before installing.";

    public static final List<String> DEFAULT_RECOMMENDED_ACTIONS = List.of(
            "Inspect shell and subprocess calls for user-controlled inputs.",
            "Review network requests and sensitive file operations before use.",
            "Avoid installing skills that require broad system access unless necessary.");

    public static final int TOP_CONCERNS_MAX = 3;
    public static final int RECOMMENDED_ACTIONS_MAX = 4;
    public static final int VALIDATED_FINDINGS_FOR_ACTIONS = 4;

    public static final String SAFE_SHELL_EXEC = "No shell execution behavior detected.";
    public static final String RISK_SHELL_EXEC = "Shell execution behavior detected; review commands and input handling.";
    public static final String SAFE_DB_ACCESS = "No database access patterns detected.";
    public static final String RISK_DB_ACCESS = "Database access patterns detected; verify query safety and permissions.";
    public static final String SAFE_FILE_DELETE = "No destructive file deletion behavior detected.";
    public static final String RISK_FILE_DELETE = "Potential file deletion behavior detected; review scope and safeguards.";
    public static final String SAFE_NETWORK = "No outbound network behavior detected.";
    public static final String RISK_NETWORK = "Outbound network behavior detected; verify destination allowlist.";
    public static final String SAFE_READS_ENV = "No environment variable reads detected.";
    public static final String RISK_READS_ENV = "Environment variable reads detected; ensure secrets are not exposed.";

    public static final int ERROR_MESSAGE_MAX_LENGTH = 1000;

    private ReportConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
