package com.arqsz.skillsense.scanner;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.arqsz.skillsense.model.Category;
import com.arqsz.skillsense.model.Confidence;
import com.arqsz.skillsense.model.Rule;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.util.RegexValidator;
import com.arqsz.skillsense.util.RegexValidator.RegexValidationException;

/**
 * Built-in detection rules. The list is evaluated in declaration order, which
 * fixes the order of findings within a file.
 * <p>
 * Rule ids, severities and categories are relied on by persisted results and the UI.
 */
public final class RuleCatalog {

    private static final List<String> PYTHON = List.of(".py");
    private static final List<String> PYTHON_AND_SHELL = List.of(".py", ".sh", ".bash", ".zsh");
    private static final List<String> JAVASCRIPT = List.of(".js", ".ts", ".mjs", ".cjs");
    private static final List<String> SHELL_AND_DOCS = List.of(".sh", ".bash", ".zsh", ".md", ".txt", ".yaml", ".yml");

    private static final String PACKAGE_JSON = "package\\.json$";
    private static final String REQUIREMENTS_TXT = "requirements.*\\.txt$";
    private static final String SKILL_MD = "SKILL\\.md$";

    private static final List<Rule> RULES = List.of(
            rule("SEC_PY_EVAL_001", Category.EXEC, Severity.CRITICAL,
                    "Python dynamic code execution detected (eval/exec).", Confidence.HIGH,
                    "\\b(eval|exec)\\s*\\(", PYTHON, null),
            rule("SEC_PY_SHELL_TRUE_001", Category.EXEC, Severity.HIGH,
                    "subprocess call with shell=True detected.", Confidence.HIGH,
                    "subprocess\\.(run|Popen|call|check_output|check_call)\\s*\\([^)]*shell\\s*=\\s*True",
                    PYTHON, null),
            rule("SEC_PY_OS_SYSTEM_001", Category.EXEC, Severity.HIGH,
                    "Shell execution via os.system/popen detected.", Confidence.HIGH,
                    "\\b(os\\.system|popen)\\s*\\(", PYTHON_AND_SHELL, null),
            rule("SEC_JS_EVAL_001", Category.EXEC, Severity.CRITICAL,
                    "JavaScript dynamic code execution detected (eval/new Function).", Confidence.HIGH,
                    "\\b(eval\\s*\\(|new\\s+Function\\s*\\()", JAVASCRIPT, null),
            rule("SEC_JS_CHILD_PROCESS_001", Category.EXEC, Severity.HIGH,
                    "child_process command execution detected.", Confidence.HIGH,
                    "child_process\\.(exec|spawn)\\s*\\(", JAVASCRIPT, null),
            rule("SEC_SH_PIPE_EXEC_001", Category.EXEC, Severity.CRITICAL,
                    "Remote script piping into shell detected (curl|sh or wget|bash).", Confidence.HIGH,
                    "(curl\\s+[^|]+?\\|\\s*(sh|bash))|(wget\\s+[^|]+?\\|\\s*(sh|bash))", SHELL_AND_DOCS, null),
            rule("SEC_FS_RM_RF_001", Category.FILESYSTEM, Severity.CRITICAL,
                    "Destructive recursive deletion detected (rm -rf / rmtree).", Confidence.HIGH,
                    "(rm\\s+-rf\\b|shutil\\.rmtree\\s*\\()", null, null),
            rule("SEC_FS_SENSITIVE_WRITE_001", Category.FILESYSTEM, Severity.HIGH,
                    "Write or modification of sensitive system path detected.", Confidence.MEDIUM,
                    "(~/\\.ssh|/etc/|/usr/|/var/)", null, null),
            rule("SEC_FS_PATH_TRAVERSAL_001", Category.FILESYSTEM, Severity.MEDIUM,
                    "Potential path traversal pattern with user-controlled path.", Confidence.MEDIUM,
                    "\\.\\./.*(user|input|param|request|query)", null, null),
            rule("SEC_NET_USER_URL_001", Category.NETWORK, Severity.MEDIUM,
                    "Potential SSRF: outbound request built from user-controlled URL.", Confidence.MEDIUM,
                    "(requests\\.(get|post|put|delete)\\s*\\(\\s*(user_?url|url_from_user|input_url|request\\.)"
                            + "|fetch\\s*\\(\\s*(user_?url|urlFromUser|inputUrl|req\\.))",
                    null, null),
            rule("SEC_NET_RAW_SOCKET_001", Category.NETWORK, Severity.HIGH,
                    "Raw socket usage detected.", Confidence.MEDIUM,
                    "(socket\\.socket\\s*\\(|new\\s+Socket\\s*\\()", null, null),
            rule("SEC_NET_METADATA_001", Category.NETWORK, Severity.HIGH,
                    "Cloud metadata endpoint access detected.", Confidence.HIGH,
                    "169\\.254\\.169\\.254", null, null),
            rule("SEC_SECRET_ENV_EXFIL_001", Category.SECRETS, Severity.HIGH,
                    "Environment secret read and outbound request pattern detected.", Confidence.MEDIUM,
                    "((os\\.environ|getenv|process\\.env).*(requests\\.|fetch\\s*\\())"
                            + "|((requests\\.|fetch\\s*\\().*(os\\.environ|getenv|process\\.env))",
                    null, null),
            rule("SEC_SECRET_TOKEN_LOG_001", Category.SECRETS, Severity.MEDIUM,
                    "Potential secret logging or Authorization header exposure.", Confidence.MEDIUM,
                    "(Authorization|api[_-]?key|token).*(print|console\\.log)"
                            + "|(print|console\\.log).*(Authorization|api[_-]?key|token)",
                    null, null),
            rule("SEC_DEP_POSTINSTALL_001", Category.DEPS, Severity.HIGH,
                    "NPM postinstall script detected.", Confidence.HIGH,
                    "\"postinstall\"\\s*:", null, PACKAGE_JSON),
            rule("SEC_DEP_NPM_GIT_HTTP_001", Category.DEPS, Severity.MEDIUM,
                    "Git or HTTP dependency source detected in package.json.", Confidence.MEDIUM,
                    "(git\\+https?://|https?://.*\\.tgz|github:)", null, PACKAGE_JSON),
            rule("SEC_DEP_PY_GIT_URL_001", Category.DEPS, Severity.LOW,
                    "requirements.txt contains git-based dependency.", Confidence.MEDIUM,
                    "git\\+https?://", null, REQUIREMENTS_TXT),
            rule("SEC_SKILL_PROMPT_INJ_001", Category.PROMPT_INJECTION, Severity.HIGH,
                    "Prompt injection style unsafe instruction in SKILL.md.", Confidence.MEDIUM,
                    "(ignore\\s+previous|exfiltrate|send\\s+secrets|disable\\s+safeguards)", null, SKILL_MD));

    static {
        Set<String> ids = new HashSet<>();
        for (Rule rule : RULES) {
            if (!ids.add(rule.id())) {
                throw new RuleCatalogException("Duplicate rule id: " + rule.id());
            }
        }
    }

    /**
     * Gets all rules in evaluation order
     * 
     * @return Immutable rule list
     */
    public static List<Rule> rules() {
        return RULES;
    }

    /**
     * Finds a rule by its id
     * 
     * @param id The rule id
     * @return The rule, or empty if no rule has that id
     */
    public static Optional<Rule> findById(String id) {
        return RULES.stream().filter(rule -> rule.id().equals(id)).findFirst();
    }

    private static Rule rule(
            String id,
            Category category,
            Severity severity,
            String title,
            Confidence confidence,
            String regex,
            List<String> fileExtensions,
            String fileNameRegex) {
        return new Rule(
                id,
                category,
                severity,
                title,
                confidence,
                compile(id, regex),
                fileExtensions,
                fileNameRegex == null ? null : compile(id, fileNameRegex));
    }

    /**
     * Compiles a catalog pattern, case-insensitive
     * 
     * @throws RuleCatalogException if the pattern is invalid or unsafe
     */
    static Pattern compile(String id, String regex) {
        try {
            return RegexValidator.compileSafe(regex, Pattern.CASE_INSENSITIVE);
        } catch (RegexValidationException e) {
            throw new RuleCatalogException("Invalid pattern for rule " + id + ": " + e.getMessage(), e);
        }
    }

    private RuleCatalog() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
