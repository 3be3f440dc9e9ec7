package com.arqsz.skillsense.scanner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.constants.ScanConstants;
import com.arqsz.skillsense.model.Category;
import com.arqsz.skillsense.model.Confidence;
import com.arqsz.skillsense.model.Finding;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.model.Severity;
import com.arqsz.skillsense.util.StrictJson;
import com.arqsz.skillsense.util.TextUtils;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Unpinned-dependency checks for package manifests and requirements lists.
 * Unparseable input yields no findings.
 */
public class ManifestChecks {

    private static final Logger log = LoggerFactory.getLogger(ManifestChecks.class);

    /**
     * Runs every manifest check that applies to the file
     * 
     * @param file The file to inspect
     * @return Findings, NPM check first
     */
    public List<Finding> check(ScannedFile file) {
        List<Finding> findings = new ArrayList<>();
        if (file.text().isEmpty()) {
            return findings;
        }

        String pathLower = file.path().toLowerCase(Locale.ROOT);
        if (pathLower.endsWith(ScanConstants.PACKAGE_MANIFEST_SUFFIX)) {
            findings.addAll(checkPackageManifest(file));
        }
        if (pathLower.contains(ScanConstants.REQUIREMENTS_MARKER)
                && pathLower.endsWith(ScanConstants.REQUIREMENTS_SUFFIX)) {
            findings.addAll(checkRequirements(file));
        }
        return findings;
    }

    /**
     * Flags dependencies declared as {@code *}, {@code latest} or a caret range
     * 
     * @param file A package.json file
     * @return One LOW finding per unpinned dependency
     */
    public List<Finding> checkPackageManifest(ScannedFile file) {
        List<Finding> findings = new ArrayList<>();
        JsonObject manifest = parseStrict(file);
        if (manifest == null) {
            return findings;
        }

        Map<String, String> dependencies = new LinkedHashMap<>();
        for (String block : ScanConstants.NPM_DEPENDENCY_BLOCKS) {
            JsonElement element = manifest.get(block);
            if (element == null || !element.isJsonObject()) {
                continue;
            }
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                dependencies.put(entry.getKey(), versionString(entry.getValue()));
            }
        }

        for (Map.Entry<String, String> dependency : dependencies.entrySet()) {
            String version = dependency.getValue();
            if (!isUnpinned(version)) {
                continue;
            }
            String evidence = TextUtils.truncate(
                    TextUtils.collapseWhitespace("\"" + dependency.getKey() + "\": \"" + version + "\""),
                    ScanConstants.EVIDENCE_MAX_LENGTH);
            findings.add(new Finding(
                    FindingIdGenerator.generate(ScanConstants.RULE_UNPINNED_NPM, file.path(), null, evidence),
                    Category.DEPS,
                    Severity.LOW,
                    ScanConstants.TITLE_UNPINNED_NPM,
                    evidence,
                    file.path(),
                    null,
                    null,
                    Confidence.MEDIUM));
        }
        return findings;
    }

    /**
     * Flags requirement lines that are not pinned with {@code ==}
     * 
     * @param file A requirements*.txt file
     * @return One LOW finding per unpinned line
     */
    public List<Finding> checkRequirements(ScannedFile file) {
        List<Finding> findings = new ArrayList<>();
        String[] lines = file.text().split("\\R");

        for (int i = 0; i < lines.length; i++) {
            String clean = lines[i].strip();
            if (clean.isEmpty() || clean.startsWith(ScanConstants.REQUIREMENT_COMMENT)) {
                continue;
            }
            if (clean.contains(ScanConstants.REQUIREMENT_PINNED)
                    || clean.startsWith(ScanConstants.REQUIREMENT_EDITABLE)
                    || clean.startsWith(ScanConstants.REQUIREMENT_VCS)) {
                continue;
            }
            int lineNumber = i + 1;
            String evidence = TextUtils.truncate(
                    TextUtils.collapseWhitespace(clean), ScanConstants.EVIDENCE_MAX_LENGTH);
            findings.add(new Finding(
                    FindingIdGenerator.generate(ScanConstants.RULE_UNPINNED_PY, file.path(), lineNumber, evidence),
                    Category.DEPS,
                    Severity.LOW,
                    ScanConstants.TITLE_UNPINNED_PY,
                    evidence,
                    file.path(),
                    lineNumber,
                    lineNumber,
                    Confidence.LOW));
        }
        return findings;
    }

    private static boolean isUnpinned(String version) {
        return ScanConstants.VERSION_ANY.equals(version)
                || ScanConstants.VERSION_LATEST.equals(version)
                || version.strip().startsWith(ScanConstants.VERSION_CARET);
    }

    private static String versionString(JsonElement value) {
        if (value.isJsonPrimitive()) {
            return value.getAsString();
        }
        return value.toString();
    }

    /**
     * Parses a manifest as a single strict JSON object
     * 
     * @return The object, or null if the text is not a well-formed JSON object
     */
    private static JsonObject parseStrict(ScannedFile file) {
        try {
            JsonElement root = StrictJson.parse(file.text());
            return root.isJsonObject() ? root.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            log.debug("Skipping unparseable manifest {}: {}", file.path(), e.getMessage());
            return null;
        }
    }
}
