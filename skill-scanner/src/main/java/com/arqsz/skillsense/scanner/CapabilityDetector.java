package com.arqsz.skillsense.scanner;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import com.arqsz.skillsense.model.Capability;
import com.arqsz.skillsense.model.CapabilityFlags;
import com.arqsz.skillsense.model.ScannedFile;

/**
 * Coarse behavioral tagging of artifact text. Independent of the rule catalog;
 * flags never produce findings.
 */
public class CapabilityDetector {

    private static final Map<Capability, Pattern> IDIOMS = new EnumMap<>(Capability.class);

    static {
        IDIOMS.put(Capability.NETWORK, idiom(Capability.NETWORK,
                "\\b(requests\\.|fetch\\s*\\(|httpx\\.|urllib\\.)"));
        IDIOMS.put(Capability.FILE_WRITE, idiom(Capability.FILE_WRITE,
                "\\b(open\\s*\\(.+['\"]w|write_text\\s*\\(|fs\\.writefile|tee\\s+)"));
        IDIOMS.put(Capability.FILE_DELETE, idiom(Capability.FILE_DELETE,
                "\\b(rm\\s+-rf|rmtree\\s*\\(|unlink\\s*\\()"));
        IDIOMS.put(Capability.SHELL_EXEC, idiom(Capability.SHELL_EXEC,
                "\\b(subprocess\\.|os\\.system|child_process\\.)"));
        IDIOMS.put(Capability.READS_ENV, idiom(Capability.READS_ENV,
                "\\b(os\\.environ|getenv|process\\.env)\\b"));
        IDIOMS.put(Capability.DB_ACCESS, idiom(Capability.DB_ACCESS,
                "\\b(select\\s+.+\\s+from|insert\\s+into|sqlalchemy|psycopg|sqlite3|mongodb)\\b"));
    }

    /**
     * Detects capabilities across all files; a flag set by any file stays set
     * 
     * @param files Files to inspect
     * @return Union of per-file flags
     */
    public CapabilityFlags detect(List<ScannedFile> files) {
        CapabilityFlags.Builder builder = new CapabilityFlags.Builder();
        for (ScannedFile file : files) {
            detectInto(file, builder);
        }
        return builder.build();
    }

    /**
     * Detects capabilities of a single file
     * 
     * @param file The file to inspect
     * @return Flags for this file alone
     */
    public CapabilityFlags detect(ScannedFile file) {
        CapabilityFlags.Builder builder = new CapabilityFlags.Builder();
        detectInto(file, builder);
        return builder.build();
    }

    private void detectInto(ScannedFile file, CapabilityFlags.Builder builder) {
        if (file.text().isEmpty()) {
            return;
        }
        String lowered = file.text().toLowerCase(Locale.ROOT);
        for (Map.Entry<Capability, Pattern> idiom : IDIOMS.entrySet()) {
            if (idiom.getValue().matcher(lowered).find()) {
                builder.set(idiom.getKey());
            }
        }
    }

    private static Pattern idiom(Capability capability, String regex) {
        return RuleCatalog.compile("capability:" + capability.key(), regex);
    }
}
