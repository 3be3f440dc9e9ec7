package com.arqsz.skillsense.acquisition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.constants.AcquisitionConstants;
import com.arqsz.skillsense.model.ScannedFile;

/**
 * Loads the text files of a skill artifact from a local directory.
 * <p>
 * Files are returned in sorted path order with {@code SKILL.md} first. Excluded
 * directories, non-text extensions, oversized files and binary content are
 * skipped silently.
 */
public class DirectoryArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(DirectoryArtifactLoader.class);

    private final long maxFileBytes;

    public DirectoryArtifactLoader() {
        this(AcquisitionConstants.DEFAULT_MAX_FILE_BYTES);
    }

    public DirectoryArtifactLoader(long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }

    /**
     * Loads every eligible file under the root
     * 
     * @param root The artifact directory
     * @return Decoded files with root-relative, {@code /}-separated paths
     * @throws IOException If the directory cannot be walked or a file cannot be read
     */
    public List<ScannedFile> load(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }

        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(root)) {
            candidates = walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> relativePath(root, path)))
                    .toList();
        }

        List<ScannedFile> files = new ArrayList<>();
        for (Path path : candidates) {
            String relative = relativePath(root, path);
            ScannedFile file = loadFile(path, relative);
            if (file == null) {
                continue;
            }
            if (relative.equals(AcquisitionConstants.PRIMARY_DOCUMENT)) {
                files.add(0, file);
            } else {
                files.add(file);
            }
        }
        return files;
    }

    private ScannedFile loadFile(Path path, String relative) throws IOException {
        if (isExcludedPath(relative)) {
            log.debug("Skipping excluded path {}", relative);
            return null;
        }
        if (shouldSkipByExtension(relative)) {
            log.debug("Skipping {} (extension not allowed)", relative);
            return null;
        }
        long size = Files.size(path);
        if (size > maxFileBytes) {
            log.debug("Skipping {} ({} bytes exceeds limit of {})", relative, size, maxFileBytes);
            return null;
        }

        byte[] content = Files.readAllBytes(path);
        if (isProbablyBinary(relative, content)) {
            log.debug("Skipping binary file {}", relative);
            return null;
        }
        return new ScannedFile(relative, new String(content, StandardCharsets.UTF_8));
    }

    /**
     * Checks whether any directory component of the path is excluded
     * 
     * @param relativePath Root-relative path with {@code /} separators
     * @return true if the file lies under an excluded directory
     */
    static boolean isExcludedPath(String relativePath) {
        String[] parts = relativePath.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (AcquisitionConstants.EXCLUDED_PATH_PARTS.contains(parts[i])) {
                return true;
            }
        }
        return false;
    }

    static boolean shouldSkipByExtension(String relativePath) {
        String lower = relativePath.toLowerCase(Locale.ROOT);
        String name = lower.substring(lower.lastIndexOf('/') + 1);
        if (name.equals(AcquisitionConstants.DOCKERFILE)) {
            return false;
        }
        return !AcquisitionConstants.ALLOWED_EXTENSIONS.contains(extension(name));
    }

    static boolean isProbablyBinary(String relativePath, byte[] content) {
        String lower = relativePath.toLowerCase(Locale.ROOT);
        String name = lower.substring(lower.lastIndexOf('/') + 1);
        if (AcquisitionConstants.BINARY_EXTENSIONS.contains(extension(name))) {
            return true;
        }
        for (byte b : content) {
            if (b == 0) {
                return true;
            }
        }
        return false;
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }

    private static String relativePath(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
