package com.devscontext.common.constants;

import java.util.Locale;
import java.util.Set;

public final class DocFileTypes {
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("md", "markdown", "txt", "rst");

    public static final Set<String> STANDARDS_FILE_NAMES = Set.of("claude.md", ".cursorrules");
    public static final Set<String> STANDARDS_DIRECTORIES = Set.of("standards", "conventions", "guidelines");
    public static final Set<String> ARCHITECTURE_DIRECTORIES = Set.of("architecture", "design", "arch");
    public static final Set<String> ADR_DIRECTORIES = Set.of("adr", "adrs", "decisions");

    public static final long MAX_DOC_FILE_SIZE_BYTES = 1_000_000; // 1MB
    public static final int MAX_DOCS_TO_SEARCH = 100;

    private DocFileTypes() {}

    public static boolean isSupported(String extension) {
        return SUPPORTED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Standards files are always part of the context, whatever the ticket says.
     */
    public static boolean isStandardsFile(String relativePath) {
        String path = normalize(relativePath);
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        if (STANDARDS_FILE_NAMES.contains(fileName)) {
            return true;
        }
        return hasDirectory(path, STANDARDS_DIRECTORIES) || fileName.startsWith("standards");
    }

    public static String getCategory(String relativePath) {
        String path = normalize(relativePath);
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        if (isStandardsFile(path)) return "STANDARDS";
        if (hasDirectory(path, ADR_DIRECTORIES) || fileName.matches("^(adr[-_]?)?\\d{3,4}[-_].*")) return "ADR";
        if (hasDirectory(path, ARCHITECTURE_DIRECTORIES) || fileName.contains("architecture")) return "ARCHITECTURE";
        return "OTHER";
    }

    private static boolean hasDirectory(String path, Set<String> directories) {
        String[] segments = path.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (directories.contains(segments[i])) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String path) {
        return path == null ? "" : path.replace('\\', '/').toLowerCase(Locale.ROOT);
    }
}
