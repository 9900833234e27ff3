package com.devscontext.common.util;

import com.devscontext.common.constants.DocFileTypes;

public final class FileUtils {

    private FileUtils() {}

    public static String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase();
    }

    /**
     * A file is searchable when it is a text format we can read and below the size cap.
     * Dot-files such as {@code .cursorrules} carry no extension and are accepted by name.
     */
    public static boolean isSearchableDoc(String filename, long fileSizeBytes) {
        if (filename == null || filename.isEmpty()) {
            return false;
        }
        if (fileSizeBytes > DocFileTypes.MAX_DOC_FILE_SIZE_BYTES) {
            return false;
        }
        if (DocFileTypes.STANDARDS_FILE_NAMES.contains(filename.toLowerCase())) {
            return true;
        }
        String extension = getFileExtension(filename);
        return !extension.isEmpty() && DocFileTypes.isSupported(extension);
    }

    public static String baseName(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }
}
