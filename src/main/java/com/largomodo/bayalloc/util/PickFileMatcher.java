package com.largomodo.bayalloc.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Recognizes pick exports by name, e.g. "251209_pick.csv" or "251028_Bidfood_Pick.csv".
 */
public final class PickFileMatcher {

    private static final String SUFFIX = "pick.csv";

    private PickFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path candidate file (can be null)
     * @return true if path is a regular file whose name ends with "pick.csv", ignoring case
     */
    public static boolean isPickFile(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        if (!Files.isRegularFile(path)) {
            return false;
        }
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SUFFIX);
    }
}
