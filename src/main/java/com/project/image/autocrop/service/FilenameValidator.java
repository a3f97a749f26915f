package com.project.image.autocrop.service;

import java.util.Locale;
import java.util.Set;

/**
 * Catches names that Windows would refuse as a file name. Not exhaustive; it rejects the common
 * cases before a user supplied name reaches the file system.
 */
public final class FilenameValidator {
    private static final String ILLEGAL_CHARS = "<>:\"/\\|?*";

    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );

    private FilenameValidator() {}

    public static boolean isIllegal(String name) {
        if (name == null || name.isEmpty()) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c <= 31 || ILLEGAL_CHARS.indexOf(c) >= 0) {
                return true;
            }
        }
        return RESERVED_NAMES.contains(name.toUpperCase(Locale.ROOT));
    }
}
