package com.kmg.blend.repo;

import java.nio.file.Path;
import java.util.regex.Pattern;

public final class JobIds {
    private static final Pattern UNSAFE = Pattern.compile("[.\\s/\\\\:*?\"<>|]");

    private JobIds() {
    }

    public static String fromInput(Path inputPath) {
        Path fileName = inputPath.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Input has no file name: " + inputPath);
        }
        return sanitize(fileName.toString());
    }

    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank.");
        }
        return UNSAFE.matcher(name).replaceAll("_");
    }
}
