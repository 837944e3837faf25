package com.schemadoc.resolver.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for file writes with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     */
    public static Path safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        return Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Creates the parent directory chain of {@code filePath}, if it has one.
     */
    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }
}
