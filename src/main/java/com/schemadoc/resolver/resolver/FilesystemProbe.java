package com.schemadoc.resolver.resolver;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Probe backed by {@link Files}. Missing files and missing parent directories are misses,
 * as are candidates whose parent path runs through a regular file. Anything else that
 * prevents reading the file is reported as an error.
 */
final class FilesystemProbe implements SchemaFileProbe {

    static final FilesystemProbe INSTANCE = new FilesystemProbe();

    private FilesystemProbe() {
    }

    @Override
    public boolean exists(Path file) throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException | NotDirectoryException e) {
            return false;
        } catch (AccessDeniedException e) {
            throw e;
        } catch (FileSystemException e) {
            // ENOTDIR surfaces as a plain FileSystemException on most platforms
            if (crossesRegularFile(file)) {
                return false;
            }
            throw e;
        }
        if (!attributes.isRegularFile()) {
            return false;
        }
        if (!Files.isReadable(file)) {
            throw new AccessDeniedException(file.toString(), null, "file exists but is not readable");
        }
        return true;
    }

    /**
     * True when the nearest existing ancestor of {@code file} is not a directory.
     */
    static boolean crossesRegularFile(Path file) {
        for (Path parent = file.getParent(); parent != null; parent = parent.getParent()) {
            if (Files.exists(parent)) {
                return !Files.isDirectory(parent);
            }
        }
        return false;
    }
}
