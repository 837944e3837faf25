package com.schemadoc.resolver.resolver;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Existence check for a single candidate file.
 */
@FunctionalInterface
public interface SchemaFileProbe {

    /**
     * @return true when {@code file} exists and can be read, false when it does not exist
     * @throws IOException when the file's state cannot be determined
     */
    boolean exists(Path file) throws IOException;

    static SchemaFileProbe filesystem() {
        return FilesystemProbe.INSTANCE;
    }
}
