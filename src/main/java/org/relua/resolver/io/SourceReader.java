package org.relua.resolver.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File-system collaborator used by discovery to obtain the text of a module file.
 * <p>
 * Implementations must be safe to call from several worker threads at once.
 */
@FunctionalInterface
public interface SourceReader {

    /**
     * Reads the full content of the given file.
     *
     * @param path The canonical path of the file.
     * @return The file content.
     * @throws IOException If the file cannot be opened or read.
     */
    String read(Path path) throws IOException;
}
