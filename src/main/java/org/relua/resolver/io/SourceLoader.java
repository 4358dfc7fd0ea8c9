package org.relua.resolver.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for discovery: reads decompiled module files from the local
 * filesystem and normalizes them for reference extraction.
 * <p>
 * Decompiler output frequently carries stray bytes inside string constants, so invalid
 * UTF-8 sequences are replaced instead of failing the read.
 */
public final class SourceLoader implements SourceReader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used for deduplication and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    @Override
    public String read(Path path) throws IOException {
        return loadFile(path).content();
    }

    /**
     * Loads content from a local filesystem path.
     *
     * @param resolvedPath The fully resolved, normalized path.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path resolvedPath) throws IOException {
        String logicalName = resolvedPath.toString().replace('\\', '/');
        byte[] bytes = Files.readAllBytes(resolvedPath);
        return new LoadResult(normalizeLineEndings(decodeLenient(bytes)), logicalName);
    }

    /**
     * Returns the canonical key of a file: its real path when it exists, otherwise the
     * absolute normalized path.
     */
    public static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private static String decodeLenient(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
