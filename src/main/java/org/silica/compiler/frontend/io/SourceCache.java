package org.silica.compiler.frontend.io;

import org.silica.compiler.frontend.library.SourceLibrary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reads source files at most once and hands out the cached buffer afterwards.
 * <p>
 * Safe for concurrent readers: when two threads read the same path at the same time
 * the first buffer stored wins and both callers observe it. Failed reads are not cached.
 */
public class SourceCache {

    private final ConcurrentMap<Path, SourceBuffer> buffers = new ConcurrentHashMap<>();

    /**
     * Reads a file, or returns the buffer cached by an earlier read.
     *
     * @param path    The file to read.
     * @param library The library the file belongs to, or {@code null}.
     * @return The buffer for the file.
     * @throws IOException If the file cannot be read.
     */
    public SourceBuffer readSource(Path path, SourceLibrary library) throws IOException {
        Path key = normalize(path);
        SourceBuffer cached = buffers.get(key);
        if (cached != null) {
            return cached;
        }

        byte[] bytes = Files.readAllBytes(key);
        String content = normalizeLineEndings(new String(bytes, StandardCharsets.UTF_8));
        SourceBuffer buffer = new SourceBuffer(key, content, library);
        SourceBuffer existing = buffers.putIfAbsent(key, buffer);
        return existing != null ? existing : buffer;
    }

    /**
     * Registers in-memory text under the given path, as if it had been read from disk.
     *
     * @param path The path to register the text under.
     * @param text The source text.
     * @return The cached buffer (an existing one if the path was already cached).
     */
    public SourceBuffer assignText(Path path, String text) {
        Path key = normalize(path);
        SourceBuffer buffer = new SourceBuffer(key, normalizeLineEndings(text), null);
        SourceBuffer existing = buffers.putIfAbsent(key, buffer);
        return existing != null ? existing : buffer;
    }

    /**
     * Checks whether a path has already been read successfully.
     *
     * @param path The path to check.
     * @return {@code true} if a buffer for the path is cached.
     */
    public boolean isCached(Path path) {
        return buffers.containsKey(normalize(path));
    }

    /**
     * @return The number of cached buffers.
     */
    public int size() {
        return buffers.size();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
