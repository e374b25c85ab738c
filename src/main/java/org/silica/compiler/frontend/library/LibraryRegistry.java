package org.silica.compiler.frontend.library;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An arena of source libraries keyed by name. Libraries are never removed, so the
 * integer handles stored on file entries stay valid for the lifetime of the registry.
 */
public final class LibraryRegistry {

    private final List<SourceLibrary> libraries = new ArrayList<>();
    private final Map<String, SourceLibrary> byName = new HashMap<>();

    /**
     * Returns the library with the given name, creating it on first use.
     *
     * @param name The library name.
     * @return The library, or {@code null} if the name is empty.
     */
    public synchronized SourceLibrary getOrAdd(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        return byName.computeIfAbsent(name, n -> {
            SourceLibrary library = new SourceLibrary(n, libraries.size());
            libraries.add(library);
            return library;
        });
    }

    /**
     * Looks up a library by name without creating it.
     *
     * @param name The library name.
     * @return The library, if registered.
     */
    public synchronized Optional<SourceLibrary> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Resolves a handle back to its library.
     *
     * @param handle A handle previously returned through {@link SourceLibrary#handle()},
     *               or {@link SourceLibrary#NO_HANDLE}.
     * @return The library, or {@code null} for {@link SourceLibrary#NO_HANDLE}.
     * @throws IndexOutOfBoundsException if the handle was not issued by this registry.
     */
    public synchronized SourceLibrary get(int handle) {
        if (handle == SourceLibrary.NO_HANDLE) {
            return null;
        }
        return libraries.get(handle);
    }

    /**
     * @return All registered libraries in creation order.
     */
    public synchronized List<SourceLibrary> getLibraries() {
        return List.copyOf(libraries);
    }

    /**
     * @return The number of registered libraries.
     */
    public synchronized int size() {
        return libraries.size();
    }
}
