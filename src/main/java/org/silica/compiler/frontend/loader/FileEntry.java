package org.silica.compiler.frontend.loader;

import org.silica.compiler.frontend.io.GlobRank;
import org.silica.compiler.frontend.library.SourceLibrary;

import java.nio.file.Path;

/**
 * One registered source file. There is exactly one entry per normalized path.
 * <p>
 * Libraries are referenced by their registry handle. The library-file flag can only
 * change from {@code true} to {@code false}: once a file is named directly it is never
 * treated as a library file again.
 */
public final class FileEntry {

    /** The effect of a library claiming a file. */
    enum ClaimOutcome {
        /** The library now owns the file. */
        ASSIGNED,
        /** Another library with the same rank already owns the file. */
        TIED,
        /** A more specific claim already owns the file. */
        IGNORED
    }

    private final Path path;
    private boolean libraryFile;
    private int libraryHandle;
    private GlobRank libraryRank;
    private int secondLibraryHandle = SourceLibrary.NO_HANDLE;

    FileEntry(Path path, boolean libraryFile, SourceLibrary library, GlobRank rank) {
        this.path = path;
        this.libraryFile = libraryFile;
        this.libraryHandle = library != null ? library.handle() : SourceLibrary.NO_HANDLE;
        this.libraryRank = rank;
    }

    void mergeLibraryFlag(boolean isLibraryFile) {
        libraryFile &= isLibraryFile;
    }

    ClaimOutcome claim(SourceLibrary library, GlobRank rank) {
        if (libraryHandle == SourceLibrary.NO_HANDLE || rank.compareTo(libraryRank) < 0) {
            libraryHandle = library.handle();
            libraryRank = rank;
            secondLibraryHandle = SourceLibrary.NO_HANDLE;
            return ClaimOutcome.ASSIGNED;
        }
        if (rank == libraryRank && library.handle() != libraryHandle) {
            if (secondLibraryHandle == SourceLibrary.NO_HANDLE) {
                secondLibraryHandle = library.handle();
            }
            return ClaimOutcome.TIED;
        }
        return ClaimOutcome.IGNORED;
    }

    public Path path() {
        return path;
    }

    public boolean isLibraryFile() {
        return libraryFile;
    }

    /**
     * @return The handle of the owning library, or {@link SourceLibrary#NO_HANDLE}.
     */
    public int libraryHandle() {
        return libraryHandle;
    }

    /**
     * @return The rank of the pattern through which the owning library claimed this file.
     */
    public GlobRank libraryRank() {
        return libraryRank;
    }

    /**
     * @return The handle of a library that claimed this file with the same rank as the owner,
     *         or {@link SourceLibrary#NO_HANDLE} if there is no such conflict.
     */
    public int secondLibraryHandle() {
        return secondLibraryHandle;
    }

    public boolean hasLibraryConflict() {
        return secondLibraryHandle != SourceLibrary.NO_HANDLE;
    }

    @Override
    public String toString() {
        return "FileEntry[" + path + (libraryFile ? ", library file" : "") + "]";
    }
}
