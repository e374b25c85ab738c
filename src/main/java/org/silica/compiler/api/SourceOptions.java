package org.silica.compiler.api;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Options that control how sources are grouped into compilation units and parsed.
 *
 * @param numThreads             Number of parse threads; 0 means one per available processor, 1 disables threading.
 * @param singleUnit             Parse all directly specified files as one compilation unit.
 * @param onlyLint               Treat every parsed tree as a library tree.
 * @param librariesInheritMacros Let library files see the macros of the single compilation unit.
 * @param minFilesForThreading   Parsing runs in parallel only when more files than this are registered.
 * @param searchExtensions       Extra file extensions probed in search directories, in addition to {@code .v} and {@code .sv}.
 */
public record SourceOptions(
        int numThreads,
        boolean singleUnit,
        boolean onlyLint,
        boolean librariesInheritMacros,
        int minFilesForThreading,
        List<String> searchExtensions
) {

    /** Config path of the source options block. */
    public static final String CONFIG_PATH = "silica.sources";

    public SourceOptions {
        if (numThreads < 0) {
            throw new IllegalArgumentException("num-threads must be >= 0, got " + numThreads);
        }
        if (minFilesForThreading < 0) {
            throw new IllegalArgumentException("min-files-for-threading must be >= 0, got " + minFilesForThreading);
        }
        if (librariesInheritMacros && !singleUnit) {
            throw new IllegalArgumentException("libraries-inherit-macros requires single-unit");
        }
        searchExtensions = List.copyOf(searchExtensions);
    }

    /**
     * @return The defaults used when no configuration is given.
     */
    public static SourceOptions defaults() {
        return new SourceOptions(0, false, false, false, 4, List.of());
    }

    /**
     * Reads the options from a config that contains a {@value #CONFIG_PATH} block.
     *
     * @param config The resolved configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type.
     * @throws IllegalArgumentException if the values are inconsistent.
     */
    public static SourceOptions fromConfig(Config config) {
        Config sources = config.getConfig(CONFIG_PATH);
        return new SourceOptions(
                sources.getInt("num-threads"),
                sources.getBoolean("single-unit"),
                sources.getBoolean("only-lint"),
                sources.getBoolean("libraries-inherit-macros"),
                sources.getInt("min-files-for-threading"),
                sources.getStringList("search-extensions"));
    }

    /**
     * @return The number of parse threads after resolving 0 to the processor count.
     */
    public int effectiveThreads() {
        return numThreads == 0 ? Runtime.getRuntime().availableProcessors() : numThreads;
    }

    public SourceOptions withNumThreads(int value) {
        return new SourceOptions(value, singleUnit, onlyLint, librariesInheritMacros, minFilesForThreading, searchExtensions);
    }

    public SourceOptions withSingleUnit(boolean value) {
        return new SourceOptions(numThreads, value, onlyLint, librariesInheritMacros, minFilesForThreading, searchExtensions);
    }

    public SourceOptions withOnlyLint(boolean value) {
        return new SourceOptions(numThreads, singleUnit, value, librariesInheritMacros, minFilesForThreading, searchExtensions);
    }

    public SourceOptions withLibrariesInheritMacros(boolean value) {
        return new SourceOptions(numThreads, singleUnit, onlyLint, value, minFilesForThreading, searchExtensions);
    }

    public SourceOptions withMinFilesForThreading(int value) {
        return new SourceOptions(numThreads, singleUnit, onlyLint, librariesInheritMacros, value, searchExtensions);
    }
}
