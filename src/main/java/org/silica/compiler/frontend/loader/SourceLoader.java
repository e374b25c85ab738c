package org.silica.compiler.frontend.loader;

import org.silica.compiler.api.SourceOptions;
import org.silica.compiler.frontend.io.GlobMode;
import org.silica.compiler.frontend.io.GlobRank;
import org.silica.compiler.frontend.io.GlobResult;
import org.silica.compiler.frontend.io.PathGlob;
import org.silica.compiler.frontend.io.SourceBuffer;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.io.WorkerPool;
import org.silica.compiler.frontend.library.LibraryRegistry;
import org.silica.compiler.frontend.library.SourceLibrary;
import org.silica.compiler.frontend.librarymap.ConfigDeclaration;
import org.silica.compiler.frontend.librarymap.EmptyMember;
import org.silica.compiler.frontend.librarymap.FilePathSpec;
import org.silica.compiler.frontend.librarymap.LibraryDeclaration;
import org.silica.compiler.frontend.librarymap.LibraryIncludeStatement;
import org.silica.compiler.frontend.librarymap.LibraryMapDocument;
import org.silica.compiler.frontend.librarymap.LibraryMapMember;
import org.silica.compiler.frontend.librarymap.LibraryMapParser;
import org.silica.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.silica.compiler.frontend.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves file patterns, library maps and search directories into source files and parses them
 * into syntax trees.
 * <p>
 * Registration never throws: pattern and I/O failures are collected in {@link #getErrors()} and
 * processing of the remaining inputs continues. Registration and the dependency search run on
 * the calling thread; only the per-file parsing in {@link #loadAndParseSources(SourceOptions)}
 * may fan out to a {@link WorkerPool}.
 */
public class SourceLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceLoader.class);

    private static final List<String> DEFAULT_EXTENSIONS = List.of(".v", ".sv");

    private final SourceCache sourceCache;
    private final LibraryRegistry libraries;

    private final List<FileEntry> fileEntries = new ArrayList<>();
    private final Map<Path, FileEntry> fileIndex = new LinkedHashMap<>();
    private final Set<Path> searchDirectories = new LinkedHashSet<>();
    private final Set<String> searchExtensions = new LinkedHashSet<>(DEFAULT_EXTENSIONS);
    private final List<LibraryMapDocument> libraryMapDocuments = new ArrayList<>();
    private final List<LoadError> errors = new ArrayList<>();
    private final Set<Path> reportedConflicts = new HashSet<>();
    private final Set<String> unresolvedNames = new LinkedHashSet<>();

    public SourceLoader(SourceCache sourceCache) {
        this(sourceCache, new LibraryRegistry());
    }

    public SourceLoader(SourceCache sourceCache, LibraryRegistry libraries) {
        this.sourceCache = sourceCache;
        this.libraries = libraries;
    }

    /**
     * Registers every file matched by a pattern as a directly specified source file.
     *
     * @param pattern A file path or glob pattern, relative to the current directory.
     */
    public void addFiles(String pattern) {
        addFilesInternal(pattern, null, false, null, false);
    }

    /**
     * Registers every file matched by a pattern as a library file of the named library.
     * The library is created if it does not exist yet.
     *
     * @param libraryName The library name. An empty name registers the files without a library.
     * @param pattern     A file path or glob pattern, relative to the current directory.
     */
    public void addLibraryFiles(String libraryName, String pattern) {
        addFilesInternal(pattern, null, true, libraries.getOrAdd(libraryName), false);
    }

    /**
     * Adds the directories matched by a pattern to the dependency search path.
     *
     * @param pattern A directory path or glob pattern.
     */
    public void addSearchDirectories(String pattern) {
        GlobResult result;
        try {
            result = PathGlob.expand(null, pattern, GlobMode.DIRECTORIES, false);
        } catch (IOException e) {
            errors.add(LoadError.of(pattern, e));
            return;
        }
        searchDirectories.addAll(result.paths());
        log.debug("Search directory pattern '{}' matched {} director(ies)", pattern, result.paths().size());
    }

    /**
     * Adds a file extension probed in the search directories. A missing leading dot is added.
     *
     * @param extension The extension, for example {@code .vh}.
     */
    public void addSearchExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return;
        }
        String trimmed = extension.trim();
        searchExtensions.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
    }

    /**
     * Parses every library map matched by a pattern and registers the libraries it declares.
     * Include statements are followed relative to the including map; an include that would
     * re-enter a map already being processed is reported as an error and skipped.
     *
     * @param pattern       A file path or glob pattern naming library map files.
     * @param basePath      The directory relative patterns resolve against, or {@code null} for the current directory.
     * @param expandEnvVars Whether to expand environment variable references in the pattern.
     */
    public void addLibraryMaps(String pattern, Path basePath, boolean expandEnvVars) {
        addLibraryMapsInternal(pattern, basePath, expandEnvVars, new ArrayDeque<>());
    }

    private void addLibraryMapsInternal(String pattern, Path basePath, boolean expandEnvVars, Deque<Path> chain) {
        GlobResult result;
        try {
            result = PathGlob.expand(basePath, pattern, GlobMode.FILES, expandEnvVars);
        } catch (IOException e) {
            errors.add(LoadError.of(pattern, e));
            return;
        }

        for (Path path : result.paths()) {
            if (chain.contains(path)) {
                String cycle = chain.stream().map(Path::toString).collect(Collectors.joining(" -> "));
                log.debug("Not following library map include of {} from {}", path, chain.peekLast());
                errors.add(new LoadError(path.toString(), "library map include cycle: " + cycle + " -> " + path, null));
                continue;
            }

            SourceBuffer buffer;
            try {
                buffer = sourceCache.readSource(path, null);
            } catch (IOException e) {
                errors.add(LoadError.of(path.toString(), e));
                continue;
            }

            LibraryMapDocument document = new LibraryMapParser(buffer).parse();
            libraryMapDocuments.add(document);
            Path parentPath = document.directory();

            chain.addLast(path);
            try {
                for (LibraryMapMember member : document.members()) {
                    if (member instanceof ConfigDeclaration || member instanceof EmptyMember) {
                        continue;
                    }
                    if (member instanceof LibraryIncludeStatement include) {
                        String includePattern = include.path().path();
                        if (!includePattern.isEmpty()) {
                            addLibraryMapsInternal(includePattern, parentPath, true, chain);
                        }
                    } else if (member instanceof LibraryDeclaration declaration) {
                        createLibrary(declaration, parentPath);
                    } else {
                        throw new IllegalStateException("Unknown library map member: " + member.getClass().getSimpleName());
                    }
                }
            } finally {
                chain.removeLast();
            }
        }
    }

    private void createLibrary(LibraryDeclaration declaration, Path basePath) {
        if (declaration.name().isEmpty()) {
            return;
        }
        SourceLibrary library = libraries.getOrAdd(declaration.name());
        for (FilePathSpec spec : declaration.filePaths()) {
            String pattern = spec.path();
            if (!pattern.isEmpty()) {
                addFilesInternal(pattern, basePath, true, library, true);
            }
        }
    }

    private void addFilesInternal(String pattern, Path basePath, boolean isLibraryFile,
                                  SourceLibrary library, boolean expandEnvVars) {
        GlobResult result;
        try {
            result = PathGlob.expand(basePath, pattern, GlobMode.FILES, expandEnvVars);
        } catch (IOException e) {
            errors.add(LoadError.of(pattern, e));
            return;
        }
        log.debug("Pattern '{}' matched {} file(s)", pattern, result.paths().size());

        GlobRank rank = result.rank();
        for (Path path : result.paths()) {
            FileEntry entry = fileIndex.get(path);
            if (entry == null) {
                entry = new FileEntry(path, isLibraryFile, library, rank);
                fileIndex.put(path, entry);
                fileEntries.add(entry);
                continue;
            }

            entry.mergeLibraryFlag(isLibraryFile);
            if (library != null && entry.claim(library, rank) == FileEntry.ClaimOutcome.TIED) {
                log.warn("File {} is claimed by libraries '{}' and '{}' with equal specificity; using '{}'",
                        path, libraries.get(entry.libraryHandle()).name(), library.name(),
                        libraries.get(entry.libraryHandle()).name());
            }
        }
    }

    /**
     * Reads every registered file through the source cache.
     *
     * @return The buffers of all files that could be read, in registration order.
     */
    public List<SourceBuffer> loadSources() {
        List<SourceBuffer> buffers = new ArrayList<>(fileEntries.size());
        for (FileEntry entry : fileEntries) {
            reportConflict(entry);
            try {
                buffers.add(sourceCache.readSource(entry.path(), libraryOf(entry)));
            } catch (IOException e) {
                errors.add(LoadError.of(entry.path().toString(), e));
            }
        }
        return buffers;
    }

    /**
     * Reads and parses every registered file, then searches the search directories for
     * definitions that the parsed trees reference but nobody declares.
     *
     * @param options Controls unit grouping, macro inheritance and threading.
     * @return All parsed trees: directly parsed files in registration order, then the single unit,
     *         then macro-inheriting library files, then files found by the dependency search.
     */
    public List<SyntaxTree> loadAndParseSources(SourceOptions options) {
        options.searchExtensions().forEach(this::addSearchExtension);
        fileEntries.forEach(this::reportConflict);

        int threads = options.effectiveThreads();
        boolean parallel = fileEntries.size() > options.minFilesForThreading()
                && options.numThreads() != 1 && threads > 1;

        List<SyntaxTree> trees = new ArrayList<>();
        List<SourceBuffer> singleUnitBuffers = new ArrayList<>();
        List<SourceBuffer> deferredLibraryBuffers = new ArrayList<>();
        List<MacroDefinition> inheritedMacros;

        if (parallel) {
            try (WorkerPool pool = new WorkerPool(threads)) {
                LoadResult[] results = new LoadResult[fileEntries.size()];
                pool.dispatch(results.length, (from, to) -> {
                    for (int i = from; i < to; i++) {
                        results[i] = loadAndParse(fileEntries.get(i), options);
                    }
                });
                for (LoadResult result : results) {
                    handleLoadResult(result, trees, singleUnitBuffers, deferredLibraryBuffers);
                }

                inheritedMacros = parseSingleUnit(singleUnitBuffers, options, trees);

                SyntaxTree[] libraryTrees = new SyntaxTree[deferredLibraryBuffers.size()];
                pool.dispatch(libraryTrees.length, (from, to) -> {
                    for (int i = from; i < to; i++) {
                        libraryTrees[i] = SyntaxTree.fromBuffer(deferredLibraryBuffers.get(i), sourceCache,
                                inheritedMacros, true);
                    }
                });
                trees.addAll(Arrays.asList(libraryTrees));
            }
        } else {
            for (FileEntry entry : fileEntries) {
                handleLoadResult(loadAndParse(entry, options), trees, singleUnitBuffers, deferredLibraryBuffers);
            }
            inheritedMacros = parseSingleUnit(singleUnitBuffers, options, trees);
            for (SourceBuffer buffer : deferredLibraryBuffers) {
                trees.add(SyntaxTree.fromBuffer(buffer, sourceCache, inheritedMacros, true));
            }
        }

        if (!searchDirectories.isEmpty()) {
            discoverDependencies(trees, inheritedMacros);
        }

        log.info("Loaded {} file(s) into {} syntax tree(s) with {} error(s) ({})",
                fileEntries.size(), trees.size(), errors.size(), parallel ? threads + " threads" : "sequential");
        return trees;
    }

    private LoadResult loadAndParse(FileEntry entry, SourceOptions options) {
        SourceBuffer buffer;
        try {
            buffer = sourceCache.readSource(entry.path(), libraryOf(entry));
        } catch (IOException e) {
            return new LoadResult.LoadFailure(entry, e);
        }

        if (!entry.isLibraryFile() && options.singleUnit()) {
            return new LoadResult.DeferredBuffer(buffer, false);
        }
        if (entry.isLibraryFile() && options.librariesInheritMacros()) {
            return new LoadResult.DeferredBuffer(buffer, true);
        }
        return new LoadResult.ParsedTree(SyntaxTree.fromBuffer(buffer, sourceCache, List.of(),
                entry.isLibraryFile() || options.onlyLint()));
    }

    private void handleLoadResult(LoadResult result, List<SyntaxTree> trees,
                                  List<SourceBuffer> singleUnitBuffers, List<SourceBuffer> deferredLibraryBuffers) {
        if (result instanceof LoadResult.ParsedTree parsed) {
            trees.add(parsed.tree());
        } else if (result instanceof LoadResult.DeferredBuffer deferred) {
            (deferred.deferredLibrary() ? deferredLibraryBuffers : singleUnitBuffers).add(deferred.buffer());
        } else if (result instanceof LoadResult.LoadFailure failure) {
            errors.add(LoadError.of(failure.entry().path().toString(), failure.error()));
        } else {
            throw new IllegalStateException("Unhandled load result: " + result);
        }
    }

    private List<MacroDefinition> parseSingleUnit(List<SourceBuffer> buffers, SourceOptions options,
                                                  List<SyntaxTree> trees) {
        if (buffers.isEmpty()) {
            return List.of();
        }
        SyntaxTree unit = SyntaxTree.fromBuffers(buffers, sourceCache, List.of(), options.onlyLint());
        trees.add(unit);
        return unit.getDefinedMacros();
    }

    private void discoverDependencies(List<SyntaxTree> trees, List<MacroDefinition> inheritedMacros) {
        Set<String> knownNames = new HashSet<>();
        for (SyntaxTree tree : trees) {
            knownNames.addAll(tree.getMetadata().getDeclaredNames());
        }
        Set<String> missingNames = new LinkedHashSet<>();
        for (SyntaxTree tree : trees) {
            collectMissingNames(tree, knownNames, missingNames);
        }

        int iteration = 0;
        while (!missingNames.isEmpty()) {
            iteration++;
            log.debug("Dependency search iteration {}: {} missing name(s) {}", iteration, missingNames.size(), missingNames);

            Set<String> nextMissingNames = new LinkedHashSet<>();
            for (String name : missingNames) {
                // an earlier file of this iteration may have declared it
                if (knownNames.contains(name)) {
                    continue;
                }
                SourceBuffer buffer = findInSearchDirectories(name);
                if (buffer == null) {
                    continue;
                }

                SyntaxTree tree = SyntaxTree.fromBuffer(buffer, sourceCache, inheritedMacros, true);
                trees.add(tree);
                log.debug("Loaded {} for missing name '{}'", buffer.path(), name);

                knownNames.addAll(tree.getMetadata().getDeclaredNames());
                collectMissingNames(tree, knownNames, nextMissingNames);
            }
            nextMissingNames.removeAll(knownNames);
            missingNames = nextMissingNames;
        }

        unresolvedNames.clear();
        for (SyntaxTree tree : trees) {
            collectMissingNames(tree, knownNames, unresolvedNames);
        }
    }

    private static void collectMissingNames(SyntaxTree tree, Set<String> knownNames, Set<String> missingNames) {
        for (String name : tree.getMetadata().getReferencedNames()) {
            if (!knownNames.contains(name)) {
                missingNames.add(name);
            }
        }
    }

    private SourceBuffer findInSearchDirectories(String name) {
        for (Path directory : searchDirectories) {
            for (String extension : searchExtensions) {
                Path candidate = directory.resolve(name + extension);
                if (sourceCache.isCached(candidate) || !Files.isRegularFile(candidate)) {
                    continue;
                }
                try {
                    return sourceCache.readSource(candidate, null);
                } catch (IOException e) {
                    errors.add(LoadError.of(candidate.toString(), e));
                }
            }
        }
        return null;
    }

    private void reportConflict(FileEntry entry) {
        if (!entry.hasLibraryConflict() || !reportedConflicts.add(entry.path())) {
            return;
        }
        String chosen = libraries.get(entry.libraryHandle()).name();
        String other = libraries.get(entry.secondLibraryHandle()).name();
        errors.add(new LoadError(entry.path().toString(),
                "claimed by libraries '" + chosen + "' and '" + other + "' with equal specificity; using '" + chosen + "'",
                null));
    }

    /**
     * @param entry A registered file entry.
     * @return The library owning the entry, or {@code null} if it has none.
     */
    public SourceLibrary libraryOf(FileEntry entry) {
        return entry.libraryHandle() == SourceLibrary.NO_HANDLE ? null : libraries.get(entry.libraryHandle());
    }

    /**
     * @param entry A registered file entry.
     * @return The library that tied with the owner for this entry, or {@code null} if there is no conflict.
     */
    public SourceLibrary secondLibraryOf(FileEntry entry) {
        return entry.hasLibraryConflict() ? libraries.get(entry.secondLibraryHandle()) : null;
    }

    public List<FileEntry> getFileEntries() {
        return Collections.unmodifiableList(fileEntries);
    }

    public List<LoadError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<LibraryMapDocument> getLibraryMapDocuments() {
        return Collections.unmodifiableList(libraryMapDocuments);
    }

    public LibraryRegistry getLibraries() {
        return libraries;
    }

    public Set<Path> getSearchDirectories() {
        return Collections.unmodifiableSet(searchDirectories);
    }

    public Set<String> getSearchExtensions() {
        return Collections.unmodifiableSet(searchExtensions);
    }

    /**
     * @return Names referenced by the loaded trees that the last dependency search could not find.
     */
    public Set<String> getUnresolvedNames() {
        return Collections.unmodifiableSet(unresolvedNames);
    }
}
