package org.silica.cli.commands;

import org.silica.cli.CommandLineInterface;
import org.silica.compiler.api.CompilationException;
import org.silica.compiler.api.SourceOptions;
import org.silica.compiler.diagnostics.CompilerLogger;
import org.silica.compiler.diagnostics.Diagnostic;
import org.silica.compiler.elaboration.Compilation;
import org.silica.compiler.elaboration.InstanceBody;
import org.silica.compiler.elaboration.ParameterOverrides;
import org.silica.compiler.elaboration.ParameterSymbolBase;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.librarymap.LibraryMapDocument;
import org.silica.compiler.frontend.loader.LoadError;
import org.silica.compiler.frontend.loader.SourceLoader;
import org.silica.compiler.frontend.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "load",
        mixinStandardHelpOptions = true,
        description = "Loads and parses HDL sources, then elaborates the parameters of the top-level definitions.")
public class LoadCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LoadCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(description = "Source files or glob patterns.")
    private List<String> files = new ArrayList<>();

    @Option(names = {"-f", "--file"}, description = "A source file or glob pattern. May be repeated.")
    private List<String> filePatterns = new ArrayList<>();

    @Option(names = {"-v", "--libfile"}, paramLabel = "[LIB=]PATTERN",
            description = "A library file or glob pattern, optionally assigned to a named library.")
    private List<String> libraryFiles = new ArrayList<>();

    @Option(names = {"-y", "--libdir"}, description = "A directory searched for definitions nobody declares.")
    private List<String> libraryDirectories = new ArrayList<>();

    @Option(names = {"-Y", "--libext"}, description = "An extra file extension probed in search directories.")
    private List<String> libraryExtensions = new ArrayList<>();

    @Option(names = "--libmap", description = "A library map file or glob pattern.")
    private List<String> libraryMaps = new ArrayList<>();

    @Option(names = "--single-unit", description = "Parse all directly specified files as one compilation unit.")
    private boolean singleUnit;

    @Option(names = "--only-lint", description = "Treat every file as a library file.")
    private boolean onlyLint;

    @Option(names = "--libraries-inherit-macros", description = "Let library files see the macros of the single unit.")
    private boolean librariesInheritMacros;

    @Option(names = {"-j", "--threads"}, description = "Number of parse threads; 0 uses all processors.")
    private Integer threads;

    @Option(names = "--top", description = "A definition to elaborate. Defaults to every uninstantiated definition.")
    private List<String> tops = new ArrayList<>();

    @Option(names = {"-G"}, paramLabel = "[INST.]NAME=VALUE", description = "Overrides a parameter of a top-level instance.")
    private List<String> overrides = new ArrayList<>();

    @Option(names = "--no-elaborate", description = "Stop after loading and parsing.")
    private boolean noElaborate;

    @Option(names = "--verbose", description = "Log progress at debug level.")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            CompilerLogger.setLevel(CompilerLogger.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();

        SourceOptions options;
        ParameterOverrides parameterOverrides;
        try {
            options = applyFlags(SourceOptions.fromConfig(parent.getConfig()));
            parameterOverrides = ParameterOverrides.parse(overrides);
        } catch (CompilationException | IllegalArgumentException e) {
            log.error("Invalid options: {}", e.getMessage());
            return 2;
        }

        SourceLoader loader = new SourceLoader(new SourceCache());
        libraryMaps.forEach(pattern -> loader.addLibraryMaps(pattern, null, false));
        files.forEach(loader::addFiles);
        filePatterns.forEach(loader::addFiles);
        for (String libraryFile : libraryFiles) {
            int eq = libraryFile.indexOf('=');
            if (eq > 0) {
                loader.addLibraryFiles(libraryFile.substring(0, eq), libraryFile.substring(eq + 1));
            } else {
                loader.addLibraryFiles("", libraryFile);
            }
        }
        libraryDirectories.forEach(loader::addSearchDirectories);
        libraryExtensions.forEach(loader::addSearchExtension);

        List<SyntaxTree> trees = loader.loadAndParseSources(options);

        boolean failed = false;
        for (LoadError error : loader.getErrors()) {
            out.println("[ERROR] " + error);
            failed = true;
        }
        for (LibraryMapDocument document : loader.getLibraryMapDocuments()) {
            failed |= print(out, document.diagnostics().getDiagnostics());
        }
        for (SyntaxTree tree : trees) {
            out.println(tree);
            failed |= print(out, tree.getDiagnostics().getDiagnostics());
        }
        for (String name : loader.getUnresolvedNames()) {
            out.println("[WARNING] no definition found for '" + name + "'");
        }

        if (!noElaborate) {
            failed |= elaborate(out, trees, parameterOverrides);
        }
        return failed ? 1 : 0;
    }

    private SourceOptions applyFlags(SourceOptions options) {
        SourceOptions result = options;
        if (threads != null) {
            result = result.withNumThreads(threads);
        }
        if (singleUnit) {
            result = result.withSingleUnit(true);
        }
        if (onlyLint) {
            result = result.withOnlyLint(true);
        }
        if (librariesInheritMacros) {
            result = result.withLibrariesInheritMacros(true);
        }
        return result;
    }

    private boolean elaborate(PrintWriter out, List<SyntaxTree> trees, ParameterOverrides parameterOverrides) {
        Compilation compilation = new Compilation();
        trees.forEach(compilation::addSyntaxTree);

        boolean failed = false;
        List<String> names = tops.isEmpty() ? compilation.getTopLevelNames() : tops;
        for (String name : names) {
            Optional<InstanceBody> top = compilation.elaborate(name, parameterOverrides);
            if (top.isEmpty()) {
                out.println("[ERROR] top-level definition '" + name + "' was not found");
                failed = true;
                continue;
            }
            printInstance(out, top.get(), "");
        }
        return print(out, compilation.getDiagnostics().getDiagnostics()) || failed;
    }

    private void printInstance(PrintWriter out, InstanceBody body, String indent) {
        out.println(indent + body);
        for (ParameterSymbolBase parameter : body.getParameters()) {
            out.println(indent + "  " + parameter);
        }
        for (InstanceBody child : body.getChildren()) {
            printInstance(out, child, indent + "  ");
        }
    }

    private static boolean print(PrintWriter out, List<Diagnostic> diagnostics) {
        boolean errors = false;
        for (Diagnostic diagnostic : diagnostics) {
            out.println(diagnostic);
            errors |= diagnostic.type() == Diagnostic.Type.ERROR;
        }
        return errors;
    }
}
