package org.silica.compiler.frontend.syntax;

import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.io.SourceBuffer;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.lexer.Token;
import org.silica.compiler.frontend.lexer.TokenType;
import org.silica.compiler.frontend.library.SourceLibrary;
import org.silica.compiler.frontend.parser.Parser;
import org.silica.compiler.frontend.parser.ParserMetadata;
import org.silica.compiler.frontend.parser.ast.CompilationUnitNode;
import org.silica.compiler.frontend.preprocessor.PreProcessor;
import org.silica.compiler.frontend.preprocessor.PreProcessorContext;
import org.silica.compiler.frontend.preprocessor.features.macro.MacroDefinition;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A parsed compilation unit: one file, or several files preprocessed and parsed together.
 * <p>
 * Each tree owns its diagnostics, so trees can be built concurrently. The
 * {@link #isLibrary()} flag controls how the semantic layer treats the definitions
 * the tree declares; it may be changed after parsing.
 */
public final class SyntaxTree {

    private final CompilationUnitNode root;
    private final ParserMetadata metadata;
    private final List<MacroDefinition> definedMacros;
    private final DiagnosticsEngine diagnostics;
    private final List<SourceBuffer> buffers;
    private volatile boolean library;

    private SyntaxTree(CompilationUnitNode root, ParserMetadata metadata, List<MacroDefinition> definedMacros,
                       DiagnosticsEngine diagnostics, List<SourceBuffer> buffers, boolean library) {
        this.root = root;
        this.metadata = metadata;
        this.definedMacros = List.copyOf(definedMacros);
        this.diagnostics = diagnostics;
        this.buffers = List.copyOf(buffers);
        this.library = library;
    }

    /**
     * Preprocesses and parses one buffer.
     *
     * @param buffer          The buffer to parse.
     * @param sourceCache     The cache used to resolve include directives.
     * @param inheritedMacros Macros visible before the first line, usually those of an earlier unit.
     * @param isLibrary       The initial library flag.
     * @return The tree.
     */
    public static SyntaxTree fromBuffer(SourceBuffer buffer, SourceCache sourceCache,
                                        Collection<MacroDefinition> inheritedMacros, boolean isLibrary) {
        return fromBuffers(List.of(buffer), sourceCache, inheritedMacros, isLibrary);
    }

    /**
     * Preprocesses several buffers in order with one shared macro table and parses them as one unit.
     *
     * @param buffers         The buffers to parse, in order.
     * @param sourceCache     The cache used to resolve include directives.
     * @param inheritedMacros Macros visible before the first line.
     * @param isLibrary       The initial library flag.
     * @return The tree.
     */
    public static SyntaxTree fromBuffers(List<SourceBuffer> buffers, SourceCache sourceCache,
                                         Collection<MacroDefinition> inheritedMacros, boolean isLibrary) {
        if (buffers.isEmpty()) {
            throw new IllegalArgumentException("At least one buffer is required");
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SourceLibrary library = buffers.get(0).library();
        PreProcessor preProcessor = new PreProcessor(diagnostics, sourceCache, new PreProcessorContext(inheritedMacros), library);

        List<Token> tokens = new ArrayList<>();
        for (SourceBuffer buffer : buffers) {
            tokens.addAll(preProcessor.expand(buffer));
        }
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        tokens.add(new Token(TokenType.END_OF_FILE, "", null,
                last == null ? 1 : last.line(), last == null ? 1 : last.column(),
                buffers.get(buffers.size() - 1).logicalName()));

        Parser parser = new Parser(tokens, diagnostics);
        CompilationUnitNode root = parser.parse();
        List<MacroDefinition> macros = new ArrayList<>(preProcessor.getContext().getMacros().values());
        return new SyntaxTree(root, parser.getMetadata(), macros, diagnostics, buffers, isLibrary);
    }

    /**
     * Parses in-memory text. The text is registered in the cache under the given name.
     *
     * @param text        The source text.
     * @param fileName    The name used in locations.
     * @param sourceCache The cache to register the text with.
     * @return The tree, flagged as not a library.
     */
    public static SyntaxTree fromText(String text, String fileName, SourceCache sourceCache) {
        SourceBuffer buffer = sourceCache.assignText(Path.of(fileName), text);
        return fromBuffer(buffer, sourceCache, List.of(), false);
    }

    public CompilationUnitNode root() {
        return root;
    }

    public ParserMetadata getMetadata() {
        return metadata;
    }

    /**
     * @return The macros defined at the end of this unit, in definition order.
     */
    public List<MacroDefinition> getDefinedMacros() {
        return definedMacros;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The buffers this tree was parsed from.
     */
    public List<SourceBuffer> getBuffers() {
        return buffers;
    }

    public boolean isLibrary() {
        return library;
    }

    public void setLibrary(boolean library) {
        this.library = library;
    }

    @Override
    public String toString() {
        String name = buffers.size() == 1 ? buffers.get(0).logicalName() : buffers.size() + " files";
        return "SyntaxTree[" + name + (library ? ", library" : "") + "]";
    }
}
