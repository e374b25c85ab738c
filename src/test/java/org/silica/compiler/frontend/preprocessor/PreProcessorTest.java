package org.silica.compiler.frontend.preprocessor;

import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.io.SourceBuffer;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.lexer.Token;
import org.silica.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link PreProcessor}: macros, conditionals and file inclusion.
 */
class PreProcessorTest {

    @TempDir
    Path tempDir;

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final SourceCache sourceCache = new SourceCache();

    private List<String> expand(String name, String text, PreProcessorContext context) {
        SourceBuffer buffer = sourceCache.assignText(tempDir.resolve(name), text);
        PreProcessor preProcessor = new PreProcessor(diagnostics, sourceCache, context, null);
        return preProcessor.expand(buffer).stream().map(Token::text).toList();
    }

    @Test
    @Tag("unit")
    void objectLikeMacroIsSubstituted() {
        List<String> texts = expand("a.sv", "`define WIDTH 8\nparameter W = `WIDTH;", new PreProcessorContext());

        assertThat(texts).containsExactly("parameter", "W", "=", "8", ";");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void functionLikeMacroBindsArgumentsAndDefaults() {
        List<String> texts = expand("a.sv", "`define MAX(a, b=0) ((a) > (b) ? (a) : (b))\n`MAX(3)",
                new PreProcessorContext());

        assertThat(String.join(" ", texts)).isEqualTo("( ( 3 ) > ( 0 ) ? ( 3 ) : ( 0 ) )");
    }

    @Test
    @Tag("unit")
    void conditionalsSelectOneBranch() {
        String source = """
                `define FAST
                `ifdef SLOW
                slow
                `elsif FAST
                fast
                `else
                none
                `endif
                """;

        assertThat(expand("a.sv", source, new PreProcessorContext())).containsExactly("fast");
    }

    @Test
    @Tag("unit")
    void unbalancedAndUnclosedConditionalsAreReported() {
        expand("a.sv", "`endif\n`ifdef X\n", new PreProcessorContext());

        assertThat(diagnostics.count(DiagCode.UNBALANCED_CONDITIONAL)).isEqualTo(1);
        assertThat(diagnostics.count(DiagCode.MISSING_ENDIF)).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void inheritedMacrosAreVisible() {
        Token name = new Token(org.silica.compiler.frontend.lexer.TokenType.IDENTIFIER, "DEPTH", "DEPTH", 1, 1, "unit.sv");
        Token body = new Token(org.silica.compiler.frontend.lexer.TokenType.INTEGER_LITERAL, "16", null, 1, 15, "unit.sv");
        PreProcessorContext context = new PreProcessorContext(List.of(new MacroDefinition(name, false, List.of(), List.of(body))));

        assertThat(expand("lib.sv", "`DEPTH", context)).containsExactly("16");
    }

    @Test
    @Tag("unit")
    void unknownMacroIsReported() {
        expand("a.sv", "`NOPE", new PreProcessorContext());

        assertThat(diagnostics.count(DiagCode.UNKNOWN_DIRECTIVE)).isEqualTo(1);
    }

    @Test
    @Tag("integration")
    void includeIsResolvedNextToTheIncludingFile() throws IOException {
        Files.writeString(tempDir.resolve("defs.svh"), "`define W 4\n");
        Path main = tempDir.resolve("main.sv");
        Files.writeString(main, "`include \"defs.svh\"\nlocalparam L = `W;");
        PreProcessor preProcessor = new PreProcessor(diagnostics, sourceCache, new PreProcessorContext(), null);

        List<String> texts = preProcessor.expand(sourceCache.readSource(main, null)).stream().map(Token::text).toList();

        assertThat(texts).containsExactly("localparam", "L", "=", "4", ";");
        assertThat(preProcessor.getContext().getMacro("W")).isPresent();
    }

    @Test
    @Tag("integration")
    void recursiveIncludeIsReported() throws IOException {
        Path self = tempDir.resolve("self.svh");
        Files.writeString(self, "`include \"self.svh\"\n");
        PreProcessor preProcessor = new PreProcessor(diagnostics, sourceCache, new PreProcessorContext(), null);

        preProcessor.expand(sourceCache.readSource(self, null));

        assertThat(diagnostics.count(DiagCode.RECURSIVE_INCLUDE)).isEqualTo(1);
    }

    @Test
    @Tag("integration")
    void missingIncludeIsReported() {
        expand("a.sv", "`include \"missing.svh\"", new PreProcessorContext());

        assertThat(diagnostics.count(DiagCode.COULD_NOT_OPEN_INCLUDE)).isEqualTo(1);
    }
}
