package org.silica.compiler.frontend.preprocessor;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.io.SourceBuffer;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.lexer.IntegerLiteral;
import org.silica.compiler.frontend.lexer.Lexer;
import org.silica.compiler.frontend.lexer.Token;
import org.silica.compiler.frontend.lexer.TokenType;
import org.silica.compiler.frontend.library.SourceLibrary;
import org.silica.compiler.frontend.preprocessor.features.macro.MacroDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The preprocessor for the hardware description language. It runs after the lexer and
 * before the parser and operates directly on the token stream.
 * <p>
 * It handles macro definition and expansion, conditional compilation and file
 * inclusion. Included files are read through the {@link SourceCache} and preprocessed
 * in place with the same macro table. The resulting stream contains no newline,
 * continuation or end-of-file tokens.
 */
public class PreProcessor {

    private static final int MAX_EXPANSION_DEPTH = 64;

    private static final Set<String> LINE_DIRECTIVES = Set.of(
            "timescale", "default_nettype", "line", "pragma", "begin_keywords", "unconnected_drive",
            "default_decay_time", "default_trireg_strength");
    private static final Set<String> BARE_DIRECTIVES = Set.of(
            "resetall", "celldefine", "endcelldefine", "nounconnected_drive", "end_keywords",
            "delay_mode_distributed", "delay_mode_path", "delay_mode_unit", "delay_mode_zero",
            "protect", "endprotect");

    private final DiagnosticsEngine diagnostics;
    private final SourceCache sourceCache;
    private final PreProcessorContext ppContext;
    private final SourceLibrary library;
    private final Deque<Path> includeStack = new ArrayDeque<>();

    /**
     * Constructs a new PreProcessor.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param sourceCache The cache used to read included files.
     * @param ppContext   The macro table, possibly seeded with inherited macros.
     * @param library     The library that included files are read for, or {@code null}.
     */
    public PreProcessor(DiagnosticsEngine diagnostics, SourceCache sourceCache, PreProcessorContext ppContext, SourceLibrary library) {
        this.diagnostics = diagnostics;
        this.sourceCache = sourceCache;
        this.ppContext = ppContext;
        this.library = library;
    }

    /**
     * Lexes and preprocesses one buffer. Macros defined by the buffer remain in the
     * context afterwards, so calling this for several buffers in a row treats them as
     * one compilation unit.
     *
     * @param buffer The buffer to process.
     * @return The expanded tokens, without a trailing end-of-file token.
     */
    public List<Token> expand(SourceBuffer buffer) {
        List<Token> tokens = new Lexer(buffer.content(), diagnostics, buffer.logicalName()).scanTokens();
        includeStack.push(buffer.path().toAbsolutePath().normalize());
        try {
            return process(tokens, 0);
        } finally {
            includeStack.pop();
        }
    }

    /**
     * @return The context holding the macros defined so far.
     */
    public PreProcessorContext getContext() {
        return ppContext;
    }

    private List<Token> process(List<Token> input, int depth) {
        Cursor cursor = new Cursor(input);
        List<Token> out = new ArrayList<>();
        Deque<Conditional> conditionals = new ArrayDeque<>();

        while (!cursor.isAtEnd()) {
            Token token = cursor.advance();
            boolean active = conditionals.isEmpty() || conditionals.peek().active;

            switch (token.type()) {
                case NEWLINE, LINE_CONTINUATION, END_OF_FILE -> { }
                case DIRECTIVE -> {
                    String name = (String) token.value();
                    if (handleConditional(name, token, cursor, conditionals)) {
                        continue;
                    }
                    if (active) {
                        handleDirective(name, token, cursor, out, depth);
                    }
                }
                default -> {
                    if (active) out.add(token);
                }
            }
        }

        for (Conditional open : conditionals) {
            diagnostics.report(DiagCode.MISSING_ENDIF, open.opener.location());
        }
        return out;
    }

    private boolean handleConditional(String name, Token directive, Cursor cursor, Deque<Conditional> conditionals) {
        switch (name) {
            case "ifdef", "ifndef" -> {
                boolean parentActive = conditionals.isEmpty() || conditionals.peek().active;
                Token macroName = expectMacroName(directive, cursor);
                boolean defined = macroName != null && ppContext.getMacro(macroName.text()).isPresent();
                boolean taken = name.equals("ifdef") == defined;
                conditionals.push(new Conditional(directive, parentActive, parentActive && taken));
                return true;
            }
            case "elsif" -> {
                Token macroName = expectMacroName(directive, cursor);
                Conditional top = conditionals.peek();
                if (top == null || top.sawElse) {
                    diagnostics.report(DiagCode.UNBALANCED_CONDITIONAL, directive.location(), name);
                    return true;
                }
                boolean defined = macroName != null && ppContext.getMacro(macroName.text()).isPresent();
                top.active = top.parentActive && !top.taken && defined;
                top.taken |= top.active;
                return true;
            }
            case "else" -> {
                Conditional top = conditionals.peek();
                if (top == null || top.sawElse) {
                    diagnostics.report(DiagCode.UNBALANCED_CONDITIONAL, directive.location(), name);
                    return true;
                }
                top.sawElse = true;
                top.active = top.parentActive && !top.taken;
                top.taken = true;
                return true;
            }
            case "endif" -> {
                if (conditionals.isEmpty()) {
                    diagnostics.report(DiagCode.UNBALANCED_CONDITIONAL, directive.location(), name);
                } else {
                    conditionals.pop();
                }
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private void handleDirective(String name, Token directive, Cursor cursor, List<Token> out, int depth) {
        switch (name) {
            case "define" -> define(directive, cursor);
            case "undef" -> {
                Token macroName = expectMacroName(directive, cursor);
                if (macroName != null) ppContext.undefine(macroName.text());
            }
            case "undefineall" -> ppContext.undefineAll();
            case "include" -> include(directive, cursor, out);
            case "__FILE__" -> out.add(new Token(TokenType.STRING_LITERAL, '"' + directive.fileName() + '"',
                    directive.fileName(), directive.line(), directive.column(), directive.fileName()));
            case "__LINE__" -> out.add(new Token(TokenType.INTEGER_LITERAL, String.valueOf(directive.line()),
                    IntegerLiteral.parse(String.valueOf(directive.line())), directive.line(), directive.column(), directive.fileName()));
            default -> {
                if (LINE_DIRECTIVES.contains(name)) {
                    cursor.restOfLine();
                } else if (!BARE_DIRECTIVES.contains(name)) {
                    ppContext.getMacro(name).ifPresentOrElse(
                            macro -> out.addAll(expandMacro(macro, directive, cursor, depth)),
                            () -> diagnostics.report(DiagCode.UNKNOWN_DIRECTIVE, directive.location(), name));
                }
            }
        }
    }

    private void define(Token directive, Cursor cursor) {
        Token name = expectMacroName(directive, cursor);
        if (name == null) {
            cursor.restOfLine();
            return;
        }

        boolean functionLike = cursor.check(TokenType.LEFT_PAREN)
                && cursor.peek().line() == name.line()
                && cursor.peek().column() == name.column() + name.text().length();
        List<MacroDefinition.Parameter> parameters = new ArrayList<>();
        if (functionLike) {
            cursor.advance();
            while (!cursor.isAtEnd() && !cursor.check(TokenType.NEWLINE)) {
                cursor.skipContinuations();
                Token param = cursor.advance();
                if (param.type() == TokenType.RIGHT_PAREN && parameters.isEmpty()) {
                    break;
                }
                if (param.type() != TokenType.IDENTIFIER) {
                    diagnostics.report(DiagCode.EXPECTED_TOKEN, param.location(), "macro argument name");
                    cursor.restOfLine();
                    return;
                }
                List<Token> defaultValue = null;
                if (cursor.check(TokenType.EQUALS)) {
                    cursor.advance();
                    defaultValue = cursor.collectUntilTopLevel(TokenType.COMMA, TokenType.RIGHT_PAREN);
                }
                parameters.add(new MacroDefinition.Parameter(param, defaultValue));
                cursor.skipContinuations();
                if (cursor.check(TokenType.COMMA)) {
                    cursor.advance();
                } else if (cursor.check(TokenType.RIGHT_PAREN)) {
                    cursor.advance();
                    break;
                } else {
                    diagnostics.report(DiagCode.EXPECTED_TOKEN, cursor.peek().location(), "')'");
                    cursor.restOfLine();
                    return;
                }
            }
        }

        List<Token> body = cursor.restOfLine();
        ppContext.registerMacro(new MacroDefinition(name, functionLike, parameters, body));
    }

    private List<Token> expandMacro(MacroDefinition macro, Token usage, Cursor cursor, int depth) {
        String name = macro.name().text();
        if (depth >= MAX_EXPANSION_DEPTH) {
            diagnostics.report(DiagCode.MACRO_EXPANSION_TOO_DEEP, usage.location(), name);
            return List.of();
        }

        Map<String, List<Token>> bindings = new HashMap<>();
        if (macro.functionLike()) {
            cursor.skipNewlines();
            if (!cursor.check(TokenType.LEFT_PAREN)) {
                diagnostics.report(DiagCode.EXPECTED_MACRO_ARGS, usage.location(), name);
                return List.of();
            }
            cursor.advance();
            List<List<Token>> actuals = cursor.collectArguments();
            List<MacroDefinition.Parameter> formals = macro.parameters();
            if (formals.isEmpty() && actuals.size() == 1 && actuals.get(0).isEmpty()) {
                actuals = List.of();
            }
            if (actuals.size() > formals.size()) {
                diagnostics.report(DiagCode.MACRO_ARGUMENT_COUNT, usage.location(), name, formals.size(), actuals.size());
                return List.of();
            }
            for (int i = 0; i < formals.size(); i++) {
                MacroDefinition.Parameter formal = formals.get(i);
                List<Token> actual = i < actuals.size() ? actuals.get(i) : null;
                if ((actual == null || actual.isEmpty()) && formal.defaultValue() != null) {
                    actual = formal.defaultValue();
                }
                if (actual == null) {
                    diagnostics.report(DiagCode.MACRO_ARGUMENT_COUNT, usage.location(), name, formals.size(), actuals.size());
                    return List.of();
                }
                bindings.put(formal.name().text(), actual);
            }
        }

        SourceLocation site = usage.location();
        List<Token> substituted = new ArrayList<>();
        for (Token bodyToken : macro.body()) {
            List<Token> replacement = bodyToken.type() == TokenType.IDENTIFIER ? bindings.get(bodyToken.text()) : null;
            if (replacement != null) {
                replacement.forEach(t -> substituted.add(t.relocate(site)));
            } else {
                substituted.add(bodyToken.relocate(site));
            }
        }
        return process(paste(substituted), depth + 1);
    }

    private static List<Token> paste(List<Token> tokens) {
        List<Token> result = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.OPERATOR && token.text().equals("``") && !result.isEmpty() && i + 1 < tokens.size()) {
                Token left = result.remove(result.size() - 1);
                Token right = tokens.get(++i);
                String text = left.text() + right.text();
                TokenType type = Lexer.isKeyword(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
                result.add(new Token(type, text, text, left.line(), left.column(), left.fileName()));
            } else if (!(token.type() == TokenType.OPERATOR && token.text().equals("``"))) {
                result.add(token);
            }
        }
        return result;
    }

    private void include(Token directive, Cursor cursor, List<Token> out) {
        String fileName = null;
        if (cursor.check(TokenType.STRING_LITERAL) && cursor.peek().line() == directive.line()) {
            fileName = (String) cursor.advance().value();
        } else if (cursor.check(TokenType.OPERATOR) && cursor.peek().text().equals("<")) {
            cursor.advance();
            StringBuilder sb = new StringBuilder();
            while (!cursor.isAtEnd() && !cursor.check(TokenType.NEWLINE)
                    && !(cursor.check(TokenType.OPERATOR) && cursor.peek().text().equals(">"))) {
                sb.append(cursor.advance().text());
            }
            if (cursor.check(TokenType.OPERATOR)) {
                cursor.advance();
                fileName = sb.toString();
            }
        }
        cursor.restOfLine();

        if (fileName == null || fileName.isEmpty()) {
            diagnostics.report(DiagCode.EXPECTED_INCLUDE_FILE, directive.location());
            return;
        }

        Path path;
        try {
            path = resolveInclude(fileName, directive.fileName());
        } catch (InvalidPathException e) {
            diagnostics.report(DiagCode.COULD_NOT_OPEN_INCLUDE, directive.location(), fileName, e.getMessage());
            return;
        }
        if (includeStack.contains(path)) {
            diagnostics.report(DiagCode.RECURSIVE_INCLUDE, directive.location(), fileName);
            return;
        }

        SourceBuffer buffer;
        try {
            buffer = sourceCache.readSource(path, library);
        } catch (IOException e) {
            diagnostics.report(DiagCode.COULD_NOT_OPEN_INCLUDE, directive.location(), fileName, e.toString());
            return;
        }
        out.addAll(expand(buffer));
    }

    private static Path resolveInclude(String fileName, String includingFile) {
        Path target = Path.of(fileName);
        if (!target.isAbsolute()) {
            Path parent = Path.of(includingFile).toAbsolutePath().getParent();
            if (parent != null) {
                Path sibling = parent.resolve(target);
                if (Files.exists(sibling) || !Files.exists(target)) {
                    target = sibling;
                }
            }
        }
        return target.toAbsolutePath().normalize();
    }

    private Token expectMacroName(Token directive, Cursor cursor) {
        if ((cursor.check(TokenType.IDENTIFIER) || cursor.check(TokenType.KEYWORD))
                && cursor.peek().line() == directive.line()) {
            return cursor.advance();
        }
        diagnostics.report(DiagCode.EXPECTED_MACRO_NAME, directive.location(), directive.value());
        return null;
    }

    private static final class Conditional {
        final Token opener;
        final boolean parentActive;
        boolean active;
        boolean taken;
        boolean sawElse;

        Conditional(Token opener, boolean parentActive, boolean active) {
            this.opener = opener;
            this.parentActive = parentActive;
            this.active = active;
            this.taken = active;
        }
    }

    /**
     * Sequential access to one token list.
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int current;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean isAtEnd() {
            return current >= tokens.size() || tokens.get(current).type() == TokenType.END_OF_FILE;
        }

        Token peek() {
            return current < tokens.size() ? tokens.get(current) : tokens.get(tokens.size() - 1);
        }

        boolean check(TokenType type) {
            return !isAtEnd() && peek().type() == type;
        }

        Token advance() {
            Token token = peek();
            if (current < tokens.size()) current++;
            return token;
        }

        void skipContinuations() {
            while (check(TokenType.LINE_CONTINUATION)) current++;
        }

        void skipNewlines() {
            while (check(TokenType.NEWLINE) || check(TokenType.LINE_CONTINUATION)) current++;
        }

        /** Consumes the remainder of the logical line, including continuations. */
        List<Token> restOfLine() {
            List<Token> line = new ArrayList<>();
            while (!isAtEnd()) {
                Token token = advance();
                if (token.type() == TokenType.NEWLINE) break;
                if (token.type() != TokenType.LINE_CONTINUATION) line.add(token);
            }
            return line;
        }

        /** Collects tokens up to (not including) one of the stop types at nesting level zero. */
        List<Token> collectUntilTopLevel(TokenType... stops) {
            List<Token> collected = new ArrayList<>();
            int nesting = 0;
            while (!isAtEnd()) {
                Token token = peek();
                if (nesting == 0 && List.of(stops).contains(token.type())) break;
                if (token.type() == TokenType.NEWLINE) break;
                nesting += nestingDelta(token);
                advance();
                if (token.type() != TokenType.LINE_CONTINUATION) collected.add(token);
            }
            return collected;
        }

        /** Collects comma separated arguments after an opening parenthesis, consuming the closing one. */
        List<List<Token>> collectArguments() {
            List<List<Token>> arguments = new ArrayList<>();
            List<Token> currentArg = new ArrayList<>();
            int nesting = 0;
            while (!isAtEnd()) {
                Token token = advance();
                TokenType type = token.type();
                if (type == TokenType.NEWLINE || type == TokenType.LINE_CONTINUATION) continue;
                if (nesting == 0 && type == TokenType.RIGHT_PAREN) {
                    arguments.add(currentArg);
                    return arguments;
                }
                if (nesting == 0 && type == TokenType.COMMA) {
                    arguments.add(currentArg);
                    currentArg = new ArrayList<>();
                    continue;
                }
                nesting += nestingDelta(token);
                currentArg.add(token);
            }
            arguments.add(currentArg);
            return arguments;
        }

        private static int nestingDelta(Token token) {
            return switch (token.type()) {
                case LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE -> 1;
                case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> -1;
                default -> 0;
            };
        }
    }
}
