package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.io.SourceBuffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses library map files:
 * <pre>
 *   library rtl "src/rtl/*.sv", src/common/...;
 *   library tb  tb/ -incdir tb/include;
 *   include ../shared/lib.map;
 *   config cfg; ... endconfig
 * </pre>
 * Paths are not tokenized like source code because they contain wildcard and
 * directory characters, so this parser scans characters directly.
 */
public class LibraryMapParser {

    private final SourceBuffer buffer;
    private final String source;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public LibraryMapParser(SourceBuffer buffer) {
        this.buffer = buffer;
        this.source = buffer.content();
    }

    /**
     * Parses the whole buffer. Errors are reported on the document and do not stop parsing.
     * @return The parsed document.
     */
    public LibraryMapDocument parse() {
        List<LibraryMapMember> members = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (isAtEnd()) break;

            SourceLocation location = location();
            if (peek() == ';') {
                advance();
                members.add(new EmptyMember(location));
                continue;
            }

            String word = readWord();
            switch (word) {
                case "library" -> {
                    LibraryDeclaration declaration = parseLibrary(location);
                    if (declaration != null) members.add(declaration);
                }
                case "include" -> {
                    FilePathSpec path = readPathSpec();
                    if (path != null) {
                        members.add(new LibraryIncludeStatement(path, location));
                        expectSemicolon();
                    } else {
                        skipToSemicolon();
                    }
                }
                case "config" -> members.add(parseConfig(location));
                default -> {
                    String found = word.isEmpty() ? String.valueOf(advance()) : word;
                    diagnostics.report(DiagCode.EXPECTED_LIBRARY_MAP_MEMBER, location, found);
                    skipToSemicolon();
                }
            }
        }
        return new LibraryMapDocument(buffer, members, diagnostics);
    }

    private LibraryDeclaration parseLibrary(SourceLocation location) {
        skipTrivia();
        String name = readWord();
        if (name.isEmpty()) {
            diagnostics.report(DiagCode.EXPECTED_LIBRARY_NAME, location());
            skipToSemicolon();
            return null;
        }

        List<FilePathSpec> filePaths = readPathList();
        List<FilePathSpec> includeDirs = List.of();
        skipTrivia();
        if (source.startsWith("-incdir", current)) {
            for (int i = 0; i < "-incdir".length(); i++) advance();
            includeDirs = readPathList();
        }
        expectSemicolon();
        return new LibraryDeclaration(name, filePaths, includeDirs, location);
    }

    private ConfigDeclaration parseConfig(SourceLocation location) {
        skipTrivia();
        String name = readWord();
        while (true) {
            skipTrivia();
            if (isAtEnd()) {
                diagnostics.report(DiagCode.MISSING_ENDCONFIG, location, name);
                break;
            }
            String word = readWord();
            if (word.equals("endconfig")) break;
            if (word.isEmpty()) advance();
        }
        return new ConfigDeclaration(name, location);
    }

    private List<FilePathSpec> readPathList() {
        List<FilePathSpec> paths = new ArrayList<>();
        FilePathSpec first = readPathSpec();
        if (first == null) return paths;
        paths.add(first);
        while (true) {
            skipTrivia();
            if (peek() != ',') break;
            advance();
            FilePathSpec next = readPathSpec();
            if (next == null) break;
            paths.add(next);
        }
        return paths;
    }

    private FilePathSpec readPathSpec() {
        skipTrivia();
        SourceLocation location = location();
        int start = current;
        if (peek() == '"') {
            advance();
            while (!isAtEnd() && peek() != '"' && peek() != '\n') advance();
            if (peek() == '"') advance();
        } else {
            while (!isAtEnd() && !Character.isWhitespace(peek()) && peek() != ',' && peek() != ';') advance();
        }
        if (current == start || source.startsWith("-incdir", start)) {
            current = start;
            diagnostics.report(DiagCode.EXPECTED_FILE_PATH, location);
            return null;
        }
        return new FilePathSpec(source.substring(start, current), location);
    }

    private String readWord() {
        int start = current;
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_' || peek() == '$')) advance();
        return source.substring(start, current);
    }

    private void expectSemicolon() {
        skipTrivia();
        if (peek() == ';') {
            advance();
        } else {
            diagnostics.report(DiagCode.EXPECTED_TOKEN, location(), "';'");
            skipToSemicolon();
        }
    }

    private void skipToSemicolon() {
        while (!isAtEnd() && peek() != ';') advance();
        if (!isAtEnd()) advance();
    }

    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private SourceLocation location() {
        return new SourceLocation(buffer.logicalName(), line, current - lineStart + 1);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }
}
