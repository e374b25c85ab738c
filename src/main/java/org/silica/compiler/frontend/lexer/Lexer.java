package org.silica.compiler.frontend.lexer;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Comments and attribute instances are dropped. Newlines and line continuations are
 * kept as tokens because the preprocessor needs them to find the end of directives.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "module", "endmodule", "macromodule", "interface", "endinterface", "program", "endprogram",
            "package", "endpackage", "class", "endclass", "function", "endfunction", "task", "endtask",
            "covergroup", "endgroup", "property", "endproperty", "sequence", "endsequence",
            "clocking", "endclocking", "specify", "endspecify", "generate", "endgenerate",
            "checker", "endchecker", "primitive", "endprimitive", "table", "endtable", "config", "endconfig",
            "begin", "end", "fork", "join", "join_any", "join_none", "case", "casex", "casez", "endcase",
            "if", "else", "for", "foreach", "while", "do", "repeat", "forever", "return", "break", "continue",
            "parameter", "localparam", "defparam", "specparam", "type", "import", "export",
            "input", "output", "inout", "ref", "wire", "tri", "wand", "wor", "supply0", "supply1", "uwire",
            "reg", "logic", "bit", "byte", "shortint", "int", "longint", "integer", "time",
            "real", "shortreal", "realtime", "string", "chandle", "event", "void",
            "signed", "unsigned", "assign", "always", "always_comb", "always_ff", "always_latch",
            "initial", "final", "typedef", "enum", "struct", "union", "packed", "modport",
            "extern", "virtual", "static", "automatic", "const", "var", "genvar", "local", "protected",
            "rand", "randc", "extends", "implements", "new", "null", "this", "super", "default",
            "posedge", "negedge", "or", "and", "not", "assert", "assume", "cover", "bind");

    private static final String[] OPERATORS = {
            "<<<=", ">>>=", "===", "!==", "==?", "!=?", "<<<", ">>>", "<<=", ">>=", "<->", "|->", "|=>",
            "==", "=>", "!=", "<=", ">=", "&&", "||", "**", "<<", ">>", "->", "++", "--", "+=", "-=", "*=", "/=",
            "%=", "&=", "|=", "^=", "~&", "~|", "~^", "^~", "+:", "-:", "##", "@@",
            "+", "-", "*", "/", "%", "<", ">", "!", "~", "&", "|", "^", "?", "@", "$"
    };

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Checks whether a word is a reserved keyword.
     * @param text The word to check.
     * @return {@code true} for keywords.
     */
    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\f' -> { }
            case '\n' -> {
                addToken(TokenType.NEWLINE);
                newLine();
            }
            case '(' -> {
                if (peek() == '*' && peekNext() != ')') {
                    attributeInstance();
                } else {
                    addToken(TokenType.LEFT_PAREN);
                }
            }
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case ':' -> {
                if (match(':')) addToken(TokenType.DOUBLE_COLON);
                else if (match('=') || match('/')) addToken(TokenType.OPERATOR);
                else addToken(TokenType.COLON);
            }
            case '#' -> {
                if (match('#')) addToken(TokenType.OPERATOR);
                else addToken(TokenType.HASH);
            }
            case '=' -> {
                if (peek() == '=' || peek() == '>') {
                    current--;
                    operator();
                } else {
                    addToken(TokenType.EQUALS);
                }
            }
            case '"' -> string();
            case '`' -> directive();
            case '\'' -> apostrophe();
            case '\\' -> {
                if (peek() == '\n' || (peek() == '\r' && peekNext() == '\n')) {
                    match('\r');
                    advance();
                    addToken(TokenType.LINE_CONTINUATION);
                    newLine();
                } else {
                    escapedIdentifier();
                }
            }
            case '/' -> {
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    current--;
                    operator();
                }
            }
            case '$' -> {
                if (isAlphaNumeric(peek())) {
                    while (isAlphaNumeric(peek())) advance();
                    addToken(TokenType.SYSTEM_IDENTIFIER);
                } else {
                    addToken(TokenType.OPERATOR);
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    current--;
                    operator();
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER, text);
    }

    private void escapedIdentifier() {
        while (!isAtEnd() && !Character.isWhitespace(peek())) advance();
        String text = source.substring(start, current);
        if (text.length() == 1) {
            report(DiagCode.UNEXPECTED_CHARACTER, "\\");
            return;
        }
        addToken(TokenType.IDENTIFIER, text.substring(1));
    }

    private void directive() {
        if (match('`')) {
            addToken(TokenType.OPERATOR); // token paste inside macro bodies
            return;
        }
        if (match('"')) {
            addToken(TokenType.OPERATOR); // stringification quote inside macro bodies
            return;
        }
        if (!isAlpha(peek())) {
            report(DiagCode.UNEXPECTED_CHARACTER, "`");
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.DIRECTIVE, source.substring(start + 1, current));
    }

    private void number() {
        while (isDigit(peek()) || peek() == '_') advance();

        // A size followed by a based literal: 8'hFF, 4 'b1010
        int save = current;
        skipInlineSpaces();
        if (peek() == '\'' && isBaseStart(peekNext(), peekAt(2))) {
            advance();
            basedLiteral();
            return;
        }
        current = save;

        boolean real = false;
        if (peek() == '.' && isDigit(peekNext())) {
            real = true;
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            real = true;
            advance();
            match('+');
            match('-');
            while (isDigit(peek()) || peek() == '_') advance();
        }

        String text = source.substring(start, current);
        if (real) {
            try {
                addToken(TokenType.REAL_LITERAL, Double.parseDouble(text.replace("_", "")));
            } catch (NumberFormatException e) {
                report(DiagCode.INVALID_NUMBER, text);
            }
            return;
        }
        literal(text);
    }

    private void apostrophe() {
        if (isBaseStart(peek(), peekNext())) {
            basedLiteral();
        } else if ("01xzXZ".indexOf(peek()) >= 0 && !isAlphaNumeric(peekNext())) {
            advance();
            literal(source.substring(start, current));
        } else {
            addToken(TokenType.APOSTROPHE);
        }
    }

    private void basedLiteral() {
        // positioned after the apostrophe
        match('s');
        match('S');
        advance(); // base character
        skipInlineSpaces();
        while (isAlphaNumeric(peek()) || peek() == '?') advance();
        literal(source.substring(start, current));
    }

    private void literal(String text) {
        try {
            addToken(TokenType.INTEGER_LITERAL, IntegerLiteral.parse(text));
        } catch (NumberFormatException e) {
            report(DiagCode.INVALID_NUMBER, text.strip());
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                report(DiagCode.UNTERMINATED_STRING);
                newLine();
                return;
            }
            if (c == '\\' && !isAtEnd()) {
                char e = advance();
                switch (e) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '\n' -> newLine();
                    default -> value.append(e);
                }
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            report(DiagCode.UNTERMINATED_STRING);
            return;
        }

        // The closing "
        advance();
        // The text of the token is the string *with* quotes, the value is the content.
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
        report(DiagCode.UNTERMINATED_BLOCK_COMMENT);
    }

    private void attributeInstance() {
        advance(); // '*'
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == ')') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
        report(DiagCode.UNTERMINATED_BLOCK_COMMENT);
    }

    private void operator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, current)) {
                current += op.length();
                addToken(TokenType.OPERATOR);
                return;
            }
        }
        char c = advance();
        report(DiagCode.UNEXPECTED_CHARACTER, String.valueOf(c));
    }

    private boolean isBaseStart(char c, char next) {
        if (c == 's' || c == 'S') {
            c = next;
        }
        return "bBoOdDhH".indexOf(c) >= 0 && c != '\0';
    }

    private void skipInlineSpaces() {
        while (peek() == ' ' || peek() == '\t') advance();
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void report(DiagCode code, Object... args) {
        diagnostics.report(code, new SourceLocation(logicalFileName, startLine, startColumn), args);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, startLine, startColumn, logicalFileName));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '$';
    }
}
