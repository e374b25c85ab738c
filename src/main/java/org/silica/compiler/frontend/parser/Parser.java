package org.silica.compiler.frontend.parser;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.lexer.Token;
import org.silica.compiler.frontend.lexer.TokenType;
import org.silica.compiler.frontend.parser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The parser for the hardware description language. It consumes the preprocessed token
 * stream and produces an Abstract Syntax Tree (AST) of the parts of the language the
 * front end cares about: design element and class declarations, parameters, package
 * imports and hierarchy instantiations.
 * <p>
 * Everything else (procedural code, nets, assertions) is scanned over without building
 * nodes. While scanning, the parser still records every {@code name::} scope reference
 * in the {@link ParserMetadata}, together with the declared and instantiated names.
 */
public class Parser {

    private static final Set<String> TYPE_KEYWORDS = Set.of(
            "bit", "logic", "reg", "byte", "shortint", "int", "longint", "integer", "time",
            "real", "shortreal", "realtime", "string");
    private static final Set<String> DIRECTIONS = Set.of("input", "output", "inout", "ref");
    private static final Set<String> DECLARATION_ENDS = Set.of(
            "endmodule", "endinterface", "endprogram", "endpackage", "endclass");
    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "typedef", "extern", "pure", "modport", "export", "defparam", "bind", "let", "nettype");
    private static final Map<String, String> SKIPPED_BLOCKS = Map.of(
            "function", "endfunction",
            "task", "endtask",
            "covergroup", "endgroup",
            "property", "endproperty",
            "sequence", "endsequence",
            "clocking", "endclocking",
            "specify", "endspecify",
            "checker", "endchecker",
            "primitive", "endprimitive",
            "config", "endconfig");
    private static final Set<String> UNARY_OPERATORS = Set.of("+", "-", "!", "~", "&", "|", "^", "~&", "~|", "~^", "^~");
    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1), Map.entry("&&", 2), Map.entry("|", 3),
            Map.entry("^", 4), Map.entry("~^", 4), Map.entry("^~", 4), Map.entry("&", 5),
            Map.entry("==", 6), Map.entry("!=", 6), Map.entry("===", 6), Map.entry("!==", 6),
            Map.entry("==?", 6), Map.entry("!=?", 6),
            Map.entry("<", 7), Map.entry("<=", 7), Map.entry(">", 7), Map.entry(">=", 7),
            Map.entry("<<", 8), Map.entry(">>", 8), Map.entry("<<<", 8), Map.entry(">>>", 8),
            Map.entry("+", 9), Map.entry("-", 9),
            Map.entry("*", 10), Map.entry("/", 10), Map.entry("%", 10),
            Map.entry("**", 11));

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final ParserMetadata metadata = new ParserMetadata();
    private final Deque<DeclarationFrame> declarationFrames = new ArrayDeque<>();
    private int current = 0;

    /**
     * Definitions declared inside one design element and the definitions it instantiates.
     */
    private static final class DeclarationFrame {
        private final Set<String> nestedNames = new HashSet<>();
        private final Set<String> instances = new LinkedHashSet<>();
    }

    /**
     * Constructs a new Parser.
     * @param tokens The preprocessed tokens, terminated by an end-of-file token.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = terminated(tokens);
        this.diagnostics = diagnostics;
    }

    private static List<Token> terminated(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.END_OF_FILE) {
            return tokens;
        }
        List<Token> copy = new ArrayList<>(tokens);
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        copy.add(last == null
                ? new Token(TokenType.END_OF_FILE, "", null, 1, 1, "<empty>")
                : new Token(TokenType.END_OF_FILE, "", null, last.line(), last.column() + last.text().length(), last.fileName()));
        return copy;
    }

    /**
     * Parses the entire token stream.
     * @return The root node.
     */
    public CompilationUnitNode parse() {
        SourceLocation start = peek().location();
        return new CompilationUnitNode(parseMembers(null, 0), start);
    }

    /**
     * @return The facts collected while parsing.
     */
    public ParserMetadata getMetadata() {
        return metadata;
    }

    // region Members

    private List<AstNode> parseMembers(String endKeyword, int depth) {
        List<AstNode> members = new ArrayList<>();
        while (!isAtEnd() && !(endKeyword != null && checkKeyword(endKeyword))) {
            int before = current;
            try {
                parseMember(members, depth);
            } catch (ParseError e) {
                synchronize();
            }
            if (current == before) {
                advance();
            }
        }
        return members;
    }

    private void parseMember(List<AstNode> out, int depth) {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER) {
            if (isInstantiationAhead()) {
                out.add(parseInstantiation());
            } else {
                advance();
            }
            return;
        }
        if (token.type() != TokenType.KEYWORD) {
            advance();
            return;
        }

        String keyword = token.text();
        DeclarationKind kind = DeclarationKind.fromKeyword(keyword);
        if (kind == DeclarationKind.INTERFACE && checkKeywordAt(1, "class")) {
            advance();
            out.add(parseClass(depth));
            return;
        }
        if (kind != null) {
            out.add(parseModuleDeclaration(kind, depth));
            return;
        }

        switch (keyword) {
            case "class" -> out.add(parseClass(depth));
            case "virtual" -> {
                if (checkKeywordAt(1, "class")) {
                    advance();
                    out.add(parseClass(depth));
                } else if (checkKeywordAt(1, "function") || checkKeywordAt(1, "task")) {
                    advance();
                } else {
                    skipStatement();
                }
            }
            case "import" -> parseImport(out);
            case "parameter", "localparam" -> out.add(parseParameterDeclaration());
            default -> {
                String blockEnd = SKIPPED_BLOCKS.get(keyword);
                if (STATEMENT_KEYWORDS.contains(keyword)) {
                    skipStatement();
                } else if (blockEnd != null && isBlockStart(keyword)) {
                    skipBlock(blockEnd);
                } else {
                    advance();
                }
            }
        }
    }

    private ModuleDeclarationNode parseModuleDeclaration(DeclarationKind kind, int depth) {
        advance();
        if (!matchKeyword("static")) matchKeyword("automatic");
        Token name = consumeIdentifier("a " + kind.name().toLowerCase() + " name");

        List<AstNode> members = new ArrayList<>();
        while (checkKeyword("import")) {
            parseImport(members);
        }
        ParameterPortListNode parameterPorts = check(TokenType.HASH) ? parseParameterPortList() : null;
        if (check(TokenType.LEFT_PAREN)) {
            parsePortList();
        }
        expect(TokenType.SEMICOLON, "';'");

        if (!declarationFrames.isEmpty()) {
            declarationFrames.peek().nestedNames.add(name.name());
        }
        declarationFrames.push(new DeclarationFrame());
        try {
            members.addAll(parseMembers(kind.endKeyword(), depth + 1));
            closeDeclaration(kind.endKeyword(), name);
        } finally {
            popDeclarationFrame();
        }

        ModuleDeclarationNode node = new ModuleDeclarationNode(kind, name, parameterPorts, members);
        if (depth == 0) {
            metadata.addDeclaration(node);
        }
        return node;
    }

    // instances of definitions nested in the element are resolved locally
    private void popDeclarationFrame() {
        DeclarationFrame frame = declarationFrames.pop();
        frame.instances.removeAll(frame.nestedNames);
        if (declarationFrames.isEmpty()) {
            frame.instances.forEach(metadata::addGlobalInstance);
        } else {
            declarationFrames.peek().instances.addAll(frame.instances);
        }
    }

    private void recordInstance(String definitionName) {
        if (declarationFrames.isEmpty()) {
            metadata.addGlobalInstance(definitionName);
        } else {
            declarationFrames.peek().instances.add(definitionName);
        }
    }

    private ClassDeclarationNode parseClass(int depth) {
        advance();
        if (!matchKeyword("static")) matchKeyword("automatic");
        Token name = consumeIdentifier("a class name");
        ParameterPortListNode parameterPorts = check(TokenType.HASH) ? parseParameterPortList() : null;
        // extends / implements clauses
        skipStatement();

        List<AstNode> members = parseMembers("endclass", depth + 1);
        closeDeclaration("endclass", name);

        ClassDeclarationNode node = new ClassDeclarationNode(name, parameterPorts, members);
        if (depth == 0) {
            metadata.addClassDeclaration(node);
        }
        return node;
    }

    private void closeDeclaration(String endKeyword, Token name) {
        if (!matchKeyword(endKeyword)) {
            diagnostics.report(DiagCode.MISSING_END_KEYWORD, name.location(), endKeyword, name.name());
            return;
        }
        if (match(TokenType.COLON) && check(TokenType.IDENTIFIER)) {
            advance();
        }
    }

    private void parsePortList() {
        advance(); // '('
        boolean sawDirection = false;
        while (!isAtEnd() && !match(TokenType.RIGHT_PAREN)) {
            List<Token> entry = new ArrayList<>();
            int nesting = 0;
            while (!isAtEnd()) {
                Token t = peek();
                if (nesting == 0 && (t.type() == TokenType.COMMA || t.type() == TokenType.RIGHT_PAREN)) break;
                nesting += nestingDelta(t);
                entry.add(advance());
            }

            if (!entry.isEmpty()) {
                Token first = entry.get(0);
                if (first.type() == TokenType.KEYWORD && DIRECTIONS.contains(first.text())) {
                    sawDirection = true;
                } else if (!sawDirection && first.type() == TokenType.IDENTIFIER && isInterfacePort(entry)) {
                    metadata.addInterfacePort(first.name());
                }
            }
            match(TokenType.COMMA);
        }
    }

    private static boolean isInterfacePort(List<Token> entry) {
        if (entry.size() >= 2 && entry.get(1).type() == TokenType.IDENTIFIER) {
            return true;
        }
        return entry.size() >= 4
                && entry.get(1).type() == TokenType.DOT
                && entry.get(2).type() == TokenType.IDENTIFIER
                && entry.get(3).type() == TokenType.IDENTIFIER;
    }

    private void parseImport(List<AstNode> out) {
        advance(); // 'import'
        if (check(TokenType.STRING_LITERAL)) {
            skipStatement(); // DPI import
            return;
        }
        do {
            Token packageName = consumeIdentifier("a package name");
            consume(TokenType.DOUBLE_COLON, "'::'");
            Token item = null;
            if (check(TokenType.OPERATOR) && peek().text().equals("*")) {
                advance();
            } else {
                item = consumeIdentifier("an import item");
            }
            metadata.addPackageImport(packageName.name());
            out.add(new PackageImportNode(packageName, item));
        } while (match(TokenType.COMMA));
        expect(TokenType.SEMICOLON, "';'");
    }

    private HierarchyInstantiationNode parseInstantiation() {
        Token type = advance();
        ParameterValueAssignmentNode parameters = check(TokenType.HASH) ? parseParameterValueAssignment() : null;

        List<Token> instanceNames = new ArrayList<>();
        do {
            Token name = consumeIdentifier("an instance name");
            while (check(TokenType.LEFT_BRACKET)) {
                skipBalanced();
            }
            if (check(TokenType.LEFT_PAREN)) {
                skipBalanced();
            } else {
                diagnostics.report(DiagCode.EXPECTED_TOKEN, peek().location(), "'('");
            }
            instanceNames.add(name);
        } while (match(TokenType.COMMA));
        expect(TokenType.SEMICOLON, "';'");

        recordInstance(type.name());
        return new HierarchyInstantiationNode(type, parameters, instanceNames);
    }

    // endregion

    // region Parameters

    private ParamDeclNode parseParameterDeclaration() {
        Token keyword = advance();
        ParamDeclNode declaration;
        if (checkKeyword("type")) {
            Token typeKeyword = advance();
            List<TypeAssignmentNode> assignments = new ArrayList<>();
            do {
                assignments.add(parseTypeAssignment());
            } while (match(TokenType.COMMA));
            declaration = new TypeParameterDeclarationNode(keyword, typeKeyword, assignments);
        } else {
            DataTypeNode type = parseDataTypeOrImplicit();
            List<DeclaratorNode> declarators = new ArrayList<>();
            do {
                declarators.add(parseDeclarator());
            } while (match(TokenType.COMMA));
            declaration = new ParameterDeclarationNode(keyword, type, declarators);
        }
        expect(TokenType.SEMICOLON, "';'");
        return declaration;
    }

    private ParameterPortListNode parseParameterPortList() {
        Token hash = advance();
        if (!check(TokenType.LEFT_PAREN)) {
            diagnostics.report(DiagCode.EXPECTED_TOKEN, peek().location(), "'('");
            return new ParameterPortListNode(hash, List.of());
        }
        int close = findClosing(current);
        advance();

        List<ParamDeclNode> declarations = new ArrayList<>();
        try {
            while (current < close) {
                Token keyword = null;
                if (checkKeyword("parameter") || checkKeyword("localparam")) {
                    keyword = advance();
                }
                if (checkKeyword("type")) {
                    Token typeKeyword = advance();
                    declarations.add(new TypeParameterDeclarationNode(keyword, typeKeyword, List.of(parseTypeAssignment())));
                } else if (keyword == null && isBareDeclarator() && !declarations.isEmpty()) {
                    // A bare name continues the previous declaration, keeping its kind and type.
                    ParamDeclNode previous = declarations.remove(declarations.size() - 1);
                    if (previous instanceof TypeParameterDeclarationNode typeDecl) {
                        declarations.add(typeDecl.withAssignment(parseTypeAssignment()));
                    } else {
                        declarations.add(((ParameterDeclarationNode) previous).withDeclarator(parseDeclarator()));
                    }
                } else {
                    DataTypeNode type = parseDataTypeOrImplicit();
                    declarations.add(new ParameterDeclarationNode(keyword, type, List.of(parseDeclarator())));
                }
                if (!match(TokenType.COMMA)) break;
            }
            if (current < close) {
                diagnostics.report(DiagCode.EXPECTED_TOKEN, peek().location(), "')'");
            }
        } catch (ParseError e) {
            // already reported; resume after the list
        }
        current = close;
        match(TokenType.RIGHT_PAREN);
        return new ParameterPortListNode(hash, declarations);
    }

    private ParameterValueAssignmentNode parseParameterValueAssignment() {
        Token hash = advance();
        if (!check(TokenType.LEFT_PAREN)) {
            // #5 or #WIDTH
            Token value = peek();
            if (value.type() == TokenType.INTEGER_LITERAL || value.type() == TokenType.REAL_LITERAL) {
                return new ParameterValueAssignmentNode(hash, List.of(new OrderedParamAssignmentNode(new LiteralNode(advance()))));
            }
            if (value.type() == TokenType.IDENTIFIER) {
                return new ParameterValueAssignmentNode(hash, List.of(new OrderedParamAssignmentNode(new IdentifierNode(advance()))));
            }
            diagnostics.report(DiagCode.EXPECTED_EXPRESSION, value.location());
            return new ParameterValueAssignmentNode(hash, List.of());
        }

        int close = findClosing(current);
        advance();
        List<ParamAssignmentNode> assignments = new ArrayList<>();
        try {
            while (current < close) {
                if (check(TokenType.DOT)) {
                    Token dot = advance();
                    Token name = consumeIdentifier("a parameter name");
                    consume(TokenType.LEFT_PAREN, "'('");
                    AstNode value = check(TokenType.RIGHT_PAREN) ? null : parseParamValue();
                    consume(TokenType.RIGHT_PAREN, "')'");
                    assignments.add(new NamedParamAssignmentNode(dot, name, value));
                } else {
                    assignments.add(new OrderedParamAssignmentNode(parseParamValue()));
                }
                if (!match(TokenType.COMMA)) break;
            }
            if (current < close) {
                diagnostics.report(DiagCode.EXPECTED_TOKEN, peek().location(), "')'");
            }
        } catch (ParseError e) {
            // already reported; resume after the list
        }
        current = close;
        match(TokenType.RIGHT_PAREN);
        return new ParameterValueAssignmentNode(hash, assignments);
    }

    private AstNode parseParamValue() {
        if (isTypeKeyword(peek())) {
            return parseKeywordType();
        }
        return parseValueExpression();
    }

    private DeclaratorNode parseDeclarator() {
        Token name = consumeIdentifier("a parameter name");
        while (check(TokenType.LEFT_BRACKET)) {
            skipBalanced(); // unpacked dimensions
        }
        ExpressionNode initializer = match(TokenType.EQUALS) ? parseValueExpression() : null;
        return new DeclaratorNode(name, initializer);
    }

    private TypeAssignmentNode parseTypeAssignment() {
        Token name = consumeIdentifier("a type parameter name");
        DataTypeNode defaultType = null;
        if (match(TokenType.EQUALS)) {
            if (isTypeKeyword(peek())) {
                defaultType = parseKeywordType();
            } else if (check(TokenType.IDENTIFIER)) {
                defaultType = parseNamedType();
            } else {
                diagnostics.report(DiagCode.EXPECTED_TOKEN, peek().location(), "a data type");
                collectUntilTerminator();
            }
        }
        return new TypeAssignmentNode(name, defaultType);
    }

    private boolean isBareDeclarator() {
        if (!check(TokenType.IDENTIFIER)) return false;
        TokenType next = tokenAt(current + 1).type();
        return next != TokenType.IDENTIFIER && next != TokenType.DOUBLE_COLON && next != TokenType.HASH;
    }

    // endregion

    // region Data types

    private DataTypeNode parseDataTypeOrImplicit() {
        Token start = peek();
        if (isTypeKeyword(start)) {
            return parseKeywordType();
        }
        if (checkKeyword("signed") || checkKeyword("unsigned") || check(TokenType.LEFT_BRACKET)) {
            Token signing = checkKeyword("signed") || checkKeyword("unsigned") ? advance() : null;
            return new ImplicitTypeNode(signing, parseDimensions(), start.location());
        }
        if (check(TokenType.IDENTIFIER) && !isBareDeclarator()) {
            return parseNamedType();
        }
        return new ImplicitTypeNode(null, List.of(), start.location());
    }

    private KeywordTypeNode parseKeywordType() {
        Token keyword = advance();
        Token signing = checkKeyword("signed") || checkKeyword("unsigned") ? advance() : null;
        return new KeywordTypeNode(keyword, signing, parseDimensions());
    }

    private NamedTypeNode parseNamedType() {
        Token first = consumeIdentifier("a type name");
        ExpressionNode name = new IdentifierNode(first);
        if (match(TokenType.DOUBLE_COLON)) {
            name = new ScopedNameNode(first, consumeIdentifier("a type name"));
        }
        if (check(TokenType.HASH) && tokenAt(current + 1).type() == TokenType.LEFT_PAREN) {
            advance();
            skipBalanced(); // class specialization
        }
        return new NamedTypeNode(name, parseDimensions());
    }

    private List<RangeNode> parseDimensions() {
        List<RangeNode> dimensions = new ArrayList<>();
        while (check(TokenType.LEFT_BRACKET)) {
            int close = findClosing(current);
            advance();
            try {
                ExpressionNode left = parseExpression();
                ExpressionNode right = match(TokenType.COLON) ? parseExpression() : left;
                if (current != close) throw new ParseError();
                dimensions.add(new RangeNode(left, right));
            } catch (ParseError e) {
                diagnostics.report(DiagCode.EXPECTED_EXPRESSION, peek().location());
            }
            current = close;
            match(TokenType.RIGHT_BRACKET);
        }
        return dimensions;
    }

    private static boolean isTypeKeyword(Token token) {
        return token.type() == TokenType.KEYWORD && TYPE_KEYWORDS.contains(token.text());
    }

    // endregion

    // region Expressions

    /**
     * Parses an expression up to the next top-level ',', ';' or ')'. Anything the
     * expression grammar does not model becomes an {@link OpaqueExpressionNode}.
     */
    private ExpressionNode parseValueExpression() {
        int start = current;
        try {
            ExpressionNode expression = parseExpression();
            if (isTerminator(peek())) {
                return expression;
            }
        } catch (ParseError e) {
            // fall through to the opaque form
        }
        current = start;
        List<Token> opaque = collectUntilTerminator();
        if (opaque.isEmpty()) {
            diagnostics.report(DiagCode.EXPECTED_EXPRESSION, peek().location());
        }
        return new OpaqueExpressionNode(opaque);
    }

    private ExpressionNode parseExpression() {
        ExpressionNode condition = parseBinary(1);
        if (check(TokenType.OPERATOR) && peek().text().equals("?")) {
            advance();
            ExpressionNode whenTrue = parseExpression();
            if (!match(TokenType.COLON)) throw new ParseError();
            ExpressionNode whenFalse = parseExpression();
            return new ConditionalNode(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private ExpressionNode parseBinary(int minPrecedence) {
        ExpressionNode left = parseUnary();
        while (true) {
            Token operator = peek();
            Integer precedence = operator.type() == TokenType.OPERATOR ? BINARY_PRECEDENCE.get(operator.text()) : null;
            if (precedence == null || precedence < minPrecedence) {
                return left;
            }
            advance();
            left = new BinaryNode(left, operator, parseBinary(precedence + 1));
        }
    }

    private ExpressionNode parseUnary() {
        if (check(TokenType.OPERATOR) && UNARY_OPERATORS.contains(peek().text())) {
            Token operator = advance();
            return new UnaryNode(operator, parseUnary());
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER_LITERAL, REAL_LITERAL, STRING_LITERAL -> {
                return new LiteralNode(advance());
            }
            case IDENTIFIER -> {
                Token first = advance();
                ExpressionNode name = new IdentifierNode(first);
                if (match(TokenType.DOUBLE_COLON)) {
                    if (!check(TokenType.IDENTIFIER)) throw new ParseError();
                    name = new ScopedNameNode(first, advance());
                }
                if (check(TokenType.LEFT_PAREN) || check(TokenType.LEFT_BRACKET) || check(TokenType.DOT) || check(TokenType.APOSTROPHE)) {
                    throw new ParseError();
                }
                return name;
            }
            case SYSTEM_IDENTIFIER -> {
                Token name = advance();
                List<ExpressionNode> arguments = new ArrayList<>();
                if (match(TokenType.LEFT_PAREN) && !match(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(parseExpression());
                    } while (match(TokenType.COMMA));
                    if (!match(TokenType.RIGHT_PAREN)) throw new ParseError();
                }
                return new SystemCallNode(name, arguments);
            }
            case LEFT_PAREN -> {
                advance();
                ExpressionNode inner = parseExpression();
                if (!match(TokenType.RIGHT_PAREN)) throw new ParseError();
                return inner;
            }
            default -> throw new ParseError();
        }
    }

    private static boolean isTerminator(Token token) {
        return switch (token.type()) {
            case COMMA, SEMICOLON, RIGHT_PAREN, END_OF_FILE -> true;
            default -> false;
        };
    }

    private List<Token> collectUntilTerminator() {
        List<Token> collected = new ArrayList<>();
        int nesting = 0;
        while (!isAtEnd()) {
            Token token = peek();
            if (nesting == 0 && isTerminator(token)) break;
            nesting += nestingDelta(token);
            collected.add(advance());
        }
        return collected;
    }

    // endregion

    // region Skipping

    private boolean isBlockStart(String keyword) {
        return switch (keyword) {
            case "property", "sequence" -> tokenAt(current + 1).type() == TokenType.IDENTIFIER;
            case "clocking" -> isOperatorAt(current + 1, "@")
                    || (tokenAt(current + 1).type() == TokenType.IDENTIFIER && isOperatorAt(current + 2, "@"));
            default -> true;
        };
    }

    private void skipBlock(String endKeyword) {
        Token start = advance();
        while (!isAtEnd() && !checkKeyword(endKeyword)) {
            advance();
        }
        if (!matchKeyword(endKeyword)) {
            diagnostics.report(DiagCode.MISSING_END_KEYWORD, start.location(), endKeyword, start.text());
            return;
        }
        if (match(TokenType.COLON) && check(TokenType.IDENTIFIER)) {
            advance();
        }
    }

    private void skipStatement() {
        int nesting = 0;
        while (!isAtEnd()) {
            Token token = peek();
            if (nesting == 0 && token.type() == TokenType.KEYWORD && DECLARATION_ENDS.contains(token.text())) {
                return;
            }
            advance();
            nesting += nestingDelta(token);
            if (nesting <= 0 && token.type() == TokenType.SEMICOLON) {
                return;
            }
        }
    }

    private void synchronize() {
        skipStatement();
    }

    private void skipBalanced() {
        int close = findClosing(current);
        while (current <= close && !isAtEnd()) {
            advance();
        }
    }

    private boolean isInstantiationAhead() {
        int i = current + 1;
        if (tokenAt(i).type() == TokenType.HASH) {
            i++;
            i = tokenAt(i).type() == TokenType.LEFT_PAREN ? findClosing(i) + 1 : i + 1;
        }
        if (tokenAt(i).type() != TokenType.IDENTIFIER) return false;
        i++;
        while (tokenAt(i).type() == TokenType.LEFT_BRACKET) {
            i = findClosing(i) + 1;
        }
        return tokenAt(i).type() == TokenType.LEFT_PAREN;
    }

    /** Returns the index of the token closing the bracket at {@code openIndex}, or the last index. */
    private int findClosing(int openIndex) {
        int nesting = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.END_OF_FILE) return i;
            nesting += nestingDelta(token);
            if (nesting == 0) return i;
        }
        return tokens.size() - 1;
    }

    private static int nestingDelta(Token token) {
        return switch (token.type()) {
            case LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE -> 1;
            case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> -1;
            default -> 0;
        };
    }

    // endregion

    // region Token access

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        diagnostics.report(DiagCode.EXPECTED_TOKEN, peek().location(), expected);
        throw new ParseError();
    }

    private Token consumeIdentifier(String expected) {
        return consume(TokenType.IDENTIFIER, expected);
    }

    private void expect(TokenType type, String expected) {
        if (!match(type)) {
            diagnostics.report(DiagCode.EXPECTED_TOKEN, previousOrCurrent().location(), expected);
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkKeyword(String keyword) {
        return checkKeywordAt(0, keyword);
    }

    private boolean checkKeywordAt(int offset, String keyword) {
        Token token = tokenAt(current + offset);
        return token.type() == TokenType.KEYWORD && token.text().equals(keyword);
    }

    private boolean isOperatorAt(int index, String operator) {
        Token token = tokenAt(index);
        return token.type() == TokenType.OPERATOR && token.text().equals(operator);
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        if (token.type() == TokenType.IDENTIFIER && check(TokenType.DOUBLE_COLON)) {
            metadata.addClassPackageName(token.name());
        }
        return token;
    }

    private Token peek() {
        return tokenAt(current);
    }

    private Token previousOrCurrent() {
        return current > 0 ? tokenAt(current - 1) : peek();
    }

    private Token tokenAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    // endregion

    /**
     * Signals that the current construct could not be parsed. Callers either report
     * and resynchronize or fall back to an opaque form.
     */
    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
