package org.snrasm.compiler.frontend.parser;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.parser.cst.TreeBuilder;
import org.snrasm.compiler.frontend.parser.features.IKeywordHandler;
import org.snrasm.compiler.frontend.parser.features.KeywordHandlerRegistry;
import org.snrasm.compiler.isa.InstructionFlag;

import java.util.List;
import java.util.Optional;

/**
 * The Parser turns the token stream of one source text into a lossless concrete syntax tree.
 * Statements are parsed by recursive descent, expressions by precedence climbing.
 * <p>
 * The parser never throws: unexpected input is reported and wrapped into
 * {@link SyntaxKind#ERROR} nodes, and parsing resumes at the next statement boundary.
 */
public class Parser implements ParsingContext {

    /** The label that marks the dispatch block of a scenario. */
    public static final String ENTRY_LABEL = "ENTRY";

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final KeywordHandlerRegistry keywordRegistry;
    private final TreeBuilder builder = new TreeBuilder();
    private int current = 0;
    /** Inside brackets newlines do not end the statement. */
    private int nesting = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, including trivia and the end-of-file token.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.keywordRegistry = KeywordHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream.
     * @return The {@link SyntaxKind#SOURCE_FILE} root; its text equals the lexed input.
     */
    public SyntaxNode parse() {
        builder.startNode(SyntaxKind.SOURCE_FILE);
        while (!isAtEnd()) {
            if (check(TokenType.NEWLINE)) {
                advance();
            } else if (check(TokenType.KEYWORD)) {
                declaration();
            } else {
                scriptBlock();
            }
        }
        while (current < tokens.size()) {
            builder.token(tokens.get(current++));
        }
        builder.finishNode();
        return builder.finish();
    }

    private void declaration() {
        Token keyword = peek();
        Optional<IKeywordHandler> handler = keywordRegistry.get(keyword.text());
        if (handler.isPresent()) {
            handler.get().parse(this);
        } else {
            recover("Unexpected `" + keyword.text() + "` outside of a function or subroutine");
        }
    }

    private void scriptBlock() {
        boolean entry = isLabelStart() && peek().text().equals(ENTRY_LABEL);
        builder.startNode(entry ? SyntaxKind.JUMP_TABLE_BLOCK : SyntaxKind.SCRIPT_BLOCK);
        if (isLabelStart()) {
            label();
        }
        while (!isAtEnd() && !check(TokenType.KEYWORD)) {
            if (check(TokenType.NEWLINE)) {
                advance();
            } else if (isLabelStart()) {
                break;
            } else {
                statement();
            }
        }
        builder.finishNode();
    }

    @Override
    public boolean body(String terminator) {
        while (!isAtEnd()) {
            if (check(TokenType.NEWLINE)) {
                advance();
            } else if (check(TokenType.KEYWORD)) {
                String keyword = peek().text();
                if (keyword.equals(terminator)) {
                    return true;
                }
                if (keyword.equals("endfun") || keyword.equals("endsub")) {
                    recover("Expected `" + terminator + "`, found `" + keyword + "`");
                } else {
                    return false;
                }
            } else if (isLabelStart()) {
                label();
            } else {
                statement();
            }
        }
        return false;
    }

    private void label() {
        builder.startNode(SyntaxKind.LABEL);
        advance();
        advance();
        builder.finishNode();
    }

    private void statement() {
        if (check(TokenType.IDENTIFIER)) {
            instruction();
        } else {
            recover("Expected an instruction, found " + peek().type().describe());
        }
    }

    private void instruction() {
        builder.startNode(SyntaxKind.INSTRUCTION);
        advance(); // mnemonic
        if (!atLineEnd()) {
            builder.startNode(SyntaxKind.ARGUMENT_LIST);
            argument();
            while (match(TokenType.COMMA)) {
                argument();
            }
            if (!atLineEnd()) {
                recover("Expected `,` or end of line, found " + peek().type().describe());
            }
            builder.finishNode();
        }
        builder.finishNode();
    }

    private void argument() {
        if (check(TokenType.IDENTIFIER) && InstructionFlag.fromSourceName(peek().text()).isPresent()) {
            TokenType next = peekNext().type();
            if (next == TokenType.COMMA || next == TokenType.NEWLINE || next == TokenType.END_OF_FILE) {
                builder.startNode(SyntaxKind.FLAG);
                advance();
                builder.finishNode();
                return;
            }
        }
        expression();
    }

    // --- Expressions ---

    @Override
    public void expression() {
        expression(0);
    }

    private void expression(int minBindingPower) {
        TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
        unary();
        while (true) {
            int bindingPower = infixBindingPower(peek());
            if (bindingPower <= minBindingPower) {
                break;
            }
            builder.startNodeAt(checkpoint, SyntaxKind.BINARY_EXPR);
            advance(); // operator
            expression(bindingPower);
            builder.finishNode();
        }
    }

    /**
     * Returns the binding power of an infix operator; all operators are left associative.
     * @param token The candidate operator.
     * @return The binding power, or 0 if the token is not an infix operator.
     */
    static int infixBindingPower(Token token) {
        return switch (token.type()) {
            case PIPE_PIPE -> 3;
            case AMP_AMP -> 4;
            case EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> 5;
            case PIPE -> 6;
            case CARET -> 7;
            case AMP -> 8;
            case SHIFT_LEFT, SHIFT_RIGHT -> 9;
            case PLUS, MINUS -> 10;
            case STAR, SLASH, DOT_STAR, DOT_SLASH -> 11;
            case IDENTIFIER -> token.text().equals("mod") ? 11 : 0;
            default -> 0;
        };
    }

    private void unary() {
        if (check(TokenType.MINUS) || check(TokenType.BANG) || check(TokenType.TILDE)) {
            builder.startNode(SyntaxKind.PREFIX_EXPR);
            advance();
            unary();
            builder.finishNode();
        } else {
            atom();
        }
    }

    private void atom() {
        Token token = peek();
        switch (token.type()) {
            case INT_NUMBER, REAL_NUMBER, STRING -> single(SyntaxKind.LITERAL);
            case REGISTER -> single(SyntaxKind.REGISTER_REF);
            case IDENTIFIER -> {
                if (peekNext().type() == TokenType.LEFT_PAREN) {
                    builder.startNode(SyntaxKind.CALL_EXPR);
                    advance();
                    delimitedList(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, SyntaxKind.ARGUMENT_LIST, false);
                    builder.finishNode();
                } else {
                    single(SyntaxKind.NAME_REF);
                }
            }
            case LEFT_PAREN -> {
                builder.startNode(SyntaxKind.PAREN_EXPR);
                nesting++;
                advance();
                expression();
                nesting--;
                consume(TokenType.RIGHT_PAREN, "`)`");
                builder.finishNode();
            }
            case LEFT_BRACE -> {
                builder.startNode(SyntaxKind.MAPPING_EXPR);
                delimitedList(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE, null, true);
                builder.finishNode();
            }
            case LEFT_BRACKET -> {
                builder.startNode(SyntaxKind.ARRAY_EXPR);
                delimitedList(TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET, null, false);
                builder.finishNode();
            }
            default -> {
                builder.startNode(SyntaxKind.ERROR);
                diagnostics.reportError("Expected an expression, found " + token.type().describe(), token.span());
                if (!atLineEnd() && !check(TokenType.COMMA) && !check(TokenType.KEYWORD) && !isClosing(token.type())) {
                    advance();
                }
                builder.finishNode();
            }
        }
    }

    private void delimitedList(TokenType open, TokenType close, SyntaxKind wrapper, boolean mapping) {
        nesting++;
        advance(); // open
        if (wrapper != null) {
            builder.startNode(wrapper);
        }
        while (!check(close) && !isAtEnd() && !check(TokenType.KEYWORD)) {
            if (mapping) {
                builder.startNode(SyntaxKind.MAPPING_ENTRY);
                expression();
                if (consume(TokenType.FAT_ARROW, "`=>`") != null) {
                    expression();
                }
                builder.finishNode();
            } else {
                expression();
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        if (wrapper != null) {
            builder.finishNode();
        }
        nesting--;
        consume(close, "`" + close.symbol() + "`");
    }

    private static boolean isClosing(TokenType type) {
        return type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACE || type == TokenType.RIGHT_BRACKET;
    }

    private void single(SyntaxKind kind) {
        builder.startNode(kind);
        advance();
        builder.finishNode();
    }

    // --- Token stream ---

    private int significantIndex(int from) {
        int i = from;
        while (i < tokens.size() - 1) {
            TokenType type = tokens.get(i).type();
            if (type.isTrivia() || (nesting > 0 && type == TokenType.NEWLINE)) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private boolean isLabelStart() {
        return check(TokenType.IDENTIFIER) && peekNext().type() == TokenType.COLON;
    }

    private Token peekNext() {
        int index = significantIndex(current);
        if (index >= tokens.size() - 1) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(significantIndex(index + 1));
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    @Override
    public Token advance() {
        int index = significantIndex(current);
        Token token = tokens.get(index);
        if (token.type() == TokenType.END_OF_FILE) {
            return token;
        }
        while (current <= index) {
            builder.token(tokens.get(current++));
        }
        return token;
    }

    @Override
    public Token peek() {
        return tokens.get(significantIndex(current));
    }

    @Override
    public Token consume(TokenType type, String what) {
        if (check(type)) {
            return advance();
        }
        Token found = peek();
        diagnostics.reportError("Expected " + what + ", found " + found.type().describe(), found.span());
        return null;
    }

    @Override
    public boolean atLineEnd() {
        return check(TokenType.NEWLINE) || isAtEnd();
    }

    @Override
    public void recover(String message) {
        builder.startNode(SyntaxKind.ERROR);
        diagnostics.reportError(message, peek().span());
        if (!atLineEnd()) {
            advance();
        }
        while (!atLineEnd() && !check(TokenType.KEYWORD)) {
            advance();
        }
        builder.finishNode();
    }

    @Override
    public void expectLineEnd(String what) {
        if (!atLineEnd()) {
            recover("Unexpected " + peek().type().describe() + " after the " + what);
        }
    }

    @Override
    public void startNode(SyntaxKind kind) {
        builder.startNode(kind);
    }

    @Override
    public void finishNode() {
        builder.finishNode();
    }

    @Override
    public int offset() {
        return peek().offset();
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}
