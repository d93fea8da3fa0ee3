package org.snrasm.compiler.frontend.parser;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides keyword handlers with access to the token stream and the tree under
 * construction without coupling them directly to the parser implementation.
 * <p>
 * All token accessors skip trivia. Consumed tokens, and the trivia before them, are
 * appended to the innermost open node.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the current token is the given keyword.
     * @param keyword The keyword text.
     * @return true if the current token is that keyword.
     */
    boolean checkKeyword(String keyword);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports an error and consumes nothing.
     * @param type The expected token type.
     * @param what A description of what was expected, used in the error message.
     * @return The consumed token, or null if the type did not match.
     */
    Token consume(TokenType type, String what);

    /**
     * @return true if the current token ends the statement (newline or end of file).
     */
    boolean atLineEnd();

    /**
     * Reports an error at the current token and wraps the rest of the statement into an
     * {@link SyntaxKind#ERROR} node.
     * @param message The error message.
     */
    void recover(String message);

    /**
     * Reports an error unless the statement ends here, then recovers.
     * @param what What the statement was, used in the error message.
     */
    void expectLineEnd(String what);

    void startNode(SyntaxKind kind);

    void finishNode();

    /**
     * Parses an expression into the open node.
     */
    void expression();

    /**
     * Parses labels and instructions until the terminator keyword, another top-level
     * keyword or the end of the file.
     * @param terminator The keyword that ends the body.
     * @return true if the terminator was found (it is not consumed).
     */
    boolean body(String terminator);

    /**
     * @return The offset of the current token.
     */
    int offset();

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
