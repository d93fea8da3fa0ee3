package org.snrasm.compiler.frontend.parser.features;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.ParsingContext;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;

/**
 * Handler for {@code function ... endfun} and {@code subroutine ... endsub}.
 * <pre>
 * function NAME($a, $b) [$v2-$v3]
 *     ...
 * endfun
 * </pre>
 * The preserved registers may also follow the header as {@code , $v2-$v3}.
 */
public class RoutineDefHandler implements IKeywordHandler {

    private final boolean subroutine;

    public RoutineDefHandler(boolean subroutine) {
        this.subroutine = subroutine;
    }

    @Override
    public void parse(ParsingContext context) {
        String what = subroutine ? "subroutine" : "function";
        String terminator = subroutine ? "endsub" : "endfun";

        context.startNode(subroutine ? SyntaxKind.SUBROUTINE_DEF : SyntaxKind.FUNCTION_DEF);
        Token keyword = context.advance();
        Token name = context.consume(TokenType.IDENTIFIER, "a " + what + " name");

        if (context.check(TokenType.LEFT_PAREN)) {
            int start = context.offset();
            parameters(context);
            if (subroutine) {
                context.getDiagnostics().reportError("Subroutines take no parameters", new Span(start, context.offset()));
            }
        }
        if (context.check(TokenType.LEFT_BRACKET) || context.check(TokenType.COMMA)) {
            int start = context.offset();
            preserved(context);
            if (subroutine) {
                context.getDiagnostics().reportError("Subroutines take no preserved registers", new Span(start, context.offset()));
            }
        }
        context.expectLineEnd(what + " header");

        if (context.body(terminator)) {
            context.advance();
            context.expectLineEnd("`" + terminator + "`");
        } else {
            String label = name != null ? " `" + name.text() + "`" : "";
            context.getDiagnostics().reportError(
                    "Missing `" + terminator + "` to terminate the " + what + label,
                    Span.at(context.offset()),
                    new Diagnostic.Label(keyword.span(), what + " starts here"));
        }
        context.finishNode();
    }

    private void parameters(ParsingContext context) {
        context.startNode(SyntaxKind.PARAM_LIST);
        context.advance(); // (
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                if (context.consume(TokenType.REGISTER, "a parameter register") == null) {
                    break;
                }
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_PAREN, "`)`");
        context.finishNode();
    }

    private void preserved(ParsingContext context) {
        context.startNode(SyntaxKind.PRESERVED_LIST);
        if (context.match(TokenType.LEFT_BRACKET)) {
            do {
                if (!range(context)) {
                    break;
                }
            } while (context.match(TokenType.COMMA));
            context.consume(TokenType.RIGHT_BRACKET, "`]`");
        } else {
            while (context.match(TokenType.COMMA)) {
                if (!range(context)) {
                    break;
                }
            }
        }
        context.finishNode();
    }

    private boolean range(ParsingContext context) {
        context.startNode(SyntaxKind.REGISTER_RANGE);
        boolean ok = context.consume(TokenType.REGISTER, "a preserved register") != null;
        if (ok && context.match(TokenType.MINUS)) {
            ok = context.consume(TokenType.REGISTER, "the last register of the range") != null;
        }
        context.finishNode();
        return ok;
    }
}
