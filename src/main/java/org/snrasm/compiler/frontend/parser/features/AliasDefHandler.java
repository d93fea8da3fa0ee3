package org.snrasm.compiler.frontend.parser.features;

import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.ParsingContext;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;

/**
 * Handler for {@code def}.
 * The syntax is {@code def NAME = expr} for constants and {@code def $name = $reg} for register aliases.
 */
public class AliasDefHandler implements IKeywordHandler {

    @Override
    public void parse(ParsingContext context) {
        context.startNode(SyntaxKind.ALIAS_DEF);
        context.advance(); // consume def

        if (!context.match(TokenType.IDENTIFIER, TokenType.REGISTER)) {
            context.recover("Expected a constant or register alias name after `def`, found " + context.peek().type().describe());
            context.finishNode();
            return;
        }
        if (context.consume(TokenType.EQUAL, "`=`") == null) {
            context.recover("Expected `=` followed by the value of the definition");
            context.finishNode();
            return;
        }
        context.expression();
        context.expectLineEnd("definition");
        context.finishNode();
    }
}
