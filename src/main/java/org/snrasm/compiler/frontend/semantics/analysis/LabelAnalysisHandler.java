package org.snrasm.compiler.frontend.semantics.analysis;

import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.ast.LabelNode;
import org.snrasm.compiler.frontend.semantics.Symbol;

/**
 * Declares labels. Labels inside a routine are local to it; file-level labels were
 * declared by the collection pass and are only looked up here.
 */
public class LabelAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof LabelNode label)) {
            return;
        }
        Token name = label.name();
        if (context.routine() == null) {
            context.program().resolve(name.text(), t -> t == Symbol.Type.LABEL)
                    .ifPresent(symbol -> context.result().label(label.syntax(), symbol));
            return;
        }
        Symbol symbol = new Symbol(name.text(), Symbol.Type.LABEL, name.span(), context.scope().name());
        if (context.symbolTable().define(context.scope(), symbol)) {
            context.result().label(label.syntax(), symbol);
        }
    }
}
