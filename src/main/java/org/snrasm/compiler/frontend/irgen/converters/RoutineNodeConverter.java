package org.snrasm.compiler.frontend.irgen.converters;

import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.snrasm.compiler.frontend.irgen.IrGenContext;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.ast.RoutineNode;
import org.snrasm.compiler.frontend.semantics.RoutineScope;
import org.snrasm.compiler.ir.IrDirective;
import org.snrasm.compiler.ir.IrLabelDef;
import org.snrasm.compiler.ir.IrValue;

import java.util.Map;

/**
 * Converts {@link RoutineNode} into an entry label, {@code proc_enter}, the converted body
 * and {@code proc_exit}. The directives carry the preserved registers; the emission rules
 * turn them into the prologue and epilogue.
 */
public final class RoutineNodeConverter implements IAstNodeToIrConverter<RoutineNode> {

	/** Directive namespace of routine boundaries. */
	public static final String NAMESPACE = "core";
	public static final String ENTER = "proc_enter";
	public static final String EXIT = "proc_exit";

	/**
	 * {@inheritDoc}
	 * <p>
	 * The exit directive is placed at the {@code endfun}/{@code endsub} keyword so the
	 * synthesized epilogue points there in diagnostics.
	 *
	 * @param node The node to convert.
	 * @param ctx  The generation context.
	 */
	@Override
	public void convert(RoutineNode node, IrGenContext ctx) {
		RoutineScope routine = ctx.analysis().routine(node.syntax()).orElse(null);
		if (routine == null) {
			return;
		}
		Span nameSpan = node.name().map(Token::span).orElse(node.keyword().span());
		ctx.emit(new IrLabelDef(routine.symbol().qualifiedName(), routine.symbol().name(), nameSpan));

		Map<String, IrValue> args = Map.of(
				"name", new IrValue.Str(routine.symbol().name()),
				"kind", new IrValue.Str(routine.isSubroutine() ? "subroutine" : "function"),
				"preserved", new IrValue.Regs(routine.preserved()));
		ctx.emit(new IrDirective(NAMESPACE, ENTER, args, nameSpan));

		ctx.enterRoutine(routine);
		node.statements().forEach(ctx::convert);
		ctx.leaveRoutine();

		Span exitSpan = node.terminator().map(Token::span).orElse(Span.at(node.syntax().span().end()));
		ctx.emit(new IrDirective(NAMESPACE, EXIT, args, exitSpan));
	}
}
