package org.snrasm.compiler.frontend.irgen.converters;

import org.snrasm.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.snrasm.compiler.frontend.irgen.IrGenContext;
import org.snrasm.compiler.frontend.parser.ast.LabelNode;
import org.snrasm.compiler.ir.IrLabelDef;

/**
 * Converts {@link LabelNode} into {@link IrLabelDef}. Labels rejected as duplicates emit nothing.
 */
public final class LabelNodeConverter implements IAstNodeToIrConverter<LabelNode> {

	@Override
	public void convert(LabelNode node, IrGenContext ctx) {
		ctx.analysis().label(node.syntax()).ifPresent(symbol ->
				ctx.emit(new IrLabelDef(symbol.qualifiedName(), symbol.name(), node.name().span())));
	}
}
