package org.snrasm.compiler.frontend.irgen.converters;

import org.snrasm.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.snrasm.compiler.frontend.irgen.IrGenContext;
import org.snrasm.compiler.frontend.parser.ast.BlockNode;

/**
 * Converts a file-level script block statement by statement.
 */
public final class BlockNodeConverter implements IAstNodeToIrConverter<BlockNode> {

	@Override
	public void convert(BlockNode node, IrGenContext ctx) {
		node.statements().forEach(ctx::convert);
	}
}
