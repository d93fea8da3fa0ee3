package org.snrasm.compiler.frontend.irgen.converters;

import org.snrasm.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.snrasm.compiler.frontend.irgen.IrGenContext;
import org.snrasm.compiler.frontend.parser.ast.AliasDefNode;

/**
 * Constants and register aliases are substituted at their uses and emit no IR.
 */
public final class AliasDefNodeConverter implements IAstNodeToIrConverter<AliasDefNode> {

	@Override
	public void convert(AliasDefNode node, IrGenContext ctx) {
		// no-op
	}
}
