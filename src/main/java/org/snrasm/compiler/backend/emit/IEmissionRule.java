package org.snrasm.compiler.backend.emit;

import org.snrasm.compiler.ir.IrItem;

import java.util.List;

/**
 * Rewriter rule that can expand or modify the IR stream of one unit before encoding.
 */
public interface IEmissionRule {

	/**
	 * Applies this rule to the given IR item stream.
	 *
	 * @param items   The input IR items.
	 * @param context The instruction set the synthesized instructions are taken from.
	 * @return The rewritten IR items.
	 */
	List<IrItem> apply(List<IrItem> items, EmissionContext context);
}
