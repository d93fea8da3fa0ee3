package org.snrasm.compiler.backend.emit;

import org.snrasm.compiler.isa.IInstructionSet;
import org.snrasm.compiler.isa.InstructionDef;

/**
 * Read-only context handed to emission rules.
 *
 * @param isa The instruction set.
 */
public record EmissionContext(IInstructionSet isa) {

	/**
	 * Looks up an instruction the rules synthesize.
	 * @param mnemonic The mnemonic.
	 * @return The definition.
	 * @throws IllegalStateException If the instruction set lacks the mnemonic.
	 */
	public InstructionDef instruction(String mnemonic) {
		return isa.byMnemonic(mnemonic)
				.orElseThrow(() -> new IllegalStateException("Instruction set has no `" + mnemonic + "`"));
	}
}
