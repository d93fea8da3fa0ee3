package org.snrasm.compiler.isa;

import java.util.Collection;
import java.util.Optional;

/**
 * Stable ISA interface used by the assembler and disassembler to look up instruction layouts.
 */
public interface IInstructionSet {

	/**
	 * Looks up a mnemonic, ignoring case.
	 * @param mnemonic The mnemonic as written in source.
	 * @return The definition, or empty if unknown.
	 */
	Optional<InstructionDef> byMnemonic(String mnemonic);

	/**
	 * Looks up the definition for an opcode.
	 * @param opcode  The opcode byte.
	 * @param subtype The operation type for {@code uo}/{@code bo}, ignored otherwise.
	 * @return The definition, or empty if the opcode or subtype is unknown.
	 */
	Optional<InstructionDef> byOpcode(int opcode, int subtype);

	/**
	 * @param opcode The opcode byte.
	 * @return {@code true} if the opcode is followed by an operation type byte.
	 */
	boolean hasSubtype(int opcode);

	/**
	 * @return All definitions.
	 */
	Collection<InstructionDef> all();
}
