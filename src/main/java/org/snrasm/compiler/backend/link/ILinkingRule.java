package org.snrasm.compiler.backend.link;

import org.snrasm.compiler.backend.encode.Relocation;

import java.util.Optional;

/**
 * Linking rule that resolves the target address of a relocation.
 */
public interface ILinkingRule {

	/**
	 * Resolves a relocation of the current unit.
	 *
	 * @param relocation The relocation.
	 * @param context    Linking context with the layout and the current unit.
	 * @return The absolute address, or empty if this rule does not know the target.
	 */
	Optional<Long> resolve(Relocation relocation, LinkingContext context);
}
