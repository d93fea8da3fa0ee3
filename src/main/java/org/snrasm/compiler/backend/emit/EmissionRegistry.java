package org.snrasm.compiler.backend.emit;

import org.snrasm.compiler.backend.emit.features.PreservedRegisterRule;
import org.snrasm.compiler.ir.IrItem;
import org.snrasm.compiler.ir.IrProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for emission rules applied in order.
 */
public final class EmissionRegistry {

	private final List<IEmissionRule> rules = new ArrayList<>();

	/**
	 * Registers a new emission rule.
	 * @param rule The rule to register.
	 */
	public void register(IEmissionRule rule) { rules.add(rule); }

	/**
	 * @return The list of registered emission rules.
	 */
	public List<IEmissionRule> rules() { return rules; }

	/**
	 * Runs every registered rule over the program, in registration order.
	 * @param program The program of one unit.
	 * @param context The emission context.
	 * @return The rewritten program.
	 */
	public IrProgram apply(IrProgram program, EmissionContext context) {
		List<IrItem> items = program.items();
		for (IEmissionRule rule : rules) {
			items = rule.apply(items, context);
		}
		return new IrProgram(program.programName(), items);
	}

	/**
	 * Initializes a new emission registry with the default rules.
	 * @return A new registry with default rules.
	 */
	public static EmissionRegistry initializeWithDefaults() {
		EmissionRegistry reg = new EmissionRegistry();
		reg.register(new PreservedRegisterRule());
		return reg;
	}
}
