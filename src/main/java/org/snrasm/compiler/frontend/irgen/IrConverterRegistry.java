package org.snrasm.compiler.frontend.irgen;

import org.snrasm.compiler.frontend.irgen.converters.AliasDefNodeConverter;
import org.snrasm.compiler.frontend.irgen.converters.BlockNodeConverter;
import org.snrasm.compiler.frontend.irgen.converters.InstructionNodeConverter;
import org.snrasm.compiler.frontend.irgen.converters.LabelNodeConverter;
import org.snrasm.compiler.frontend.irgen.converters.RoutineNodeConverter;
import org.snrasm.compiler.frontend.parser.ast.AliasDefNode;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.ast.BlockNode;
import org.snrasm.compiler.frontend.parser.ast.InstructionNode;
import org.snrasm.compiler.frontend.parser.ast.LabelNode;
import org.snrasm.compiler.frontend.parser.ast.RoutineNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to converter instances, similar in spirit to
 * the keyword handler registry of the parser.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();

	private IrConverterRegistry() {
	}

	/**
	 * Registers a converter for the given AST node class.
	 *
	 * @param nodeType  The concrete AST node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete AST type parameter.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Retrieves the converter registered for the given class.
	 *
	 * @param nodeType The AST node class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IAstNodeToIrConverter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves the converter for the given node.
	 *
	 * @param node The AST node instance to resolve a converter for.
	 * @return The converter, or empty for nodes that produce no IR.
	 */
	@SuppressWarnings("unchecked")
	public Optional<IAstNodeToIrConverter<AstNode>> resolve(AstNode node) {
		return Optional.ofNullable((IAstNodeToIrConverter<AstNode>) byClass.get(node.getClass()));
	}

	/**
	 * Creates an empty registry.
	 *
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize() {
		return new IrConverterRegistry();
	}

	/**
	 * Initializes a registry with all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize();
		reg.register(AliasDefNode.class, new AliasDefNodeConverter());
		reg.register(BlockNode.class, new BlockNodeConverter());
		reg.register(RoutineNode.class, new RoutineNodeConverter());
		reg.register(LabelNode.class, new LabelNodeConverter());
		reg.register(InstructionNode.class, new InstructionNodeConverter());
		return reg;
	}
}
