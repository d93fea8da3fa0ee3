package org.snrasm.compiler.frontend.irgen.converters;

import org.snrasm.compiler.frontend.irgen.ExpressionLowerer;
import org.snrasm.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.snrasm.compiler.frontend.irgen.IrGenContext;
import org.snrasm.compiler.frontend.lexer.Literals;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.ast.InstructionNode;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.ConstValue;
import org.snrasm.compiler.frontend.semantics.JumpTableEntry;
import org.snrasm.compiler.frontend.semantics.OperandBinding;
import org.snrasm.compiler.frontend.semantics.Resolution;
import org.snrasm.compiler.ir.IrError;
import org.snrasm.compiler.ir.IrExpr;
import org.snrasm.compiler.ir.IrImm;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrLabelDef;
import org.snrasm.compiler.ir.IrLabelRef;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrNumber;
import org.snrasm.compiler.ir.IrOperand;
import org.snrasm.compiler.ir.IrReg;
import org.snrasm.compiler.ir.IrString;
import org.snrasm.compiler.isa.Field;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.InstructionFlag;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.OperandKind;
import org.snrasm.compiler.isa.Shape;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts an {@link InstructionNode} into an {@link IrInstruction}, lowering every operand
 * according to the kind of the field it is bound to.
 */
public final class InstructionNodeConverter implements IAstNodeToIrConverter<InstructionNode> {

	private static final IrError UNRESOLVED = new IrError("unresolved");

	/**
	 * {@inheritDoc}
	 * <p>
	 * Instructions rejected by the analysis emit nothing. Operands that fail to lower become
	 * {@link IrError} placeholders so that the remaining operands are still checked.
	 *
	 * @param node The node to convert.
	 * @param ctx  The generation context.
	 */
	@Override
	public void convert(InstructionNode node, IrGenContext ctx) {
		Optional<InstructionDef> lookup = ctx.analysis().instruction(node.syntax());
		if (lookup.isEmpty()) {
			return;
		}
		InstructionDef def = lookup.get();
		Optional<List<OperandBinding>> bindings = OperandBinding.bind(def, node.operands());
		if (bindings.isEmpty()) {
			return;
		}
		Map<Integer, OperandBinding> byIndex = new HashMap<>();
		bindings.get().forEach(b -> byIndex.put(b.index(), b));

		List<IrOperand> operands = new ArrayList<>();
		List<Field> fields = def.positionalFields();
		for (int i = 0; i < fields.size(); i++) {
			Field field = fields.get(i);
			OperandBinding binding = byIndex.get(i);
			if (binding != null) {
				operands.add(lower(field.kind(), binding, node, ctx));
			} else if (def.shape() != Shape.PLAIN) {
				// omitted uo/bo operand: the explicit bit stays clear
				continue;
			} else if (field.defaultValue() != null) {
				operands.add(defaultOperand(field));
			} else {
				operands.add(new IrList(List.of()));
			}
		}

		Set<InstructionFlag> flags = EnumSet.noneOf(InstructionFlag.class);
		for (SyntaxNode flag : node.flags()) {
			InstructionFlag.fromSourceName(flag.childTokens().get(0).text()).ifPresent(flags::add);
		}
		ctx.emit(new IrInstruction(def, operands, flags, node.span()));

		if (fields.stream().anyMatch(f -> f.kind() == OperandKind.ADDRESS_TABLE)) {
			ctx.emit(new IrLabelDef(fallthroughKey(node), "", node.span()));
		}
	}

	private IrOperand lower(OperandKind kind, OperandBinding binding, InstructionNode node, IrGenContext ctx) {
		ExpressionLowerer lowerer = ctx.lowerer();
		return switch (kind) {
			case REGISTER -> register(binding.node(), ctx);
			case NUMBER -> number(binding.node(), lowerer);
			case U8, U16, BOOL, MESSAGE_ID -> immediate(kind, binding.node(), ctx);
			case STRING, FIXUP_STRING -> string(binding.node());
			case CODE_ADDRESS -> codeAddress(binding.node(), ctx);
			case EXPRESSION -> lowerer.lowerExpression(binding.node())
					.<IrOperand>map(IrExpr::new).orElse(UNRESOLVED);
			case CONDITION -> lowerer.lowerCondition(binding.node())
					.<IrOperand>map(c -> c).orElse(UNRESOLVED);
			case STRING_ARRAY -> new IrList(binding.elements().stream().map(this::string).toList());
			case REGISTER_LIST -> new IrList(binding.elements().stream().map(e -> register(e, ctx)).toList());
			case NUMBER_LIST, BITMASK, NUMBER_TABLE ->
					new IrList(binding.elements().stream().map(e -> number(e, lowerer)).toList());
			case ADDRESS_TABLE -> jumpTable(node, ctx);
		};
	}

	private IrOperand register(SyntaxNode node, IrGenContext ctx) {
		return ctx.analysis().resolution(node)
				.filter(Resolution.RegisterRef.class::isInstance)
				.<IrOperand>map(r -> new IrReg(((Resolution.RegisterRef) r).register()))
				.orElse(UNRESOLVED);
	}

	private IrOperand number(SyntaxNode node, ExpressionLowerer lowerer) {
		return lowerer.lowerNumberSpec(node).<IrOperand>map(IrNumber::new).orElse(UNRESOLVED);
	}

	private IrOperand immediate(OperandKind kind, SyntaxNode node, IrGenContext ctx) {
		Optional<ConstValue> value = ctx.lowerer().evaluateConstant(node);
		if (value.isEmpty()) {
			return UNRESOLVED;
		}
		long max = switch (kind) {
			case U8 -> 0xFF;
			case U16 -> 0xFFFF;
			case BOOL -> 1;
			default -> 0xFFFFFF;
		};
		int v = value.get().value();
		if (v < 0 || v > max) {
			ctx.diagnostics().reportError("Value " + v + " does not fit into " + describe(kind) + " (0.." + max + ")",
					node.significantSpan());
			return UNRESOLVED;
		}
		return new IrImm(v);
	}

	private IrOperand string(SyntaxNode node) {
		if (node.kind() != SyntaxKind.LITERAL) {
			return UNRESOLVED;
		}
		Token token = node.childTokens().get(0);
		return token.type() == TokenType.STRING ? new IrString(Literals.unescape(token.text())) : UNRESOLVED;
	}

	private IrOperand codeAddress(SyntaxNode node, IrGenContext ctx) {
		return ctx.analysis().resolution(node)
				.filter(Resolution.CodeTarget.class::isInstance)
				.<IrOperand>map(r -> {
					var symbol = ((Resolution.CodeTarget) r).symbol();
					return new IrLabelRef(symbol.qualifiedName(), symbol.name());
				})
				.orElse(UNRESOLVED);
	}

	private IrOperand jumpTable(InstructionNode node, IrGenContext ctx) {
		List<JumpTableEntry> entries = ctx.analysis().jumpTable(node.syntax());
		int size = entries.stream().mapToInt(JumpTableEntry::key).max().orElse(-1) + 1;
		IrOperand[] table = new IrOperand[size];
		for (JumpTableEntry entry : entries) {
			table[entry.key()] = codeAddress(entry.target(), ctx);
		}
		IrLabelRef fallthrough = new IrLabelRef(fallthroughKey(node), "");
		List<IrOperand> dense = new ArrayList<>(size);
		for (IrOperand target : table) {
			dense.add(target != null ? target : fallthrough);
		}
		return new IrList(dense);
	}

	private static IrOperand defaultOperand(Field field) {
		if (field.kind() == OperandKind.NUMBER) {
			return new IrNumber(NumberSpec.constant(field.defaultValue()));
		}
		return new IrImm(field.defaultValue());
	}

	private static String fallthroughKey(InstructionNode node) {
		return IrLabelDef.UNIT_LOCAL_PREFIX + "jt@" + node.span().start();
	}

	private static String describe(OperandKind kind) {
		return switch (kind) {
			case U8 -> "u8";
			case U16 -> "u16";
			case BOOL -> "a bool";
			default -> "a message id";
		};
	}
}
