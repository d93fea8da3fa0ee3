package org.snrasm.compiler.backend.emit.features;

import org.snrasm.compiler.backend.emit.EmissionContext;
import org.snrasm.compiler.backend.emit.EmissionRegistry;
import org.snrasm.compiler.backend.emit.IEmissionRule;
import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.irgen.converters.RoutineNodeConverter;
import org.snrasm.compiler.ir.IrDirective;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrItem;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrNumber;
import org.snrasm.compiler.ir.IrProgram;
import org.snrasm.compiler.ir.IrReg;
import org.snrasm.compiler.ir.IrValue;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.Register;
import org.snrasm.compiler.isa.ScenarioInstructionSet;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class PreservedRegisterRuleTest {

    private static final Span SPAN = new Span(0, 1);

    @Mock
    private IEmissionRule first;

    @Mock
    private IEmissionRule second;

    private final EmissionContext context = new EmissionContext(ScenarioInstructionSet.getInstance());

    private IrDirective enter(String kind, Register... preserved) {
        return new IrDirective(RoutineNodeConverter.NAMESPACE, RoutineNodeConverter.ENTER,
                Map.of("kind", new IrValue.Str(kind), "preserved", new IrValue.Regs(List.of(preserved))), SPAN);
    }

    private IrDirective exit() {
        return new IrDirective(RoutineNodeConverter.NAMESPACE, RoutineNodeConverter.EXIT, Map.of(), SPAN);
    }

    private IrInstruction instruction(String mnemonic) {
        return new IrInstruction(context.instruction(mnemonic), List.of(), SPAN);
    }

    private static List<String> mnemonics(List<IrItem> items) {
        return items.stream()
                .map(i -> i instanceof IrInstruction ins ? ins.mnemonic() : ((IrDirective) i).name())
                .toList();
    }

    /**
     * Every explicit return is preceded by the restoring pop, and a body that can fall
     * through gets an implicit return.
     */
    @Test
    void testPrologueAndEpilogues() {
        // Arrange
        List<IrItem> items = List.of(
                enter("function", Register.regular(2), Register.regular(3)),
                instruction("return"),
                instruction("EXIT"),
                exit());

        // Act
        List<IrItem> out = new PreservedRegisterRule().apply(items, context);

        // Assert
        assertThat(mnemonics(out)).containsExactly(
                RoutineNodeConverter.ENTER, "push", "pop", "return", "EXIT", "pop", "return", RoutineNodeConverter.EXIT);
        IrInstruction push = (IrInstruction) out.get(1);
        assertThat(push.operands()).containsExactly(new IrList(List.of(
                new IrNumber(NumberSpec.of(Register.regular(2))), new IrNumber(NumberSpec.of(Register.regular(3))))));
        IrInstruction pop = (IrInstruction) out.get(2);
        assertThat(pop.operands()).containsExactly(new IrList(List.of(
                new IrReg(Register.regular(3)), new IrReg(Register.regular(2)))));
    }

    @Test
    void testNoImplicitTerminatorAfterUnconditionalReturn() {
        List<IrItem> out = new PreservedRegisterRule().apply(
                List.of(enter("function"), instruction("return"), exit()), context);

        assertThat(mnemonics(out)).containsExactly(RoutineNodeConverter.ENTER, "return", RoutineNodeConverter.EXIT);
    }

    @Test
    void testSubroutineEndsWithRetsub() {
        List<IrItem> out = new PreservedRegisterRule().apply(
                List.of(enter("subroutine"), instruction("EXIT"), exit()), context);

        assertThat(mnemonics(out)).containsExactly(RoutineNodeConverter.ENTER, "EXIT", "retsub", RoutineNodeConverter.EXIT);
    }

    @Test
    void testRegistryAppliesRulesInOrder() {
        // Arrange
        List<IrItem> afterFirst = List.of(instruction("EXIT"));
        when(first.apply(any(), same(context))).thenReturn(afterFirst);
        when(second.apply(same(afterFirst), same(context))).thenReturn(List.of());
        EmissionRegistry registry = new EmissionRegistry();
        registry.register(first);
        registry.register(second);

        // Act
        IrProgram result = registry.apply(new IrProgram("test", List.of()), context);

        // Assert
        assertThat(result.items()).isEmpty();
        InOrder order = inOrder(first, second);
        order.verify(first).apply(any(), same(context));
        order.verify(second).apply(same(afterFirst), same(context));
    }
}
