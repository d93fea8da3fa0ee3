package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Lexer;
import org.snrasm.compiler.frontend.parser.Parser;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.isa.Register;
import org.snrasm.compiler.isa.ScenarioInstructionSet;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}: symbol collection, scoping of
 * register aliases and the checks of the linking pass.
 */
public class SemanticAnalyzerTest {

    private DiagnosticsEngine diagnostics;
    private SyntaxNode root;
    private ProgramScope scope;

    private UnitAnalysis analyze(String source) {
        diagnostics = new DiagnosticsEngine("test.snr");
        root = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, ScenarioInstructionSet.getInstance());
        scope = analyzer.collect(List.of(root));
        return analyzer.analyzeUnit(root, scope);
    }

    private List<SyntaxNode> find(SyntaxKind kind, String text) {
        List<SyntaxNode> nodes = new ArrayList<>();
        root.walk(n -> {
            if (n.kind() == kind && n.significantText().equals(text)) {
                nodes.add(n);
            }
        });
        return nodes;
    }

    private List<String> messages() {
        return diagnostics.getDiagnostics().stream().map(Diagnostic::message).toList();
    }

    /**
     * Verifies parameter binding, local label resolution and self recursion of a function.
     */
    @Test
    @Tag("unit")
    void testRecursiveFunctionResolves() {
        // Arrange
        String source = """
                function GCD($a, $b)
                    jc $b != 0, _RECUR
                    mov $v1, $a
                    return
                _RECUR:
                    exp $a, $a mod $b
                    call GCD, $b, $a
                endfun
                """;

        // Act
        UnitAnalysis analysis = analyze(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        RoutineScope routine = analysis.routine(root.childNodes().get(0)).orElseThrow();
        assertThat(routine.parameters())
                .containsEntry("$a", Register.argument(0))
                .containsEntry("$b", Register.argument(1));

        Optional<Resolution> recur = analysis.resolution(find(SyntaxKind.NAME_REF, "_RECUR").get(0));
        assertThat(recur).get().isInstanceOfSatisfying(Resolution.CodeTarget.class, t -> {
            assertThat(t.symbol().type()).isEqualTo(Symbol.Type.LABEL);
            assertThat(t.symbol().isGlobal()).isFalse();
        });
        Optional<Resolution> callee = analysis.resolution(find(SyntaxKind.NAME_REF, "GCD").get(0));
        assertThat(callee).get().isInstanceOfSatisfying(Resolution.CodeTarget.class,
                t -> assertThat(t.symbol().type()).isEqualTo(Symbol.Type.FUNCTION));
        Optional<Resolution> alias = analysis.resolution(find(SyntaxKind.REGISTER_REF, "$a").get(0));
        assertThat(alias).contains(new Resolution.RegisterRef(Register.argument(0)));
    }

    /**
     * An alias that is only declared by another function is unknown here, and the error
     * does not stop the analysis of the sibling function.
     */
    @Test
    @Tag("unit")
    void testUndefinedAliasDoesNotAbortSiblings() {
        // Arrange
        String source = """
                function F($x)
                    mov $y, 1
                    return
                endfun
                function G($y)
                    mov $y, 2
                    j MISSING
                endfun
                """;

        // Act
        UnitAnalysis analysis = analyze(source);

        // Assert
        assertThat(messages()).containsExactly(
                "Unresolved register alias: `$y`",
                "Could not find the definition of `MISSING`");
        SyntaxNode inG = find(SyntaxKind.REGISTER_REF, "$y").get(1);
        assertThat(analysis.resolution(inG)).contains(new Resolution.RegisterRef(Register.argument(0)));
    }

    @Test
    @Tag("unit")
    void testDuplicateLabelKeepsFirst() {
        analyze("L:\n    EXIT\nL:\n    EXIT\n");

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("Duplicate definition of label `L`");
            assertThat(d.labels()).extracting(Diagnostic.Label::message).containsExactly("first defined here");
            assertThat(d.labels().get(0).span().start()).isEqualTo(0);
        });
    }

    /**
     * Verifies that a duplicate jump table key is a single warning and the first entry wins.
     */
    @Test
    @Tag("unit")
    void testDuplicateJumpTableKeyWarns() {
        // Arrange
        String source = """
                ENTRY:
                    jt $v0, { 0 => A, 0 => B }
                    EXIT
                A:
                    EXIT
                B:
                    EXIT
                """;

        // Act
        UnitAnalysis analysis = analyze(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.message()).isEqualTo("Duplicate jump table key `0`; the first entry is used");
        });
        SyntaxNode jt = find(SyntaxKind.INSTRUCTION, "jt $v0, { 0 => A, 0 => B }").get(0);
        assertThat(analysis.jumpTable(jt)).singleElement().satisfies(e -> {
            assertThat(e.key()).isZero();
            assertThat(e.target().significantText()).isEqualTo("A");
        });
    }

    @Test
    @Tag("unit")
    void testCallArityIsChecked() {
        analyze("function F($p, $q)\n    return\nendfun\nMAIN:\n    call F, 1\n");

        assertThat(messages()).containsExactly("`F` takes 2 arguments, found 1");
    }

    @Test
    @Tag("unit")
    void testReturnAndRetsubPlacement() {
        analyze("MAIN:\n    return\nfunction F\n    retsub\nendfun\n");

        assertThat(messages()).containsExactly(
                "`return` is only valid inside a function",
                "`retsub` is not valid inside a function; use `return`");
    }

    @Test
    @Tag("unit")
    void testUnknownInstruction() {
        analyze("MAIN:\n    frobnicate $v0\n");

        assertThat(messages()).containsExactly("Unknown instruction `frobnicate`");
    }

    /**
     * Constants may refer to constants defined later; a cycle is reported.
     */
    @Test
    @Tag("unit")
    void testConstantsForwardReferencesAndCycles() {
        // Act
        analyze("def A = B + 1\ndef B = 2\ndef C = D\ndef D = C\n");

        // Assert
        assertThat(scope.constant("A")).contains(new ConstValue(3, ValueKind.INT));
        assertThat(messages()).isNotEmpty().allMatch(m -> m.startsWith("Cyclic constant definition"));
    }

    @Test
    @Tag("unit")
    void testGlobalRegisterAliasChain() {
        analyze("def $count = $index\ndef $index = $v4\nMAIN:\n    mov $count, 1\n");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(scope.alias("$count")).contains(Register.regular(4));
    }

    @Test
    @Tag("unit")
    void testAliasForBuiltinRegisterIsRejected() {
        analyze("def $v0 = $v1\n");

        assertThat(messages()).containsExactly("Cannot define an alias for the builtin register `$v0`");
    }

    /**
     * Verifies the checks on function headers: parameter registers and preserved ranges.
     */
    @Test
    @Tag("unit")
    void testFunctionHeaderChecks() {
        // Act
        analyze("""
                function A($a1)
                    return
                endfun
                function B($x) [ $v3-$v2 ]
                    return
                endfun
                function C($x) [ $v2-$a3 ]
                    return
                endfun
                function D($x) [ $a0 ]
                    return
                endfun
                """);

        // Assert
        assertThat(messages()).containsExactly(
                "Parameter `$a1` must be the argument register `$a0`",
                "Register range `$v3-$v2` is reversed",
                "Register range `$v2-$a3` crosses register banks",
                "Preserved register `$a0` is bound to parameter `$x`");
    }

    @Test
    @Tag("unit")
    void testPreservedRangeIsExpanded() {
        UnitAnalysis analysis = analyze("function F [ $v2-$v4, $v7 ]\n    return\nendfun\n");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        RoutineScope routine = analysis.routine(root.childNodes().get(0)).orElseThrow();
        assertThat(routine.preserved()).containsExactly(
                Register.regular(2), Register.regular(3), Register.regular(4), Register.regular(7));
    }
}
