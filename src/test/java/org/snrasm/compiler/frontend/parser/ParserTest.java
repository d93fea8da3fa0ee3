package org.snrasm.compiler.frontend.parser;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Lexer;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * The parser builds a lossless syntax tree, so every test also checks that the
 * tree reproduces its input.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private SyntaxNode parse(String source) {
        diagnostics = new DiagnosticsEngine("test.snr");
        Lexer lexer = new Lexer(source, diagnostics);
        return new Parser(lexer.scanTokens(), diagnostics).parse();
    }

    private static List<SyntaxNode> collect(SyntaxNode root, SyntaxKind kind) {
        List<SyntaxNode> nodes = new ArrayList<>();
        root.walk(n -> {
            if (n.kind() == kind) {
                nodes.add(n);
            }
        });
        return nodes;
    }

    /**
     * Verifies that top-level labels open script blocks and that the {@code ENTRY}
     * label opens the jump table block.
     */
    @Test
    @Tag("unit")
    void testTopLevelBlocks() {
        // Arrange
        String source = """
                ENTRY:
                    jt $v0, { 0 => SNR_0, 1 => SNR_1 }
                    EXIT 0, 0
                SNR_0:
                    EXIT
                SNR_1:
                    EXIT
                """;

        // Act
        SyntaxNode root = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root.kind()).isEqualTo(SyntaxKind.SOURCE_FILE);
        assertThat(root.text()).isEqualTo(source);
        assertThat(root.childNodes()).extracting(SyntaxNode::kind).containsExactly(
                SyntaxKind.JUMP_TABLE_BLOCK, SyntaxKind.SCRIPT_BLOCK, SyntaxKind.SCRIPT_BLOCK);
        assertThat(collect(root, SyntaxKind.MAPPING_ENTRY)).hasSize(2);
    }

    /**
     * Verifies that comments, blank lines and line continuations survive parsing.
     */
    @Test
    @Tag("unit")
    void testTreeIsLossless() {
        // Arrange
        String source = "/* header */\n"
                + "def LIMIT = 10 // ten\n"
                + "\n"
                + "function F($x) [ $v2-$v3 ]\n"
                + "    exp $x, $x + \\\n"
                + "        LIMIT\t// wrapped\n"
                + "endfun\n";

        // Act
        SyntaxNode root = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root.text()).isEqualTo(source);
        assertThat(root.childNodes()).extracting(SyntaxNode::kind)
                .containsExactly(SyntaxKind.ALIAS_DEF, SyntaxKind.FUNCTION_DEF);
        SyntaxNode function = root.childNodes().get(1);
        assertThat(function.firstChild(SyntaxKind.PARAM_LIST)).isPresent();
        assertThat(collect(function, SyntaxKind.REGISTER_RANGE)).hasSize(1);
    }

    /**
     * Verifies that {@code nowait} is a trailing flag and not a third operand.
     */
    @Test
    @Tag("unit")
    void testTrailingFlagIsRecognized() {
        // Act
        SyntaxNode root = parse("MSGSET 7503, \"hello\", nowait\n");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        SyntaxNode arguments = collect(root, SyntaxKind.ARGUMENT_LIST).get(0);
        assertThat(arguments.childNodes()).extracting(SyntaxNode::kind)
                .containsExactly(SyntaxKind.LITERAL, SyntaxKind.LITERAL, SyntaxKind.FLAG);
    }

    @Test
    @Tag("unit")
    void testModAndElementwiseShareMultiplicativeLevel() {
        SyntaxNode root = parse("exp $v0, 1 + 2 mod 3 .* 4\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        SyntaxNode sum = collect(root, SyntaxKind.BINARY_EXPR).get(0);
        assertThat(sum.significantText()).isEqualTo("1 + 2 mod 3 .* 4");
        SyntaxNode product = sum.childNodes().get(1);
        assertThat(product.kind()).isEqualTo(SyntaxKind.BINARY_EXPR);
        // left associative: (2 mod 3) .* 4
        assertThat(product.childNodes().get(0).significantText()).isEqualTo("2 mod 3");
        assertThat(product.childNodes().get(1).significantText()).isEqualTo("4");
    }

    /**
     * Verifies that a malformed line becomes an ERROR node and parsing resumes on the next line.
     */
    @Test
    @Tag("unit")
    void testRecoveryIntoErrorNode() {
        // Arrange
        String source = "L:\n    42 junk here\n    mov $v0, 1\n";

        // Act
        SyntaxNode root = parse(source);

        // Assert
        assertThat(root.text()).isEqualTo(source);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("Expected an instruction, found number");
        assertThat(collect(root, SyntaxKind.ERROR)).singleElement()
                .extracting(SyntaxNode::significantText).isEqualTo("42 junk here");
        assertThat(collect(root, SyntaxKind.INSTRUCTION)).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testMissingEndfunPointsAtHeader() {
        String source = "function F\n    return\nfunction G\n    return\nendfun\n";

        SyntaxNode root = parse(source);

        assertThat(root.text()).isEqualTo(source);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("Missing `endfun` to terminate the function `F`");
            assertThat(d.labels()).extracting(Diagnostic.Label::message).containsExactly("function starts here");
            assertThat(d.labels().get(0).span().start()).isEqualTo(0);
        });
        assertThat(root.childNodes()).extracting(SyntaxNode::kind)
                .containsExactly(SyntaxKind.FUNCTION_DEF, SyntaxKind.FUNCTION_DEF);
    }

    @Test
    @Tag("unit")
    void testSubroutineRejectsParameters() {
        parse("subroutine S($x)\n    retsub\nendsub\n");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("Subroutines take no parameters");
    }
}
