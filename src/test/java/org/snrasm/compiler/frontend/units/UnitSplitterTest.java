package org.snrasm.compiler.frontend.units;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class UnitSplitterTest {

    @Test
    void testSplitsAtRoutinesAndTopLevelLabels() {
        // Arrange
        String source = """
                def A = 1
                def B = 2
                function F
                    return
                endfun
                MAIN:
                    EXIT
                """;

        // Act
        List<SourceUnit> units = UnitSplitter.split(source);

        // Assert
        assertThat(units).extracting(SourceUnit::text).containsExactly(
                "def A = 1\ndef B = 2\n",
                "function F\n    return\nendfun\n",
                "MAIN:\n    EXIT\n");
        assertThat(units).extracting(SourceUnit::index).containsExactly(0, 1, 2);
        assertThat(units.get(1).offset()).isEqualTo(source.indexOf("function"));
        assertThat(units.get(2).name()).isEqualTo("unit#2");
    }

    /**
     * Labels inside a routine belong to the routine and never start a unit.
     */
    @Test
    void testLocalLabelsStayInsideRoutine() {
        String source = "function F\n_LOOP:\n    j _LOOP\nendfun\n";

        List<SourceUnit> units = UnitSplitter.split(source);

        assertThat(units).singleElement().extracting(SourceUnit::text).isEqualTo(source);
    }

    @Test
    void testCommentedOutHeaderDoesNotSplit() {
        // Arrange
        String source = "MAIN:\n    /* function X\n    endfun */ EXIT\n    // subroutine Y\n    EXIT\n";

        // Act
        List<SourceUnit> units = UnitSplitter.split(source);

        // Assert
        assertThat(units).hasSize(1);
    }

    @Test
    void testContinuedLineIsOneLogicalLine() {
        String source = "MAIN:\n    MSGSET 1, \\\nOTHER: \"x\"\n";

        List<SourceUnit> units = UnitSplitter.split(source);

        assertThat(units).hasSize(1);
    }

    @Test
    void testConcatenationYieldsFile() {
        String source = "  \n// lead\nL1:\n    EXIT\nsubroutine S\n    retsub\nendsub\ndef X = 3\nL2:\n    gosub S\n";

        List<SourceUnit> units = UnitSplitter.split(source);

        assertThat(units).hasSize(5);
        assertThat(units.stream().map(SourceUnit::text).collect(Collectors.joining())).isEqualTo(source);
        for (SourceUnit unit : units) {
            assertThat(source.substring(unit.span().start(), unit.span().end())).isEqualTo(unit.text());
        }
    }

    @Test
    void testEmptyFileYieldsOneEmptyUnit() {
        assertThat(UnitSplitter.split("")).singleElement()
                .satisfies(u -> assertThat(u.text()).isEmpty());
    }
}
