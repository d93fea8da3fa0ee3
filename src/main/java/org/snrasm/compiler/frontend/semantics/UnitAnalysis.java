package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.isa.InstructionDef;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The result of analyzing one unit, keyed by syntax node identity.
 * Instructions that failed validation have no entry in {@link #instruction}.
 */
public final class UnitAnalysis {

    private final ProgramScope program;
    private final Map<SyntaxNode, Resolution> resolutions = new IdentityHashMap<>();
    private final Map<SyntaxNode, InstructionDef> instructions = new IdentityHashMap<>();
    private final Map<SyntaxNode, RoutineScope> routines = new IdentityHashMap<>();
    private final Map<SyntaxNode, Symbol> labels = new IdentityHashMap<>();
    private final Map<SyntaxNode, List<JumpTableEntry>> jumpTables = new IdentityHashMap<>();

    public UnitAnalysis(ProgramScope program) {
        this.program = program;
    }

    public ProgramScope program() {
        return program;
    }

    public void resolve(SyntaxNode reference, Resolution resolution) {
        resolutions.put(reference, resolution);
    }

    public Optional<Resolution> resolution(SyntaxNode reference) {
        return Optional.ofNullable(resolutions.get(reference));
    }

    public void accept(SyntaxNode instruction, InstructionDef definition) {
        instructions.put(instruction, definition);
    }

    public Optional<InstructionDef> instruction(SyntaxNode instruction) {
        return Optional.ofNullable(instructions.get(instruction));
    }

    public void routine(SyntaxNode node, RoutineScope scope) {
        routines.put(node, scope);
    }

    public Optional<RoutineScope> routine(SyntaxNode node) {
        return Optional.ofNullable(routines.get(node));
    }

    /**
     * Records the symbol a label definition introduces. Duplicate local labels are not recorded.
     * @param label  The {@code LABEL} node.
     * @param symbol The symbol.
     */
    public void label(SyntaxNode label, Symbol symbol) {
        labels.put(label, symbol);
    }

    public Optional<Symbol> label(SyntaxNode label) {
        return Optional.ofNullable(labels.get(label));
    }

    public void jumpTable(SyntaxNode instruction, List<JumpTableEntry> entries) {
        jumpTables.put(instruction, List.copyOf(entries));
    }

    public List<JumpTableEntry> jumpTable(SyntaxNode instruction) {
        return jumpTables.getOrDefault(instruction, List.of());
    }
}
