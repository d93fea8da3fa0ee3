package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.incremental.ContentHash;
import org.snrasm.compiler.isa.Register;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * The frozen result of the collection pass: every file-level symbol with the evaluated
 * constants, the resolved register aliases and the routine signatures.
 * <p>
 * Per-unit analysis only reads this object, so units can be analyzed concurrently.
 */
public final class ProgramScope {

    private final SymbolTable symbolTable;
    private final Map<String, ConstValue> constants;
    private final Map<String, Register> aliases;
    private final Map<String, RoutineInfo> routines;
    private String fingerprint;

    public ProgramScope(SymbolTable symbolTable, Map<String, ConstValue> constants,
                        Map<String, Register> aliases, Map<String, RoutineInfo> routines) {
        this.symbolTable = symbolTable;
        this.constants = Collections.unmodifiableMap(new TreeMap<>(constants));
        this.aliases = Collections.unmodifiableMap(new TreeMap<>(aliases));
        this.routines = Collections.unmodifiableMap(new TreeMap<>(routines));
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public Optional<Symbol> resolve(String name, Predicate<Symbol.Type> filter) {
        return symbolTable.root().lookupLocal(name, filter);
    }

    /**
     * @param name The constant name.
     * @return The value; empty if the constant is undefined or its evaluation failed.
     */
    public Optional<ConstValue> constant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    /**
     * @param name The alias including its {@code $}.
     * @return The register at the end of the alias chain; empty if undefined or cyclic.
     */
    public Optional<Register> alias(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    public Optional<RoutineInfo> routine(String name) {
        return Optional.ofNullable(routines.get(name));
    }

    public Map<String, ConstValue> constants() {
        return constants;
    }

    /**
     * A digest of everything per-unit analysis can observe from outside its unit.
     * Symbol positions are left out: moving a definition does not change how other
     * units resolve against it.
     * @return A hex SHA-256 digest.
     */
    public synchronized String fingerprint() {
        if (fingerprint == null) {
            StringBuilder sb = new StringBuilder();
            new TreeMap<>(collectSymbols()).forEach((k, v) -> sb.append(k).append('=').append(v).append('\n'));
            constants.forEach((k, v) -> sb.append("const ").append(k).append('=').append(v.value()).append(':').append(v.kind()).append('\n'));
            aliases.forEach((k, v) -> sb.append("alias ").append(k).append('=').append(v.id()).append('\n'));
            routines.forEach((k, v) -> sb.append("routine ").append(k).append('=').append(v.parameterCount()).append('\n'));
            fingerprint = ContentHash.of(sb.toString());
        }
        return fingerprint;
    }

    private Map<String, String> collectSymbols() {
        Map<String, String> result = new TreeMap<>();
        for (Symbol s : symbolTable.root().symbols()) {
            result.put(s.type() + " " + s.name(), s.owner());
        }
        return result;
    }
}
