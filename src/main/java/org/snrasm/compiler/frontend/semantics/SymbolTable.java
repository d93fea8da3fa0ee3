package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A symbol table for managing scopes and symbols during semantic analysis.
 * It supports nested scopes and resolving symbols from an inner scope outwards.
 * <p>
 * Within one scope no two symbols of the same namespace share a name. Labels, functions
 * and subroutines form one namespace (they all name code addresses); every other
 * symbol type is its own namespace.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final String name;
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, List<Symbol>> symbols = new LinkedHashMap<>();

        Scope(String name, Scope parent) {
            this.name = name;
            this.parent = parent;
        }

        public String name() {
            return name;
        }

        public Scope parent() {
            return parent;
        }

        public List<Scope> children() {
            return Collections.unmodifiableList(children);
        }

        /**
         * @return All symbols defined directly in this scope, in definition order.
         */
        public List<Symbol> symbols() {
            List<Symbol> all = new ArrayList<>();
            symbols.values().forEach(all::addAll);
            return all;
        }

        /**
         * Looks a name up in this scope only.
         * @param name   The name.
         * @param filter Accepted symbol types.
         * @return The symbol, if defined here.
         */
        public Optional<Symbol> lookupLocal(String name, Predicate<Symbol.Type> filter) {
            return symbols.getOrDefault(name, List.of()).stream().filter(s -> filter.test(s.type())).findFirst();
        }
    }

    private final Scope rootScope;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new symbol table.
     * @param diagnostics The diagnostics engine for reporting duplicate definitions.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.rootScope = new Scope(Symbol.GLOBAL, null);
    }

    public Scope root() {
        return rootScope;
    }

    /**
     * Creates a nested scope.
     * @param name   The name of the scope; it becomes the owner of symbols defined in it.
     * @param parent The enclosing scope.
     * @return The new scope.
     */
    public Scope createScope(String name, Scope parent) {
        Scope scope = new Scope(name, parent);
        parent.children.add(scope);
        return scope;
    }

    /**
     * Defines a new symbol in its owner scope.
     * Reports an error if a symbol of the same namespace is already defined there;
     * the first definition is kept.
     * @param scope  The scope to define the symbol in.
     * @param symbol The symbol to define.
     * @return true if the symbol was added.
     */
    public boolean define(Scope scope, Symbol symbol) {
        Optional<Symbol> existing = scope.lookupLocal(symbol.name(), t -> sameNamespace(t, symbol.type()));
        if (existing.isPresent()) {
            diagnostics.reportError(
                    "Duplicate definition of " + symbol.type().describe() + " `" + symbol.name() + "`",
                    symbol.span(),
                    new Diagnostic.Label(existing.get().span(), "first defined here"));
            return false;
        }
        scope.symbols.computeIfAbsent(symbol.name(), k -> new ArrayList<>()).add(symbol);
        return true;
    }

    /**
     * Resolves a symbol by name, searching from the given scope upwards to the root.
     * @param name   The name to resolve.
     * @param scope  The innermost scope to search.
     * @param filter Accepted symbol types.
     * @return An optional containing the found symbol, or empty if not found.
     */
    public Optional<Symbol> resolve(String name, Scope scope, Predicate<Symbol.Type> filter) {
        for (Scope s = scope; s != null; s = s.parent) {
            Optional<Symbol> found = s.lookupLocal(name, filter);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static boolean sameNamespace(Symbol.Type a, Symbol.Type b) {
        return a == b || (a.isCodeAddress() && b.isCodeAddress());
    }
}
