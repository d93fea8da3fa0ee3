package org.snrasm.compiler.ir;

import org.snrasm.compiler.diagnostics.Span;

import java.util.Map;

/**
 * Generic directive marker in the IR stream, consumed by emission rules. Arguments
 * use a small typed value system to avoid Object-typed maps.
 */
public record IrDirective(String namespace, String name, Map<String, IrValue> args, Span span) implements IrItem {

    public IrDirective {
        args = Map.copyOf(args);
    }

    public boolean is(String namespace, String name) {
        return this.namespace.equals(namespace) && this.name.equals(name);
    }
}
