package org.snrasm.compiler.disasm;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.ir.IrAddress;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrOperand;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Recovers function boundaries from decoded code.
 * <p>
 * {@code return} and {@code call} only assemble inside and towards functions, so every
 * call target is tried as the start of a function. The function ends at the first
 * {@code return} that no jump from inside the function goes past. A candidate is rejected
 * when it contains {@code retsub}, overlaps another function, is entered by anything other
 * than a {@code call} of its start, or is called with differing argument counts.
 * <p>
 * A {@code return} left outside every called function belongs to a function nothing calls.
 * That function starts after the closest preceding instruction that never falls through,
 * or at the start of the block, and takes no parameters.
 */
final class FunctionReconstructor {

    /** The most parameters a function header can declare. */
    static final int MAX_PARAMETERS = 16;

    /**
     * A recovered function.
     *
     * @param first      The index of the first instruction.
     * @param last       The index of the final {@code return}.
     * @param parameters The argument count every call site passes.
     */
    record Region(int first, int last, int parameters) {
        boolean contains(int index) {
            return index >= first && index <= last;
        }
    }

    private final List<DecodedInstruction> code;
    private final DiagnosticsEngine diagnostics;
    private final Map<Long, Integer> indexByAddress = new HashMap<>();

    FunctionReconstructor(List<DecodedInstruction> code, DiagnosticsEngine diagnostics) {
        this.code = code;
        this.diagnostics = diagnostics;
        for (int i = 0; i < code.size(); i++) {
            indexByAddress.put(code.get(i).address(), i);
        }
    }

    /**
     * Finds all functions. Call targets that cannot be delimited are reported as warnings.
     * @return The regions in address order.
     */
    List<Region> reconstruct() {
        TreeSet<Long> callTargets = new TreeSet<>();
        for (DecodedInstruction ins : code) {
            if ("call".equals(ins.mnemonic())) {
                callTargets.add(callTarget(ins));
            }
        }

        List<Region> regions = new ArrayList<>();
        for (long target : callTargets) {
            Integer start = indexByAddress.get(target);
            if (start == null) {
                continue;
            }
            delimit(start, callTargets, true).ifPresent(regions::add);
        }

        for (int i = 0; i < code.size(); i++) {
            DecodedInstruction ins = code.get(i);
            if (!"return".equals(ins.mnemonic()) || covers(regions, i)) {
                continue;
            }
            Optional<Region> uncalled = delimit(uncalledStart(i), callTargets, false)
                    .filter(r -> regions.stream().noneMatch(other -> overlaps(r, other)));
            if (uncalled.isPresent()) {
                regions.add(uncalled.get());
            } else {
                diagnostics.reportWarning("`return` at " + hex(ins.address())
                        + " is outside of any function; the listing will not reassemble", span(ins));
            }
        }
        regions.sort(Comparator.comparingInt(Region::first));
        return regions;
    }

    private int uncalledStart(int returnIndex) {
        int start = returnIndex;
        while (start > 0 && !code.get(start - 1).instruction().definition().neverFallsThrough()) {
            start--;
        }
        return start;
    }

    private static boolean covers(List<Region> regions, int index) {
        return regions.stream().anyMatch(r -> r.contains(index));
    }

    private static boolean overlaps(Region a, Region b) {
        return a.first() <= b.last() && b.first() <= a.last();
    }

    /**
     * @param called Whether the start is a call target; otherwise no call target may lie in the function.
     */
    private Optional<Region> delimit(int start, TreeSet<Long> callTargets, boolean called) {
        long startAddress = code.get(start).address();
        long furthest = startAddress;
        int last = -1;
        for (int k = start; k < code.size(); k++) {
            DecodedInstruction ins = code.get(k);
            if ((k > start || !called) && callTargets.contains(ins.address())) {
                reject(startAddress, "it runs into the function at " + hex(ins.address()));
                return Optional.empty();
            }
            if ("retsub".equals(ins.mnemonic())) {
                reject(startAddress, "it contains `retsub` at " + hex(ins.address()));
                return Optional.empty();
            }
            if (!"call".equals(ins.mnemonic()) && !"gosub".equals(ins.mnemonic())) {
                for (long t : ins.targets()) {
                    furthest = Math.max(furthest, t);
                }
            }
            if ("return".equals(ins.mnemonic()) && furthest <= ins.address()) {
                last = k;
                break;
            }
        }
        if (last < 0) {
            reject(startAddress, "no `return` ends it");
            return Optional.empty();
        }

        long endAddress = code.get(last).end();
        int parameters = -1;
        for (int i = 0; i < code.size(); i++) {
            DecodedInstruction ins = code.get(i);
            boolean inside = i >= start && i <= last;
            if ("call".equals(ins.mnemonic()) && callTarget(ins) == startAddress) {
                int count = callArguments(ins);
                if (parameters >= 0 && parameters != count) {
                    reject(startAddress, "call sites pass " + parameters + " and " + count + " arguments");
                    return Optional.empty();
                }
                parameters = count;
                continue;
            }
            if (inside) {
                continue;
            }
            for (long t : ins.targets()) {
                if (t >= startAddress && t < endAddress) {
                    reject(startAddress, "it is entered from " + hex(ins.address()));
                    return Optional.empty();
                }
            }
        }
        if (parameters > MAX_PARAMETERS) {
            reject(startAddress, "it takes " + parameters + " arguments, at most " + MAX_PARAMETERS + " are supported");
            return Optional.empty();
        }
        return Optional.of(new Region(start, last, Math.max(parameters, 0)));
    }

    private void reject(long address, String reason) {
        Integer index = indexByAddress.get(address);
        Span at = index == null ? Span.NONE : span(code.get(index));
        diagnostics.reportWarning("Cannot reconstruct the function at " + hex(address) + ": " + reason
                + "; the listing will not reassemble", at);
    }

    static long callTarget(DecodedInstruction call) {
        return ((IrAddress) call.instruction().operands().get(0)).address();
    }

    static int callArguments(DecodedInstruction call) {
        IrOperand args = call.instruction().operands().get(1);
        return args instanceof IrList list ? list.elements().size() : 0;
    }

    private static Span span(DecodedInstruction ins) {
        return ins.instruction().span();
    }

    static String hex(long address) {
        return String.format("0x%04x", address);
    }
}
