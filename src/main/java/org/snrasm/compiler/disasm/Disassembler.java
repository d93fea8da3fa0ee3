package org.snrasm.compiler.disasm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snrasm.compiler.api.DisassemblyResult;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.isa.CodeReader;
import org.snrasm.compiler.isa.DecodingException;
import org.snrasm.compiler.isa.IInstructionSet;
import org.snrasm.compiler.isa.TextCodec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a code block back into source text that assembles to the same bytes.
 * <p>
 * Code targets without an external name are called {@code LABEL_xxxx} after their address
 * (the prefix is configurable); recovered functions are called {@code FUN_xxxx}. Decoding
 * stops at the first instruction that cannot be decoded; the listing up to there is still
 * returned together with the error.
 */
public class Disassembler {

    private static final Logger LOG = LoggerFactory.getLogger(Disassembler.class);

    /** Name prefix of recovered functions without an external name. */
    public static final String FUNCTION_PREFIX = "FUN_";

    private final InstructionDecoder decoder;
    private final long baseAddress;
    private final String labelPrefix;

    /**
     * @param isa         The instruction set.
     * @param text        The text encoding of string operands.
     * @param baseAddress The address the block is loaded at.
     * @param labelPrefix The prefix of synthesized label names.
     */
    public Disassembler(IInstructionSet isa, TextCodec text, long baseAddress, String labelPrefix) {
        this.decoder = new InstructionDecoder(isa, text);
        this.baseAddress = baseAddress;
        this.labelPrefix = labelPrefix;
    }

    public DisassemblyResult disassemble(byte[] code) {
        return disassemble(code, Map.of());
    }

    /**
     * Disassembles a code block.
     *
     * @param code  The code block.
     * @param names External names of code addresses, used instead of synthesized names.
     * @return The listing and the diagnostics; spans are byte ranges of the block.
     */
    public DisassemblyResult disassemble(byte[] code, Map<Long, String> names) {
        long startTime = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("<binary>");
        List<DecodedInstruction> instructions = decodeAll(code, diagnostics);
        long endAddress = instructions.isEmpty() ? baseAddress : instructions.get(instructions.size() - 1).end();

        Set<Long> boundaries = new HashSet<>();
        instructions.forEach(ins -> boundaries.add(ins.address()));
        boundaries.add(endAddress);

        TreeSet<Long> targets = new TreeSet<>();
        for (DecodedInstruction ins : instructions) {
            for (long t : ins.targets()) {
                if (!boundaries.contains(t)) {
                    diagnostics.reportError(String.format("Code target 0x%04x of `%s` at 0x%04x is not at an instruction boundary",
                            t, ins.mnemonic(), ins.address()), ins.instruction().span());
                }
                targets.add(t);
            }
        }
        for (long named : names.keySet()) {
            if (boundaries.contains(named)) {
                targets.add(named);
            }
        }

        List<FunctionReconstructor.Region> regions = new FunctionReconstructor(instructions, diagnostics).reconstruct();
        String text = new Listing(instructions, regions, targets, names, endAddress).print();

        LOG.debug("Disassembled {} instructions ({} bytes) in {} ms", instructions.size(), code.length,
                (System.nanoTime() - startTime) / 1_000_000);
        return new DisassemblyResult(text, diagnostics.getDiagnostics());
    }

    private List<DecodedInstruction> decodeAll(byte[] code, DiagnosticsEngine diagnostics) {
        List<DecodedInstruction> instructions = new ArrayList<>();
        CodeReader in = new CodeReader(code, 0);
        while (!in.isAtEnd()) {
            int start = in.position();
            try {
                instructions.add(decoder.decode(in, baseAddress));
            } catch (DecodingException e) {
                int at = Math.max(start, Math.min(e.getOffset(), code.length));
                diagnostics.reportError(String.format("%s (instruction at 0x%04x)", e.getMessage(), baseAddress + start),
                        new Span(start, Math.max(at, start + 1)));
                break;
            }
        }
        return instructions;
    }

    /**
     * Lays out labels, function headers and instructions of one listing.
     */
    private final class Listing {

        private final List<DecodedInstruction> instructions;
        private final Map<Integer, FunctionReconstructor.Region> regionByFirst = new HashMap<>();
        private final Map<Integer, FunctionReconstructor.Region> regionByIndex = new HashMap<>();
        private final Map<Long, FunctionReconstructor.Region> regionByAddress = new HashMap<>();
        private final TreeSet<Long> targets;
        private final Map<Long, String> names;
        private final long endAddress;
        private final StringBuilder out = new StringBuilder();

        Listing(List<DecodedInstruction> instructions, List<FunctionReconstructor.Region> regions,
                TreeSet<Long> targets, Map<Long, String> names, long endAddress) {
            this.instructions = instructions;
            this.targets = targets;
            this.names = names;
            this.endAddress = endAddress;
            for (FunctionReconstructor.Region r : regions) {
                regionByFirst.put(r.first(), r);
                regionByAddress.put(instructions.get(r.first()).address(), r);
                for (int i = r.first(); i <= r.last(); i++) {
                    regionByIndex.put(i, r);
                }
            }
        }

        String print() {
            for (int i = 0; i < instructions.size(); i++) {
                DecodedInstruction ins = instructions.get(i);
                FunctionReconstructor.Region region = regionByIndex.get(i);
                if (regionByFirst.containsKey(i)) {
                    blankLine();
                    out.append(header(ins.address(), region)).append('\n');
                    if (isJumpedToFromInside(region)) {
                        out.append(syntheticLabel(ins.address())).append(":\n");
                    }
                } else if (targets.contains(ins.address())) {
                    if (region == null) {
                        blankLine();
                    }
                    out.append(labelName(ins.address())).append(":\n");
                }

                final int index = i;
                SourcePrinter printer = new SourcePrinter(t -> operandName(t, index));
                out.append(SourcePrinter.INDENT).append(printer.print(ins.instruction())).append('\n');

                if (region != null && region.last() == i) {
                    out.append("endfun\n");
                }
            }
            if (targets.contains(endAddress) && !instructions.isEmpty()) {
                blankLine();
                out.append(labelName(endAddress)).append(":\n");
            }
            return out.toString();
        }

        private String header(long address, FunctionReconstructor.Region region) {
            StringBuilder sb = new StringBuilder("function ").append(functionName(address));
            if (region.parameters() > 0) {
                List<String> params = new ArrayList<>();
                for (int p = 0; p < region.parameters(); p++) {
                    params.add("$a" + p);
                }
                sb.append('(').append(String.join(", ", params)).append(')');
            }
            return sb.toString();
        }

        private boolean isJumpedToFromInside(FunctionReconstructor.Region region) {
            long start = instructions.get(region.first()).address();
            for (int i = region.first(); i <= region.last(); i++) {
                DecodedInstruction ins = instructions.get(i);
                if ("call".equals(ins.mnemonic())) {
                    continue;
                }
                if (ins.targets().contains(start)) {
                    return true;
                }
            }
            return false;
        }

        private String operandName(long target, int index) {
            FunctionReconstructor.Region callee = regionByAddress.get(target);
            if (callee != null) {
                if ("call".equals(instructions.get(index).mnemonic())) {
                    return functionName(target);
                }
                return syntheticLabel(target);
            }
            return labelName(target);
        }

        private String functionName(long address) {
            return names.getOrDefault(address, String.format("%s%04x", FUNCTION_PREFIX, address));
        }

        private String labelName(long address) {
            return names.getOrDefault(address, syntheticLabel(address));
        }

        private String syntheticLabel(long address) {
            return String.format("%s%04x", labelPrefix, address);
        }

        private void blankLine() {
            if (out.length() > 0) {
                out.append('\n');
            }
        }
    }
}
