package org.snrasm.compiler.isa;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.snrasm.compiler.isa.OperandKind.BITMASK;
import static org.snrasm.compiler.isa.OperandKind.CODE_ADDRESS;
import static org.snrasm.compiler.isa.OperandKind.CONDITION;
import static org.snrasm.compiler.isa.OperandKind.EXPRESSION;
import static org.snrasm.compiler.isa.OperandKind.MESSAGE_ID;
import static org.snrasm.compiler.isa.OperandKind.NUMBER;
import static org.snrasm.compiler.isa.OperandKind.NUMBER_LIST;
import static org.snrasm.compiler.isa.OperandKind.NUMBER_TABLE;
import static org.snrasm.compiler.isa.OperandKind.ADDRESS_TABLE;
import static org.snrasm.compiler.isa.OperandKind.REGISTER;
import static org.snrasm.compiler.isa.OperandKind.REGISTER_LIST;
import static org.snrasm.compiler.isa.OperandKind.FIXUP_STRING;
import static org.snrasm.compiler.isa.OperandKind.STRING;
import static org.snrasm.compiler.isa.OperandKind.STRING_ARRAY;
import static org.snrasm.compiler.isa.OperandKind.U16;
import static org.snrasm.compiler.isa.OperandKind.U8;

/**
 * The instruction set of the scenario VM: the arithmetic and control flow instructions
 * ({@code 0x40..0x50}) and the engine commands ({@code 0x00}, {@code 0x81..0xFF}).
 */
public final class ScenarioInstructionSet implements IInstructionSet {

    public static final int OP_UO = 0x40;
    public static final int OP_BO = 0x41;

    private static final ScenarioInstructionSet INSTANCE = new ScenarioInstructionSet();

    private final Map<String, InstructionDef> byName = new LinkedHashMap<>();
    private final Map<Integer, InstructionDef> byCode = new HashMap<>();

    public static ScenarioInstructionSet getInstance() {
        return INSTANCE;
    }

    private ScenarioInstructionSet() {
        String[] unary = {"zero", "not16", "neg", "abs"};
        for (int i = 0; i < unary.length; i++) {
            register(new InstructionDef(unary[i], OP_UO, i, Shape.UNARY, fields(REGISTER, NUMBER)));
        }
        String[] binary = {"mov", "bzero", "add", "sub", "mul", "div", "mod", "and", "or", "xor",
                "shl", "shr", "mulr", "divr", "atan2", "setbit", "clrbit", "ctz"};
        for (int i = 0; i < binary.length; i++) {
            register(new InstructionDef(binary[i], OP_BO, i, Shape.BINARY, fields(REGISTER, NUMBER, NUMBER)));
        }
        plain("exp", 0x42, REGISTER, EXPRESSION);
        plain("gt", 0x44, REGISTER, NUMBER, NUMBER_TABLE);
        plain("jc", 0x46, CONDITION, CODE_ADDRESS);
        plain("j", 0x47, CODE_ADDRESS);
        plain("gosub", 0x48, CODE_ADDRESS);
        plain("retsub", 0x49);
        plain("jt", 0x4A, NUMBER, ADDRESS_TABLE);
        plain("rnd", 0x4C, REGISTER, NUMBER, NUMBER);
        plain("push", 0x4D, NUMBER_LIST);
        plain("pop", 0x4E, REGISTER_LIST);
        plain("call", 0x4F, CODE_ADDRESS, NUMBER_LIST);
        plain("return", 0x50);

        register(new InstructionDef("EXIT", 0x00, -1, Shape.PLAIN,
                List.of(Field.optional(U8, 0), Field.optional(NUMBER, 1))));
        command("SGET", 0x81, REGISTER, NUMBER);
        command("SSET", 0x82, NUMBER, NUMBER);
        register(new InstructionDef("WAIT", 0x83, -1, Shape.PLAIN,
                List.of(Field.flag(InstructionFlag.INTERRUPTABLE, false), Field.of(NUMBER))));
        command("MSGINIT", 0x85, NUMBER);
        register(new InstructionDef("MSGSET", 0x86, -1, Shape.PLAIN,
                List.of(Field.of(MESSAGE_ID), Field.flag(InstructionFlag.NOWAIT, true), Field.of(FIXUP_STRING))));
        command("MSGWAIT", 0x87, NUMBER);
        command("MSGSIGNAL", 0x88);
        command("MSGSYNC", 0x89, NUMBER, NUMBER);
        register(new InstructionDef("MSGCLOSE", 0x8A, -1, Shape.PLAIN,
                List.of(Field.flag(InstructionFlag.NOWAIT, true))));
        command("SELECT", 0x8D, U16, U16, REGISTER, NUMBER, STRING, STRING_ARRAY);
        command("WIPE", 0x8E, NUMBER, NUMBER, NUMBER, BITMASK);
        command("WIPEWAIT", 0x8F);
        command("BGMPLAY", 0x90, NUMBER, NUMBER, NUMBER, NUMBER);
        command("BGMSTOP", 0x91, NUMBER);
        command("BGMVOL", 0x92, NUMBER, NUMBER);
        command("BGMWAIT", 0x93, NUMBER);
        command("BGMSYNC", 0x94, NUMBER);
        command("SEPLAY", 0x95, NUMBER, NUMBER, NUMBER, NUMBER, NUMBER, NUMBER, NUMBER);
        command("SESTOP", 0x96, NUMBER, NUMBER);
        command("SESTOPALL", 0x97, NUMBER);
        command("SEVOL", 0x98, NUMBER, NUMBER, NUMBER);
        command("SEPAN", 0x99, NUMBER, NUMBER, NUMBER);
        command("SEWAIT", 0x9A, NUMBER, NUMBER);
        command("SEONCE", 0x9B, NUMBER, NUMBER, NUMBER, NUMBER, NUMBER);
        command("VOICEPLAY", 0x9C, STRING, NUMBER, NUMBER);
        command("VOICESTOP", 0x9D);
        command("VOICEWAIT", 0x9E, NUMBER);
        command("SYSSE", 0x9F, NUMBER, NUMBER);
        command("SAVEINFO", 0xA0, NUMBER, FIXUP_STRING);
        command("AUTOSAVE", 0xA1);
        command("EVBEGIN", 0xA2, NUMBER);
        command("EVEND", 0xA3);
        command("RESUMESET", 0xA4);
        command("RESUME", 0xA5);
        command("SYSCALL", 0xA6, NUMBER, NUMBER);
        command("TROPHY", 0xB0, NUMBER);
        command("UNLOCK", 0xB1, U8, NUMBER_LIST);
        command("LAYERINIT", 0xC0, NUMBER);
        command("LAYERLOAD", 0xC1, NUMBER, NUMBER, NUMBER, BITMASK);
        command("LAYERUNLOAD", 0xC2, NUMBER, NUMBER);
        command("LAYERCTRL", 0xC3, NUMBER, NUMBER, BITMASK);
        command("LAYERWAIT", 0xC4, NUMBER, NUMBER_LIST);
        command("LAYERSWAP", 0xC5, NUMBER, NUMBER);
        command("LAYERSELECT", 0xC6, NUMBER, NUMBER);
        command("MOVIEWAIT", 0xC7, NUMBER, NUMBER);
        command("TRANSSET", 0xC9, NUMBER, NUMBER, NUMBER, BITMASK);
        command("TRANSWAIT", 0xCA, NUMBER);
        command("PAGEBACK", 0xCB);
        command("PLANESELECT", 0xCC, NUMBER);
        command("PLANECLEAR", 0xCD);
        command("MASKLOAD", 0xCE, NUMBER, NUMBER, NUMBER);
        command("MASKUNLOAD", 0xCF);
        command("CHARS", 0xE0, NUMBER, NUMBER);
        command("TIPSGET", 0xE1, NUMBER_LIST);
        command("QUIZ", 0xE2, REGISTER, NUMBER);
        command("SHOWCHARS", 0xE3);
        command("NOTIFYSET", 0xE4, NUMBER);
        command("DEBUGOUT", 0xFF, STRING, NUMBER_LIST);
    }

    private static List<Field> fields(OperandKind... kinds) {
        List<Field> result = new ArrayList<>();
        for (OperandKind kind : kinds) {
            result.add(Field.of(kind));
        }
        return result;
    }

    private void plain(String mnemonic, int opcode, OperandKind... kinds) {
        register(new InstructionDef(mnemonic, opcode, -1, Shape.PLAIN, fields(kinds)));
    }

    private void command(String mnemonic, int opcode, OperandKind... kinds) {
        plain(mnemonic, opcode, kinds);
    }

    private void register(InstructionDef def) {
        byName.put(def.mnemonic().toUpperCase(Locale.ROOT), def);
        byCode.put(key(def.opcode(), def.subtype()), def);
    }

    private static int key(int opcode, int subtype) {
        return (opcode << 8) | (subtype & 0xFF);
    }

    @Override
    public Optional<InstructionDef> byMnemonic(String mnemonic) {
        return Optional.ofNullable(byName.get(mnemonic.toUpperCase(Locale.ROOT)));
    }

    @Override
    public Optional<InstructionDef> byOpcode(int opcode, int subtype) {
        return Optional.ofNullable(byCode.get(key(opcode, hasSubtype(opcode) ? subtype : -1)));
    }

    @Override
    public boolean hasSubtype(int opcode) {
        return opcode == OP_UO || opcode == OP_BO;
    }

    @Override
    public Collection<InstructionDef> all() {
        return Collections.unmodifiableCollection(byName.values());
    }
}
