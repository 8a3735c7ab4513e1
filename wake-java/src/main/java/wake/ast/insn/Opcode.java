package wake.ast.insn;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Instruction set: the Wake keyword that introduces an instruction and the
 * Masm mnemonic it is emitted as.
 */
public enum Opcode {
    MOV("mov", "MOV"),
    DB("db", "DB"),
    CALL("call", "CALL"),
    HLT("hlt", "HLT"),
    RET("ret", "RET"),

    // arithmetic
    ADD("add", "ADD"),
    SUB("sub", "SUB"),
    MUL("mul", "MUL"),
    DIV("div", "DIV"),
    INC("inc", "INC"),

    // control flow
    JMP("jmp", "JMP"),
    CMP("cmp", "CMP"),
    JE("je", "JE"),
    JNE("jne", "JNE"),
    JL("jl", "JL"),
    JG("jg", "JG"),

    // stack
    PUSH("push", "PUSH"),
    POP("pop", "POP"),

    // io
    OUT("out", "OUT"),
    COUT("cout", "COUT"),
    EXIT("exit", "EXIT"),

    // bitwise
    AND("and", "AND"),
    OR("or", "OR"),
    XOR("xor", "XOR"),
    NOT("not", "NOT"),
    SHL("shl", "SHL"),
    SHR("shr", "SHR");

    private static final Map<String, Opcode> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Opcode::keyword, Function.identity()));

    private final String keyword;
    private final String mnemonic;

    Opcode(String keyword, String mnemonic) {
        this.keyword = keyword;
        this.mnemonic = mnemonic;
    }

    public String keyword() { return keyword; }

    public String mnemonic() { return mnemonic; }

    public static Optional<Opcode> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }
}
