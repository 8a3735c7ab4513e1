package wake.ast.insn;

import java.util.List;

public record Xor(String dest, List<String> sources) implements BinaryInstruction {
    public Xor {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Xor(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.XOR; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitXor(this); }
}
