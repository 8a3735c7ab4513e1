package wake.ast.insn;

import java.util.List;

public record Multiply(String dest, List<String> sources) implements BinaryInstruction {
    public Multiply {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Multiply(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.MUL; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitMultiply(this); }
}
