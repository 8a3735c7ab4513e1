package wake.ast.insn;

import java.util.List;

public record Subtract(String dest, List<String> sources) implements BinaryInstruction {
    public Subtract {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Subtract(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.SUB; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitSubtract(this); }
}
