package wake.ast.insn;

import java.util.List;

public record Divide(String dest, List<String> sources) implements BinaryInstruction {
    public Divide {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Divide(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.DIV; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitDivide(this); }
}
