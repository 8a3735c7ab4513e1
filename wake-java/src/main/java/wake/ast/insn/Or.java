package wake.ast.insn;

import java.util.List;

public record Or(String dest, List<String> sources) implements BinaryInstruction {
    public Or {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Or(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.OR; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitOr(this); }
}
