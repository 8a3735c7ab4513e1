package wake.ast.insn;

import java.util.List;

public record And(String dest, List<String> sources) implements BinaryInstruction {
    public And {
        sources = BinaryInstruction.checkSources(sources);
    }

    public And(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.AND; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitAnd(this); }
}
