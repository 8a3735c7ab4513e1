package wake.ast.insn;

import java.util.List;

public record ShiftLeft(String dest, List<String> sources) implements BinaryInstruction {
    public ShiftLeft {
        sources = BinaryInstruction.checkSources(sources);
    }

    public ShiftLeft(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.SHL; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitShiftLeft(this); }
}
