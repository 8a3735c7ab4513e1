package wake.ast.insn;

import java.util.List;

public record ShiftRight(String dest, List<String> sources) implements BinaryInstruction {
    public ShiftRight {
        sources = BinaryInstruction.checkSources(sources);
    }

    public ShiftRight(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.SHR; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitShiftRight(this); }
}
