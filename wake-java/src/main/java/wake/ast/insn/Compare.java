package wake.ast.insn;

import java.util.List;

public record Compare(String dest, List<String> sources) implements BinaryInstruction {
    public Compare {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Compare(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.CMP; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitCompare(this); }
}
