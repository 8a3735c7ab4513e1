package wake.ast.insn;

import java.util.List;

public record Add(String dest, List<String> sources) implements BinaryInstruction {
    public Add {
        sources = BinaryInstruction.checkSources(sources);
    }

    public Add(String dest, String src) {
        this(dest, List.of(src));
    }

    @Override public Opcode opcode() { return Opcode.ADD; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitAdd(this); }
}
