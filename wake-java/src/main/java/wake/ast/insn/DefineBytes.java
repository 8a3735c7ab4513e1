package wake.ast.insn;

// address: digits after $ (empty for a bare $); text keeps its quotes
public record DefineBytes(String address, String text) implements Instruction {
    @Override public Opcode opcode() { return Opcode.DB; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitDefineBytes(this); }
}
