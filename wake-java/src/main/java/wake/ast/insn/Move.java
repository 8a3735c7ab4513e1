package wake.ast.insn;

public record Move(String dest, String src) implements Instruction {
    @Override public Opcode opcode() { return Opcode.MOV; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitMove(this); }
}
