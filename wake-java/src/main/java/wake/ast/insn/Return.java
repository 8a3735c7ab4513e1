package wake.ast.insn;

public record Return() implements Instruction {
    @Override public Opcode opcode() { return Opcode.RET; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitReturn(this); }
}
