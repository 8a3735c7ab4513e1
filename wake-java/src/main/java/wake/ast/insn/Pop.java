package wake.ast.insn;

public record Pop(String operand) implements UnaryInstruction {
    @Override public Opcode opcode() { return Opcode.POP; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitPop(this); }
}
