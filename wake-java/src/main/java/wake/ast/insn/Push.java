package wake.ast.insn;

public record Push(String operand) implements UnaryInstruction {
    @Override public Opcode opcode() { return Opcode.PUSH; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitPush(this); }
}
