package wake.ast.insn;

public record Not(String operand) implements UnaryInstruction {
    @Override public Opcode opcode() { return Opcode.NOT; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitNot(this); }
}
