package wake.ast.insn;

public record Increment(String operand) implements UnaryInstruction {
    @Override public Opcode opcode() { return Opcode.INC; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitIncrement(this); }
}
