package wake.ast.insn;

public record Exit(String operand) implements UnaryInstruction {
    @Override public Opcode opcode() { return Opcode.EXIT; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitExit(this); }
}
