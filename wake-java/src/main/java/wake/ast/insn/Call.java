package wake.ast.insn;

public record Call(String target) implements Instruction {
    @Override public Opcode opcode() { return Opcode.CALL; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitCall(this); }
}
