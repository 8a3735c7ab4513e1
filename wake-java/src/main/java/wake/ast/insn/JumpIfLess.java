package wake.ast.insn;

public record JumpIfLess(String trueLabel, String falseLabel) implements ConditionalJump {
    @Override public Opcode opcode() { return Opcode.JL; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJumpIfLess(this); }
}
