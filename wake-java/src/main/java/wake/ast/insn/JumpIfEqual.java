package wake.ast.insn;

public record JumpIfEqual(String trueLabel, String falseLabel) implements ConditionalJump {
    @Override public Opcode opcode() { return Opcode.JE; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJumpIfEqual(this); }
}
