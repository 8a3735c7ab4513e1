package wake.ast.insn;

public record JumpIfNotEqual(String trueLabel, String falseLabel) implements ConditionalJump {
    @Override public Opcode opcode() { return Opcode.JNE; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJumpIfNotEqual(this); }
}
