package wake.ast.insn;

public record JumpIfGreater(String trueLabel, String falseLabel) implements ConditionalJump {
    @Override public Opcode opcode() { return Opcode.JG; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJumpIfGreater(this); }
}
