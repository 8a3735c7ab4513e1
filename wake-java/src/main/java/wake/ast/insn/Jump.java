package wake.ast.insn;

public record Jump(String target) implements Instruction {
    @Override public Opcode opcode() { return Opcode.JMP; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJump(this); }
}
