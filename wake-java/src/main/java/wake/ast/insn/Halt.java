package wake.ast.insn;

public record Halt() implements Instruction {
    @Override public Opcode opcode() { return Opcode.HLT; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitHalt(this); }
}
