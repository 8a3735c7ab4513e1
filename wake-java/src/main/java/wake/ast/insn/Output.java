package wake.ast.insn;

public record Output(String port, String value) implements Instruction {
    @Override public Opcode opcode() { return Opcode.OUT; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitOutput(this); }
}
