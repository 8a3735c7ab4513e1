package wake.ast.insn;

public record OutputChar(String port, String value) implements Instruction {
    @Override public Opcode opcode() { return Opcode.COUT; }
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitOutputChar(this); }
}
