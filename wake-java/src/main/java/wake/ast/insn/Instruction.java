package wake.ast.insn;

public sealed interface Instruction
        permits Move, DefineBytes, Call, Halt, Return,
        BinaryInstruction, UnaryInstruction, ConditionalJump,
        Jump, Output, OutputChar {

    Opcode opcode();

    <R> R accept(InstructionVisitor<R> visitor);
}
