package wake.ast.insn;

public sealed interface UnaryInstruction extends Instruction
        permits Increment, Push, Pop, Not, Exit {

    String operand();
}
