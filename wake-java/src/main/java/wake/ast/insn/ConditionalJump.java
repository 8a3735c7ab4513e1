package wake.ast.insn;

public sealed interface ConditionalJump extends Instruction
        permits JumpIfEqual, JumpIfNotEqual, JumpIfLess, JumpIfGreater {

    String trueLabel();

    String falseLabel();
}
