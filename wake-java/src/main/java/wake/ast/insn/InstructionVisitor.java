package wake.ast.insn;

public interface InstructionVisitor<R> {
    R visitMove(Move insn);
    R visitDefineBytes(DefineBytes insn);
    R visitCall(Call insn);
    R visitHalt(Halt insn);
    R visitReturn(Return insn);

    R visitAdd(Add insn);
    R visitSubtract(Subtract insn);
    R visitMultiply(Multiply insn);
    R visitDivide(Divide insn);
    R visitIncrement(Increment insn);

    R visitJump(Jump insn);
    R visitCompare(Compare insn);
    R visitJumpIfEqual(JumpIfEqual insn);
    R visitJumpIfNotEqual(JumpIfNotEqual insn);
    R visitJumpIfLess(JumpIfLess insn);
    R visitJumpIfGreater(JumpIfGreater insn);

    R visitPush(Push insn);
    R visitPop(Pop insn);
    R visitOutput(Output insn);
    R visitOutputChar(OutputChar insn);
    R visitExit(Exit insn);

    R visitAnd(And insn);
    R visitOr(Or insn);
    R visitXor(Xor insn);
    R visitNot(Not insn);
    R visitShiftLeft(ShiftLeft insn);
    R visitShiftRight(ShiftRight insn);
}
