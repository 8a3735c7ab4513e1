package wake.codegen;

import wake.ast.Program;
import wake.ast.decl.FunctionDecl;
import wake.ast.decl.TopLevelDecl;
import wake.ast.decl.VerbatimIncludeDecl;
import wake.ast.insn.*;

import java.util.ArrayList;
import java.util.List;

public final class CodeGenerator {
    public static final String INDENT = "    ";

    private final LineFormatter formatter = new LineFormatter();

    public String generate(Program program) {
        List<String> out = new ArrayList<>();

        for (TopLevelDecl decl : program.declarations()) {
            if (decl instanceof VerbatimIncludeDecl inc) {
                out.add("#include " + inc.path());
            } else if (decl instanceof FunctionDecl fn) {
                generateFunction(fn, out);
            }
        }
        return String.join("\n", out);
    }

    private void generateFunction(FunctionDecl fn, List<String> out) {
        out.add("LBL " + fn.name());
        for (Instruction insn : fn.body()) {
            out.add(line(insn));
        }
        out.add("");
    }

    public String line(Instruction insn) {
        String text = insn.accept(formatter);
        return isFlush(insn) ? text : INDENT + text;
    }

    // HLT and RET stay flush left
    private static boolean isFlush(Instruction insn) {
        return insn instanceof Halt || insn instanceof Return;
    }

    private static final class LineFormatter implements InstructionVisitor<String> {

        @Override public String visitMove(Move i) { return "MOV " + i.dest() + " " + i.src(); }
        @Override public String visitDefineBytes(DefineBytes i) { return "DB $" + i.address() + " " + i.text(); }
        @Override public String visitCall(Call i) { return "CALL #" + i.target(); }
        @Override public String visitHalt(Halt i) { return i.opcode().mnemonic(); }
        @Override public String visitReturn(Return i) { return i.opcode().mnemonic(); }

        @Override public String visitAdd(Add i) { return binary(i); }
        @Override public String visitSubtract(Subtract i) { return binary(i); }
        @Override public String visitMultiply(Multiply i) { return binary(i); }
        @Override public String visitDivide(Divide i) { return binary(i); }
        @Override public String visitIncrement(Increment i) { return unary(i); }

        @Override public String visitJump(Jump i) { return "JMP #" + i.target(); }
        @Override public String visitCompare(Compare i) { return binary(i); }
        @Override public String visitJumpIfEqual(JumpIfEqual i) { return conditional(i); }
        @Override public String visitJumpIfNotEqual(JumpIfNotEqual i) { return conditional(i); }
        @Override public String visitJumpIfLess(JumpIfLess i) { return conditional(i); }
        @Override public String visitJumpIfGreater(JumpIfGreater i) { return conditional(i); }

        @Override public String visitPush(Push i) { return unary(i); }
        @Override public String visitPop(Pop i) { return unary(i); }
        @Override public String visitOutput(Output i) { return "OUT " + i.port() + " " + i.value(); }
        @Override public String visitOutputChar(OutputChar i) { return "COUT " + i.port() + " " + i.value(); }
        @Override public String visitExit(Exit i) { return unary(i); }

        @Override public String visitAnd(And i) { return binary(i); }
        @Override public String visitOr(Or i) { return binary(i); }
        @Override public String visitXor(Xor i) { return binary(i); }
        @Override public String visitNot(Not i) { return unary(i); }
        @Override public String visitShiftLeft(ShiftLeft i) { return binary(i); }
        @Override public String visitShiftRight(ShiftRight i) { return binary(i); }

        private static String binary(BinaryInstruction i) {
            return i.opcode().mnemonic() + " " + i.dest() + " " + String.join(" ", i.sources());
        }

        private static String unary(UnaryInstruction i) {
            return i.opcode().mnemonic() + " " + i.operand();
        }

        private static String conditional(ConditionalJump i) {
            return i.opcode().mnemonic() + " #" + i.trueLabel() + " #" + i.falseLabel();
        }
    }
}
