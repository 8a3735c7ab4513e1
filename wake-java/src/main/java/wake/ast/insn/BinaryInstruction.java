package wake.ast.insn;

import java.util.List;

// op(dest, src); an optional third operand is kept as a second source
public sealed interface BinaryInstruction extends Instruction
        permits Add, Subtract, Multiply, Divide, Compare,
        And, Or, Xor, ShiftLeft, ShiftRight {

    String dest();

    List<String> sources();

    static List<String> checkSources(List<String> sources) {
        if (sources.isEmpty()) throw new IllegalArgumentException("binary instruction needs a source operand");
        return List.copyOf(sources);
    }
}
