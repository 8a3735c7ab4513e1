package wake.ast.decl;

import wake.ast.insn.Instruction;

import java.util.List;

public record FunctionDecl(
        String name,
        List<Instruction> body
) implements TopLevelDecl {
    public FunctionDecl {
        body = List.copyOf(body);
    }
}
