package wake.ast;

import wake.ast.decl.FunctionDecl;
import wake.ast.decl.TopLevelDecl;

import java.util.List;

public record Program(
        List<TopLevelDecl> declarations
) {
    public Program {
        declarations = List.copyOf(declarations);
    }

    public List<FunctionDecl> functions() {
        return declarations.stream()
                .filter(FunctionDecl.class::isInstance)
                .map(FunctionDecl.class::cast)
                .toList();
    }
}
