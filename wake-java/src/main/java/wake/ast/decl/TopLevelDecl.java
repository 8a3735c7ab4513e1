package wake.ast.decl;

public sealed interface TopLevelDecl permits FunctionDecl, VerbatimIncludeDecl {}
