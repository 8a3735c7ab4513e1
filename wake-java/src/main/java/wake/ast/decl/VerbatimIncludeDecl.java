package wake.ast.decl;

// #M_include "path" kept for the assembler; path keeps its quotes
public record VerbatimIncludeDecl(
        String directive,
        String path
) implements TopLevelDecl {}
