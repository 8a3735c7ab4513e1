package wake.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wake.ast.Program;
import wake.codegen.CodeGenerator;
import wake.diag.CompileException;
import wake.diag.Diagnostic;
import wake.include.IncludeResolver;
import wake.lexer.Lexer;
import wake.lexer.Token;
import wake.parser.Parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class WakeCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(WakeCompiler.class);

    private final List<Path> searchPaths;

    public WakeCompiler() {
        this(List.of());
    }

    // searchPaths are tried after the input file's own directory
    public WakeCompiler(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    public CompileResult compile(Path input) {
        Path file = input.toAbsolutePath().normalize();
        List<Diagnostic> warnings = new ArrayList<>();
        try {
            IncludeResolver resolver = new IncludeResolver(file.getParent());
            searchPaths.forEach(resolver::addSearchPath);

            IncludeResolver.Result resolved = resolver.process(file);
            warnings.addAll(resolved.warnings());
            LOG.debug("Include resolution: {} tokens", resolved.tokens().size());

            return CompileResult.success(parseAndGenerate(resolved.tokens(), warnings), warnings);
        } catch (CompileException e) {
            LOG.debug("Compilation of {} failed: {}", file, e.getMessage());
            return CompileResult.failure(e.getMessage(), warnings);
        } catch (IOException e) {
            LOG.debug("Could not read {}", file, e);
            return CompileResult.failure("File error: " + e.getMessage(), warnings);
        }
    }

    // no include expansion: #include is dropped, #M_include passes through
    public CompileResult compileSource(String source, String sourceFile) {
        List<Diagnostic> warnings = new ArrayList<>();
        try {
            List<Token> tokens = new Lexer(source, sourceFile).tokenize();
            return CompileResult.success(parseAndGenerate(tokens, warnings), warnings);
        } catch (CompileException e) {
            LOG.debug("Compilation failed: {}", e.getMessage());
            return CompileResult.failure(e.getMessage(), warnings);
        }
    }

    private String parseAndGenerate(List<Token> tokens, List<Diagnostic> warnings) {
        Parser parser = new Parser(tokens);
        Program program;
        try {
            program = parser.parseProgram();
        } finally {
            warnings.addAll(parser.warnings());
        }
        LOG.debug("Parser: {} declarations, {} functions",
                program.declarations().size(), program.functions().size());

        return new CodeGenerator().generate(program);
    }
}
