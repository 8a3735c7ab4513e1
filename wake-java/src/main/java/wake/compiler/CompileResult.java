package wake.compiler;

import wake.diag.Diagnostic;

import java.util.List;
import java.util.Optional;

public record CompileResult(
        String output,           // null on failure
        String error,            // null on success
        List<Diagnostic> warnings
) {
    public CompileResult {
        if ((output == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of output and error must be set");
        }
        warnings = List.copyOf(warnings);
    }

    public static CompileResult success(String output, List<Diagnostic> warnings) {
        return new CompileResult(output, null, warnings);
    }

    public static CompileResult failure(String error, List<Diagnostic> warnings) {
        return new CompileResult(null, error, warnings);
    }

    public boolean isSuccess() { return output != null; }

    public Optional<String> outputIfSuccess() { return Optional.ofNullable(output); }
}
