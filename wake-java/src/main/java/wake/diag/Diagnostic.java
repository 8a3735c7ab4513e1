package wake.diag;

// non-fatal, collected and returned
public record Diagnostic(String sourceFile, int line, String message) {

    @Override
    public String toString() {
        String where = sourceFile == null || sourceFile.isEmpty() ? "<input>" : sourceFile;
        return where + ":" + line + ": warning: " + message;
    }
}
