package wake.diag;

public abstract class CompileException extends RuntimeException {
    private final int line;
    private final String sourceFile;

    protected CompileException(String message, int line, String sourceFile) {
        super(message);
        this.line = line;
        this.sourceFile = sourceFile == null ? "" : sourceFile;
    }

    public int line() { return line; }

    public String sourceFile() { return sourceFile; }

    protected static String at(int line, String sourceFile) {
        if (sourceFile == null || sourceFile.isEmpty()) return " at line " + line;
        return " at line " + line + " in " + sourceFile;
    }
}
