package wake.include;

import wake.diag.CompileException;

public class IncludeException extends CompileException {
    private final String includePath;

    public IncludeException(String includePath, String includingFile) {
        super("Could not find include file '" + includePath + "'"
                        + (includingFile == null || includingFile.isEmpty() ? "" : " included from " + includingFile),
                0, includingFile);
        this.includePath = includePath;
    }

    public String includePath() { return includePath; }
}
