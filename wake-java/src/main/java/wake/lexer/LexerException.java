package wake.lexer;

import wake.diag.CompileException;

public class LexerException extends CompileException {
    public LexerException(String message, int line, String sourceFile) {
        super(message + at(line, sourceFile), line, sourceFile);
    }
}
