package wake.parser;

import wake.diag.CompileException;
import wake.lexer.Token;
import wake.lexer.TokenType;

public class ParseException extends CompileException {

    public ParseException(String message, int line, String sourceFile) {
        super(message + at(line, sourceFile), line, sourceFile);
    }

    // adds the found token and, when the file is readable, the source line
    public static ParseException of(Token token, String message) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(at(token.line(), token.sourceFile()));
        if (token.type() == TokenType.EOF) sb.append(" (got end of input)");
        else sb.append(" (got ").append(token.type()).append(" '").append(token.lexeme()).append("')");

        String excerpt = SourceExcerpt.of(token.sourceFile(), token.line());
        if (!excerpt.isEmpty()) sb.append('\n').append(excerpt);
        return new ParseException(sb.toString(), token);
    }

    private ParseException(String fullMessage, Token token) {
        super(fullMessage, token.line(), token.sourceFile());
    }
}
