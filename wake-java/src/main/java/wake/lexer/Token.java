package wake.lexer;

public record Token(TokenType type, String lexeme, int line, String sourceFile) {  // string lexemes keep quotes

    public Token {
        if (sourceFile == null) sourceFile = "";
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line;
    }
}
