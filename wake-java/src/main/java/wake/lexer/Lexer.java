package wake.lexer;

import java.util.*;

public class Lexer {

    private static final String MACRO_INCLUDE = "#M_include";
    private static final String INCLUDE = "#include";

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("void", TokenType.VOID)
    );

    private final String source;
    private final String sourceFile;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;

    public Lexer(String source) {
        this(source, "");
    }

    public Lexer(String source, String sourceFile) {
        this.source = source;
        this.sourceFile = sourceFile == null ? "" : sourceFile;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int startLine = line;
            char c = advance();

            switch (c) {
                case '(' -> add(TokenType.LPAREN, "(", startLine);
                case ')' -> add(TokenType.RPAREN, ")", startLine);
                case '{' -> add(TokenType.LBRACE, "{", startLine);
                case '}' -> add(TokenType.RBRACE, "}", startLine);
                case ',' -> add(TokenType.COMMA, ",", startLine);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine);

                case '/' -> {
                    if (match('/')) skipComment();
                    else error("Unexpected character '/'");
                }

                case '#' -> directive(startLine);
                case '"' -> stringLiteral(startLine);
                case '$' -> address(startLine);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine);
                    else if (isAlpha(c)) identifier(c, startLine);
                    else error("Unexpected character '" + c + "'");
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, sourceFile));
        return tokens;
    }

    // ================= helpers =================

    // '#' is already consumed; longer directive first
    private void directive(int line) {
        int start = pos - 1;
        if (source.startsWith(MACRO_INCLUDE, start)) {
            pos = start + MACRO_INCLUDE.length();
            add(TokenType.MACRO_INCLUDE, MACRO_INCLUDE, line);
        } else if (source.startsWith(INCLUDE, start)) {
            pos = start + INCLUDE.length();
            add(TokenType.INCLUDE, INCLUDE, line);
        }
        // stray '#': dropped
    }

    private void numberLiteral(char first, int line) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        add(TokenType.NUMBER_LITERAL, sb.toString(), line);
    }

    private void identifier(char first, int line) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line);
    }

    private void stringLiteral(int startLine) {
        StringBuilder sb = new StringBuilder();
        sb.append('"');

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') line++;
            sb.append(c);
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                if (escaped == '\n') line++;
                sb.append(escaped);
            }
        }

        if (isAtEnd()) throw new LexerException("Unterminated string", startLine, sourceFile);

        sb.append(advance()); // closing "
        add(TokenType.STRING_LITERAL, sb.toString(), startLine);
    }

    // $<digits> is an address literal, a bare $ stands alone
    private void address(int line) {
        StringBuilder sb = new StringBuilder("$");
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        add(TokenType.IDENTIFIER, sb.toString(), line);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                advance();
                line++;
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        return source.charAt(pos++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line) {
        tokens.add(new Token(type, lexeme, line, sourceFile));
    }

    private void error(String message) {
        throw new LexerException(message, line, sourceFile);
    }
}
