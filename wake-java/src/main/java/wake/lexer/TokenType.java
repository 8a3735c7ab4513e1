package wake.lexer;

public enum TokenType {

    // directives
    MACRO_INCLUDE,   // #M_include, passed through to the assembler
    INCLUDE,         // #include, inlined before parsing

    // keywords
    VOID,

    // literals
    IDENTIFIER,
    NUMBER_LITERAL,
    STRING_LITERAL,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    COMMA, SEMICOLON,

    EOF
}
